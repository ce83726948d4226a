package tabledeploy.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import tabledeploy.model.ConfigurationException;

/**
 * Reports invalid configuration as a one-line error with exit code 2, instead of a stack trace.
 */
class ConfigurationErrorHandler implements CommandLine.IExecutionExceptionHandler {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationErrorHandler.class);
  static final int CONFIGURATION_ERROR = 2;

  @Override
  public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) throws Exception {
    if (!(ex instanceof ConfigurationException)) throw ex;
    LOG.debug("Configuration error", ex);
    commandLine.getErr().println("[FAIL] Configuration error: " + ex.getMessage());
    commandLine.getErr().flush();
    return CONFIGURATION_ERROR;
  }
}
