package tabledeploy.model;

/**
 * Thrown for declarations that can never be deployed as written (invalid batch size, malformed primary key,
 * unreadable config). Always fatal: raised before any remote call is made.
 */
public class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  public static ConfigurationException format(String template, Object... args) {
    return new ConfigurationException(String.format(template, args));
  }
}
