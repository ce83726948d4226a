package tabledeploy.remote;

/**
 * The service could not be reached, or did not answer in time.
 */
public class TransportException extends RemoteServiceException {
  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
