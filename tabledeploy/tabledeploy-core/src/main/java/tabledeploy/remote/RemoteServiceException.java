package tabledeploy.remote;

/**
 * A failure of a remote call as a whole (as opposed to a row-level {@link RowResult}).
 */
public class RemoteServiceException extends RuntimeException {
  public RemoteServiceException(String message) {
    super(message);
  }

  public RemoteServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
