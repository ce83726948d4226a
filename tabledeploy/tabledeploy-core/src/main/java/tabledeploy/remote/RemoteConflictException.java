package tabledeploy.remote;

/**
 * The service rejected an entire batch because a supplied lock version was outdated.
 */
public class RemoteConflictException extends RemoteServiceException {
  public RemoteConflictException(String message) {
    super(message);
  }

  public RemoteConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
