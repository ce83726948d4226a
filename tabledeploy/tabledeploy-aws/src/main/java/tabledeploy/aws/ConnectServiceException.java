package tabledeploy.aws;

import tabledeploy.remote.RemoteServiceException;

/**
 * An error response from the Connect API, with the service's error code (e.g. {@code AccessDeniedException}) and
 * HTTP status.
 */
public class ConnectServiceException extends RemoteServiceException {
  private final String errorCode;
  private final int statusCode;

  public ConnectServiceException(String errorCode, int statusCode, String message) {
    super(errorCode + " (HTTP " + statusCode + "): " + message);
    this.errorCode = errorCode;
    this.statusCode = statusCode;
  }

  public String errorCode() {
    return errorCode;
  }

  public int statusCode() {
    return statusCode;
  }

  public boolean isNotFound() {
    return statusCode == 404 || "ResourceNotFoundException".equals(errorCode);
  }
}
