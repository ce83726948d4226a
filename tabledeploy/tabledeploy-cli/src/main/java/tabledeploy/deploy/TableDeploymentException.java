package tabledeploy.deploy;

/**
 * A table could not be deployed. The pipeline reports it and moves on to the next table.
 */
public class TableDeploymentException extends RuntimeException {
  private final String tableName;

  public TableDeploymentException(String tableName, String message, Throwable cause) {
    super(message, cause);
    this.tableName = tableName;
  }

  public String tableName() {
    return tableName;
  }
}
