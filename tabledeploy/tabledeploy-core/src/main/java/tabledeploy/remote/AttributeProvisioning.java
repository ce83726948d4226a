package tabledeploy.remote;

import java.util.Optional;

public record AttributeProvisioning(String attributeName, Status status, Optional<String> error) {
  public enum Status {
    CREATED,
    SKIPPED,
    FAILED
  }

  public static AttributeProvisioning created(String attributeName) {
    return new AttributeProvisioning(attributeName, Status.CREATED, Optional.empty());
  }

  public static AttributeProvisioning skipped(String attributeName) {
    return new AttributeProvisioning(attributeName, Status.SKIPPED, Optional.empty());
  }

  public static AttributeProvisioning failed(String attributeName, String error) {
    return new AttributeProvisioning(attributeName, Status.FAILED, Optional.of(error));
  }
}
