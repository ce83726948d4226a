package tabledeploy.model;

import org.immutables.value.Value;

/**
 * A provisioned table as the reconciliation engine sees it: the service-assigned id, its name, and the lock level
 * it enforces.
 */
@Value.Immutable
public interface TableHandle {
  static ImmutableTableHandle.Builder builder() {
    return ImmutableTableHandle.builder();
  }

  static TableHandle of(String id, String name, LockLevel lockLevel) {
    return builder().id(id).name(name).lockLevel(lockLevel).build();
  }

  String id();

  String name();

  LockLevel lockLevel();
}
