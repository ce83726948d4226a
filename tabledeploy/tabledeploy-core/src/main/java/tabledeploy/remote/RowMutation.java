package tabledeploy.remote;

import org.immutables.value.Value;
import tabledeploy.model.DesiredRow;
import tabledeploy.model.LockScope;
import tabledeploy.model.LockVersion;
import tabledeploy.model.PrimaryKey;

import java.util.Map;

/**
 * A row to write, together with the lock versions of every scope the write touches. Empty lock versions for tables
 * whose lock level is {@link tabledeploy.model.LockLevel#NONE NONE}.
 */
@Value.Immutable
public interface RowMutation {
  static RowMutation of(DesiredRow row, Map<LockScope, LockVersion> lockVersions) {
    return ImmutableRowMutation.builder().row(row).lockVersions(lockVersions).build();
  }

  DesiredRow row();

  Map<LockScope, LockVersion> lockVersions();

  default PrimaryKey primaryKey() {
    return row().primaryKey();
  }

  default LockVersion lockVersion(LockScope scope) {
    return lockVersions().getOrDefault(scope, LockVersion.none());
  }
}
