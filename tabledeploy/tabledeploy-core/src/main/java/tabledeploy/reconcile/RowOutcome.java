package tabledeploy.reconcile;

import tabledeploy.model.PrimaryKey;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The final result of reconciling one desired row: updated in place, created, or failed with a cause.
 */
public record RowOutcome(PrimaryKey primaryKey, Kind kind, Phase phase, Optional<String> cause) {
  public static final String RETRIES_EXHAUSTED = "concurrency conflict, retries exhausted";
  public static final String CANCELLED = "reconciliation cancelled before the row was submitted";

  public enum Kind {
    UPDATED,
    CREATED,
    FAILED
  }

  public RowOutcome {
    checkNotNull(primaryKey, "primaryKey");
    checkArgument(cause.isPresent() == (kind == Kind.FAILED), "exactly the FAILED outcomes carry a cause");
  }

  public static RowOutcome updated(PrimaryKey primaryKey) {
    return new RowOutcome(primaryKey, Kind.UPDATED, Phase.UPDATE, Optional.empty());
  }

  public static RowOutcome created(PrimaryKey primaryKey) {
    return new RowOutcome(primaryKey, Kind.CREATED, Phase.CREATE, Optional.empty());
  }

  public static RowOutcome failed(PrimaryKey primaryKey, Phase phase, String cause) {
    return new RowOutcome(primaryKey, Kind.FAILED, phase, Optional.of(cause));
  }

  public boolean isFailed() {
    return kind == Kind.FAILED;
  }

  @Override
  public String toString() {
    return cause.map(c -> String.format("%s [%s] in %s: %s", kind, primaryKey, phase, c))
            .orElseGet(() -> String.format("%s [%s]", kind, primaryKey));
  }
}
