package tabledeploy.remote;

import com.google.common.collect.ImmutableSet;
import tabledeploy.model.PrimaryKey;

import java.util.Collection;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The service's verdict on one row of a batch call.
 * <p/>
 * {@link Status#INCOMPLETE} results name the attributes the row has no value for; every other status carries an
 * empty {@link #missingAttributes()}.
 */
public record RowResult(PrimaryKey primaryKey, Status status, String message, Set<String> missingAttributes) {
  public enum Status {
    SUCCESS,
    /** the service rejected the values; retrying cannot help */
    VALIDATION_ERROR,
    /** no row exists with this primary key */
    NOT_FOUND,
    /** the row exists, but holds no value for some of the submitted attributes; the others were written */
    INCOMPLETE,
    /** the supplied lock version was outdated */
    CONFLICT,
    /** the call carrying this row failed as a whole */
    ERROR
  }

  public RowResult {
    checkNotNull(primaryKey, "primaryKey");
    checkNotNull(status, "status");
    if (message == null) message = "";
    missingAttributes = ImmutableSet.copyOf(missingAttributes);
    checkArgument(missingAttributes.isEmpty() != (status == Status.INCOMPLETE),
            "exactly the INCOMPLETE results name missing attributes");
  }

  public RowResult(PrimaryKey primaryKey, Status status, String message) {
    this(primaryKey, status, message, ImmutableSet.of());
  }

  public static RowResult success(PrimaryKey primaryKey) {
    return new RowResult(primaryKey, Status.SUCCESS, "");
  }

  public static RowResult validationError(PrimaryKey primaryKey, String message) {
    return new RowResult(primaryKey, Status.VALIDATION_ERROR, message);
  }

  public static RowResult notFound(PrimaryKey primaryKey, String message) {
    return new RowResult(primaryKey, Status.NOT_FOUND, message);
  }

  public static RowResult incomplete(PrimaryKey primaryKey, Collection<String> missingAttributes) {
    return new RowResult(primaryKey, Status.INCOMPLETE, "no value for " + missingAttributes, ImmutableSet.copyOf(missingAttributes));
  }

  public static RowResult conflict(PrimaryKey primaryKey, String message) {
    return new RowResult(primaryKey, Status.CONFLICT, message);
  }

  public static RowResult error(PrimaryKey primaryKey, String message) {
    return new RowResult(primaryKey, Status.ERROR, message);
  }
}
