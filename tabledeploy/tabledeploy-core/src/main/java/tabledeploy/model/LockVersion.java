package tabledeploy.model;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An opaque optimistic-concurrency token, as last reported by the data-table service. {@link #none()} stands for
 * "no version": used when the table's lock level is {@link LockLevel#NONE}, or when the locked resource does not
 * exist yet.
 */
public final class LockVersion {
  private static final LockVersion NONE = new LockVersion(null);

  private final String token;

  private LockVersion(String token) {
    this.token = token;
  }

  public static LockVersion of(String token) {
    checkArgument(token != null && !token.isEmpty(), "token must be non-empty");
    return new LockVersion(token);
  }

  public static LockVersion none() {
    return NONE;
  }

  public static LockVersion ofNullable(String token) {
    return token == null || token.isEmpty() ? NONE : of(token);
  }

  public Optional<String> token() {
    return Optional.ofNullable(token);
  }

  public boolean isPresent() {
    return token != null;
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj || (obj instanceof LockVersion other && Objects.equals(token, other.token));
  }

  @Override
  public int hashCode() {
    return token == null ? 0 : token.hashCode();
  }

  @Override
  public String toString() {
    return token == null ? "LockVersion(none)" : "LockVersion(" + token + ")";
  }
}
