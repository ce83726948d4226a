package tabledeploy.model;

import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * The resource a lock version belongs to. Which keys are present depends on the lock level:
 * <ul>
 *   <li>{@link LockLevel#DATA_TABLE}: neither (one version for the whole table)</li>
 *   <li>{@link LockLevel#PRIMARY_VALUE}: the row's primary key</li>
 *   <li>{@link LockLevel#ATTRIBUTE}: the attribute name</li>
 *   <li>{@link LockLevel#VALUE}: both</li>
 * </ul>
 */
@Value.Immutable
public interface LockScope {
  static LockScope table() {
    return ImmutableLockScope.builder().level(LockLevel.DATA_TABLE).build();
  }

  static LockScope row(PrimaryKey primaryKey) {
    return ImmutableLockScope.builder().level(LockLevel.PRIMARY_VALUE).primaryKey(primaryKey).build();
  }

  static LockScope attribute(String attributeName) {
    return ImmutableLockScope.builder().level(LockLevel.ATTRIBUTE).attributeName(attributeName).build();
  }

  static LockScope value(PrimaryKey primaryKey, String attributeName) {
    return ImmutableLockScope.builder()
            .level(LockLevel.VALUE)
            .primaryKey(primaryKey)
            .attributeName(attributeName)
            .build();
  }

  /**
   * @return the scope guarding the value of {@code attributeName} in the row identified by {@code primaryKey}, or
   * empty for {@link LockLevel#NONE}
   */
  static Optional<LockScope> forValue(LockLevel level, PrimaryKey primaryKey, String attributeName) {
    return switch (level) {
      case NONE -> Optional.empty();
      case DATA_TABLE -> Optional.of(table());
      case PRIMARY_VALUE -> Optional.of(row(primaryKey));
      case ATTRIBUTE -> Optional.of(attribute(attributeName));
      case VALUE -> Optional.of(value(primaryKey, attributeName));
    };
  }

  /**
   * @return every distinct scope a write of {@code row} touches at the given lock level
   */
  static List<LockScope> scopesFor(LockLevel level, DesiredRow row) {
    return writtenAttributes(row).stream()
            .map(attributeName -> forValue(level, row.primaryKey(), attributeName))
            .flatMap(Optional::stream)
            .distinct()
            .collect(ImmutableList.toImmutableList());
  }

  /**
   * The attribute names a write of {@code row} carries: its non-key attributes, or its primary attributes when it
   * has none (a key-only row is still written as values).
   */
  static List<String> writtenAttributes(DesiredRow row) {
    List<NamedValue> written = row.attributes().isEmpty() ? row.primaryValues() : row.attributes();
    return written.stream().map(NamedValue::attributeName).collect(ImmutableList.toImmutableList());
  }

  LockLevel level();

  Optional<PrimaryKey> primaryKey();

  Optional<String> attributeName();

  @Value.Check
  default void checkKeys() {
    switch (level()) {
      case NONE -> throw new IllegalStateException("LockLevel.NONE has no lock scopes");
      case DATA_TABLE -> checkState(primaryKey().isEmpty() && attributeName().isEmpty(), "DATA_TABLE scope takes no keys");
      case PRIMARY_VALUE -> checkState(primaryKey().isPresent() && attributeName().isEmpty(), "PRIMARY_VALUE scope takes a primary key only");
      case ATTRIBUTE -> checkState(primaryKey().isEmpty() && attributeName().isPresent(), "ATTRIBUTE scope takes an attribute name only");
      case VALUE -> checkState(primaryKey().isPresent() && attributeName().isPresent(), "VALUE scope takes a primary key and an attribute name");
    }
  }
}
