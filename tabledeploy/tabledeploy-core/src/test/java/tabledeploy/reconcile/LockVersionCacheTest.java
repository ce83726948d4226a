package tabledeploy.reconcile;

import org.junit.jupiter.api.Test;
import tabledeploy.model.AttributeValue;
import tabledeploy.model.LockLevel;
import tabledeploy.model.LockScope;
import tabledeploy.model.LockVersion;
import tabledeploy.model.PrimaryKey;
import tabledeploy.model.TableHandle;
import tabledeploy.remote.RemoteServiceException;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LockVersionCacheTest {
  private static final PrimaryKey KEY = PrimaryKey.of("Id", AttributeValue.text("a"));

  private final List<LockScope> fetched = new ArrayList<>();
  private final LockVersionCache cache = new LockVersionCache((table, scope) -> {
    fetched.add(scope);
    return LockVersion.of("v" + fetched.size());
  });

  @Test
  void unlockedTablesNeverFetch() {
    TableHandle table = TableHandle.of("t1", "Unlocked", LockLevel.NONE);

    assertThat(cache.get(table, LockScope.table())).isEqualTo(LockVersion.none());
    assertThat(fetched).isEmpty();
  }

  @Test
  void fetchesOncePerScopeUntilInvalidated() {
    TableHandle table = TableHandle.of("t1", "Values", LockLevel.VALUE);
    LockScope scope = LockScope.value(KEY, "Name");

    assertThat(cache.get(table, scope)).isEqualTo(LockVersion.of("v1"));
    assertThat(cache.get(table, scope)).isEqualTo(LockVersion.of("v1"));
    assertThat(fetched).hasSize(1);

    cache.invalidate(table, scope);
    assertThat(cache.get(table, scope)).isEqualTo(LockVersion.of("v2"));
    assertThat(cache.get(table, LockScope.value(KEY, "Other"))).isEqualTo(LockVersion.of("v3"));
  }

  @Test
  void tableLevelSharesOneVersion() {
    TableHandle table = TableHandle.of("t1", "Whole", LockLevel.DATA_TABLE);

    cache.get(table, LockScope.table());
    cache.get(table, LockScope.table());

    assertThat(fetched).containsExactly(LockScope.table());
  }

  @Test
  void tablesAreCachedSeparately() {
    LockScope scope = LockScope.row(KEY);

    cache.get(TableHandle.of("t1", "One", LockLevel.PRIMARY_VALUE), scope);
    cache.get(TableHandle.of("t2", "Two", LockLevel.PRIMARY_VALUE), scope);

    assertThat(fetched).hasSize(2);
  }

  @Test
  void rejectsScopesOfTheWrongLevel() {
    TableHandle table = TableHandle.of("t1", "Rows", LockLevel.PRIMARY_VALUE);

    assertThrows(IllegalArgumentException.class, () -> cache.get(table, LockScope.attribute("Name")));
  }

  @Test
  void fetchFailuresPropagateUnwrapped() {
    LockVersionCache failing = new LockVersionCache((table, scope) -> {
      throw new RemoteServiceException("AccessDeniedException");
    });
    TableHandle table = TableHandle.of("t1", "Rows", LockLevel.PRIMARY_VALUE);

    RemoteServiceException e = assertThrows(RemoteServiceException.class, () -> failing.get(table, LockScope.row(KEY)));
    assertThat(e).hasMessageThat().isEqualTo("AccessDeniedException");
  }
}
