package tabledeploy.reconcile;

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tabledeploy.model.LockLevel;
import tabledeploy.model.LockScope;
import tabledeploy.model.LockVersion;
import tabledeploy.model.TableHandle;
import tabledeploy.remote.LockTokenFetchApi;
import tabledeploy.remote.RemoteServiceException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Remembers the lock versions fetched during one reconciliation run, so that consecutive writes to the same scope
 * don't fetch the same version twice. A cached version is replaced only by fetching a new one after
 * {@link #invalidate}; nothing here ever edits a version.
 * <p/>
 * Instances are scoped to a single run, and are discarded with it.
 */
public class LockVersionCache {
  private static final Logger LOG = LoggerFactory.getLogger(LockVersionCache.class);

  private final LockTokenFetchApi fetchApi;
  private final Cache<ScopeKey, LockVersion> versions = CacheBuilder.newBuilder().build();

  public LockVersionCache(LockTokenFetchApi fetchApi) {
    this.fetchApi = fetchApi;
  }

  /**
   * @return the lock version for {@code scope}, fetching it if it isn't cached; always {@link LockVersion#none()}
   * for tables locked at {@link LockLevel#NONE}, without a fetch
   * @throws RemoteServiceException if the fetch failed
   */
  public LockVersion get(TableHandle table, LockScope scope) {
    if (!table.lockLevel().requiresLockVersion()) return LockVersion.none();

    ScopeKey key = ScopeKey.of(table, scope);
    try {
      return versions.get(key, () -> {
        LockVersion version = checkNotNull(fetchApi.fetchToken(table, key.scope()), "fetched lock version");
        LOG.debug("Fetched {} for {} of table '{}'", version, key.scope(), table.name());
        return version;
      });
    } catch (ExecutionException | UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new RemoteServiceException("Failed to fetch lock version for " + scope, e.getCause());
    }
  }

  public Map<LockScope, LockVersion> getAll(TableHandle table, Collection<LockScope> scopes) {
    Map<LockScope, LockVersion> result = new LinkedHashMap<>();
    for (LockScope scope : scopes) {
      result.put(scope, get(table, scope));
    }
    return result;
  }

  /**
   * Forgets the cached version for {@code scope}, so the next {@link #get} fetches a fresh one.
   */
  public void invalidate(TableHandle table, LockScope scope) {
    if (table.lockLevel().requiresLockVersion()) versions.invalidate(ScopeKey.of(table, scope));
  }

  public void invalidateAll(TableHandle table, Collection<LockScope> scopes) {
    scopes.forEach(scope -> invalidate(table, scope));
  }

  record ScopeKey(String tableId, LockScope scope) {
    static ScopeKey of(TableHandle table, LockScope scope) {
      // one version guards the whole table at DATA_TABLE level, whatever row or attribute is written
      LockScope normalized = table.lockLevel() == LockLevel.DATA_TABLE ? LockScope.table() : scope;
      checkArgument(
              normalized.level() == table.lockLevel(),
              "Scope %s does not match lock level %s of table '%s'", scope, table.lockLevel(), table.name()
      );
      return new ScopeKey(table.id(), normalized);
    }
  }
}
