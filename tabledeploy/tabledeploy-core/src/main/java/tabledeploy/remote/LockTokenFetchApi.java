package tabledeploy.remote;

import tabledeploy.model.LockScope;
import tabledeploy.model.LockVersion;
import tabledeploy.model.TableHandle;

@FunctionalInterface
public interface LockTokenFetchApi {
  /**
   * @return the service's current lock version for {@code scope}, or {@link LockVersion#none()} if the locked
   * resource does not exist yet
   */
  LockVersion fetchToken(TableHandle table, LockScope scope);
}
