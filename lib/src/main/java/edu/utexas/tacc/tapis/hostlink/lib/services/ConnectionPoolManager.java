package edu.utexas.tacc.tapis.hostlink.lib.services;

import java.nio.file.Path;
import java.util.List;
import javax.inject.Inject;

import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.dao.registry.ConnectionRegistry;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.InvalidTargetFormatException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.RegistryIOException;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ISshControlClient;
import edu.utexas.tacc.tapis.hostlink.lib.models.RegistryEntry;
import edu.utexas.tacc.tapis.hostlink.lib.utils.KeyDeriver;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;
import edu.utexas.tacc.tapis.hostlink.lib.utils.TargetParser;
import edu.utexas.tacc.tapis.hostlink.lib.workers.StaleConnectionSweeper;

/*
 * Hard cap on the number of tracked connections.
 * Evicted connections are shut down and their sockets removed. When anything was evicted a background sweep
 *   then clears whatever else is dead. Nothing is swept while the pool is under its cap.
 */
@Service
public class ConnectionPoolManager
{
  private static final Logger log = LoggerFactory.getLogger(ConnectionPoolManager.class);

  private final ConnectionRegistry registry;
  private final ControlSocketStore socketStore;
  private final ISshControlClient sshClient;
  private final StaleConnectionSweeper sweeper;
  private final int defaultMaxConnections;

  @Inject
  public ConnectionPoolManager(ConnectionRegistry registry, ControlSocketStore socketStore,
                               ISshControlClient sshClient, StaleConnectionSweeper sweeper, IRuntimeConfig config)
  {
    this.registry = registry;
    this.socketStore = socketStore;
    this.sshClient = sshClient;
    this.sweeper = sweeper;
    this.defaultMaxConnections = config.getMaxConnections();
  }

  public List<RegistryEntry> enforceCapacity() throws RegistryIOException
  {
    return enforceCapacity(defaultMaxConnections, null);
  }

  public List<RegistryEntry> enforceCapacity(int maxConnections) throws RegistryIOException
  {
    return enforceCapacity(maxConnections, null);
  }

  /**
   * Evict the oldest registered connections until at most maxConnections remain.
   * @param maxConnections cap on registry rows
   * @param keepTarget target that must survive, typically the one just established. May be null.
   * @return rows evicted, oldest first
   * @throws RegistryIOException on error
   */
  public List<RegistryEntry> enforceCapacity(int maxConnections, String keepTarget) throws RegistryIOException
  {
    String keepId = keepTarget == null ? null : KeyDeriver.deriveId(keepTarget);
    List<RegistryEntry> evicted = registry.evictOldest(maxConnections, keepId);
    if (evicted.isEmpty()) return evicted;

    for (RegistryEntry row : evicted)
    {
      log.info(LibUtils.getMsg("HOSTLINK_POOL_EVICT", row.getTarget(), maxConnections));
      Path socket = socketStore.socketPathForId(row.getConnectionId());
      if (!socketStore.exists(socket)) continue;
      try
      {
        sshClient.exit(TargetParser.parse(row.getTarget()), socket);
      }
      catch (InvalidTargetFormatException e)
      {
        log.debug(e.getMessage());
      }
      socketStore.delete(socket);
    }
    sweeper.sweepAsync();
    return evicted;
  }

  /**
   * Apply the configured cap while keeping the given target.
   */
  public List<RegistryEntry> enforceCapacityKeeping(String keepTarget) throws RegistryIOException
  {
    return enforceCapacity(defaultMaxConnections, keepTarget);
  }
}
