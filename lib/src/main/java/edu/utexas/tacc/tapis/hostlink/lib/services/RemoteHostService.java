package edu.utexas.tacc.tapis.hostlink.lib.services;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.caches.DeviceTypeCache;
import edu.utexas.tacc.tapis.hostlink.lib.caches.LastTargetTracker;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.CacheWriteFailedException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionNotFoundException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionTimeoutException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionUnhealthyException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.InvalidTargetFormatException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.RegistryIOException;
import edu.utexas.tacc.tapis.hostlink.lib.models.CacheListing;
import edu.utexas.tacc.tapis.hostlink.lib.models.CacheStatsReport;
import edu.utexas.tacc.tapis.hostlink.lib.models.CloseOutcome;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConfiguredHost;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConnectOutcome;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConnectionDetail;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConnectionStatus;
import edu.utexas.tacc.tapis.hostlink.lib.models.RemoteCommandResult;
import edu.utexas.tacc.tapis.hostlink.lib.models.SweepResult;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;
import edu.utexas.tacc.tapis.hostlink.lib.workers.BackgroundTaskRunner;
import edu.utexas.tacc.tapis.hostlink.lib.workers.StaleConnectionSweeper;

/**
 * Entry point for callers that need remote host sessions.
 *
 * Targets passed in are trimmed. Where an operation accepts a missing target the most recently connected target
 * is used, and ConnectionNotFoundException is thrown when there is none.
 *
 * Annotate as an hk2 Service so that default scope for DI is singleton
 */
@Service
public class RemoteHostService
{
  private static final Logger log = LoggerFactory.getLogger(RemoteHostService.class);

  private final ConnectionLifecycleManager lifecycleManager;
  private final ConnectionPoolManager poolManager;
  private final ConnectionStatusService statusService;
  private final DeviceTypeService deviceTypeService;
  private final DeviceTypeCache deviceTypeCache;
  private final LastTargetTracker lastTargetTracker;
  private final StaleConnectionSweeper sweeper;
  private final BackgroundTaskRunner taskRunner;

  @Inject
  public RemoteHostService(ConnectionLifecycleManager lifecycleManager, ConnectionPoolManager poolManager,
                           ConnectionStatusService statusService, DeviceTypeService deviceTypeService,
                           DeviceTypeCache deviceTypeCache, LastTargetTracker lastTargetTracker,
                           StaleConnectionSweeper sweeper, BackgroundTaskRunner taskRunner)
  {
    this.lifecycleManager = lifecycleManager;
    this.poolManager = poolManager;
    this.statusService = statusService;
    this.deviceTypeService = deviceTypeService;
    this.deviceTypeCache = deviceTypeCache;
    this.lastTargetTracker = lastTargetTracker;
    this.sweeper = sweeper;
    this.taskRunner = taskRunner;
  }

  /**
   * Startup maintenance: a background sweep, the pool cap and cache housekeeping.
   */
  public void initialize()
  {
    sweeper.sweepAsync();
    try
    {
      poolManager.enforceCapacity();
    }
    catch (RegistryIOException e)
    {
      log.warn(LibUtils.getMsg("HOSTLINK_INIT_POOL_ERR", e.getMessage()));
    }
    deviceTypeCache.init();
  }

  public void shutdown()
  {
    taskRunner.shutdown();
  }

  // ************************************************************************
  // **** Connections
  // ************************************************************************

  public ConnectOutcome ensureConnection(String target)
          throws InvalidTargetFormatException, ConnectionTimeoutException, RegistryIOException
  {
    String t = StringUtils.trimToEmpty(target);
    ConnectOutcome outcome = lifecycleManager.establish(t);
    rememberTarget(t);
    return outcome;
  }

  public CloseOutcome closeConnection(String target)
          throws InvalidTargetFormatException, ConnectionNotFoundException, RegistryIOException
  {
    return lifecycleManager.close(resolveTarget(target));
  }

  public ConnectOutcome reconnect(String target)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionTimeoutException,
                 RegistryIOException
  {
    String t = resolveTarget(target);
    ConnectOutcome outcome = lifecycleManager.reconnect(t);
    rememberTarget(t);
    return outcome;
  }

  public RemoteCommandResult runCommand(String target, String command)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionUnhealthyException,
                 IOException, InterruptedException
  {
    return runCommand(target, command, null);
  }

  /**
   * Run a command on the target, or on the last target when none is given.
   * @param timeout null for no limit
   */
  public RemoteCommandResult runCommand(String target, String command, Duration timeout)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionUnhealthyException,
                 IOException, InterruptedException
  {
    return lifecycleManager.execute(resolveTarget(target), command, timeout);
  }

  public Optional<String> getLastTarget()
  {
    return lastTargetTracker.get();
  }

  public List<ConnectionDetail> listConnections() throws RegistryIOException
  {
    return statusService.listDetailed();
  }

  public List<String> listActiveTargets() throws RegistryIOException
  {
    return statusService.listActive();
  }

  public List<ConfiguredHost> listConfiguredHosts()
  {
    return statusService.listConfiguredHosts();
  }

  public ConnectionStatus connectionStatus(String target) throws ConnectionNotFoundException
  {
    return statusService.status(resolveTarget(target));
  }

  /**
   * Synchronous sweep of dead sockets and registry rows followed by removal of expired cache entries.
   */
  public SweepResult cleanup() throws RegistryIOException
  {
    SweepResult result = sweeper.sweep();
    int cacheRemoved = deviceTypeCache.cleanupExpired();
    log.info(LibUtils.getMsg("HOSTLINK_CLEANUP_DONE", result.getSocketsRemoved(), result.getRowsRemoved(),
                             cacheRemoved));
    return result;
  }

  // ************************************************************************
  // **** Device types
  // ************************************************************************

  public Optional<String> getDeviceType(String target) throws ConnectionNotFoundException
  {
    return deviceTypeService.getCached(resolveTarget(target));
  }

  public String setDeviceType(String target, String deviceType)
          throws ConnectionNotFoundException, CacheWriteFailedException
  {
    return deviceTypeService.setManual(resolveTarget(target), deviceType);
  }

  public boolean clearDeviceType(String target) throws ConnectionNotFoundException, CacheWriteFailedException
  {
    return deviceTypeService.clear(resolveTarget(target));
  }

  public Optional<String> detectDeviceType(String target, boolean force)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionUnhealthyException,
                 CacheWriteFailedException, InterruptedException
  {
    return deviceTypeService.detect(resolveTarget(target), force);
  }

  public CacheStatsReport cacheStats()
  {
    return deviceTypeCache.stats();
  }

  public List<CacheListing> cacheListing()
  {
    return deviceTypeCache.listAll();
  }

  /* **************************************************************************** */
  /*                               Private Methods                                */
  /* **************************************************************************** */

  /*
   * Trimmed target, or the last target when the caller gave none.
   */
  private String resolveTarget(String target) throws ConnectionNotFoundException
  {
    if (StringUtils.isNotBlank(target)) return target.trim();
    return lastTargetTracker.get().orElseThrow(
            () -> new ConnectionNotFoundException(LibUtils.getMsg("HOSTLINK_NO_LAST_TARGET")));
  }

  /*
   * A failure to record the last target is logged and does not fail the caller.
   */
  private void rememberTarget(String target)
  {
    try
    {
      lastTargetTracker.set(target);
    }
    catch (CacheWriteFailedException e)
    {
      log.warn(LibUtils.getMsg("HOSTLINK_LAST_TARGET_NOT_SAVED", target, e.getMessage()));
    }
  }
}
