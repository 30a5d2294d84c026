package edu.utexas.tacc.tapis.hostlink.lib.services;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.inject.Inject;

import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.dao.registry.ConnectionRegistry;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionNotFoundException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionTimeoutException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionUnhealthyException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.InvalidTargetFormatException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.RegistryIOException;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.HealthChecker;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ISshControlClient;
import edu.utexas.tacc.tapis.hostlink.lib.models.CloseOutcome;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConnectOutcome;
import edu.utexas.tacc.tapis.hostlink.lib.models.RemoteCommandResult;
import edu.utexas.tacc.tapis.hostlink.lib.models.SshTarget;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;
import edu.utexas.tacc.tapis.hostlink.lib.utils.TargetParser;
import edu.utexas.tacc.tapis.hostlink.lib.workers.BackgroundTaskRunner;

/**
 * Establishes, reuses, closes and uses multiplexed sessions.
 *
 * A session for a target is reused whenever its control socket passes a full health check. Otherwise any leftover
 * socket is removed, a new master is launched and the socket is polled until the master answers or the readiness
 * budget (attempts times poll interval) runs out. A session that came up is registered and the pool cap applied.
 *
 * Targets are parsed before anything else so a malformed target never touches the socket directory or registry.
 */
@Service
public class ConnectionLifecycleManager
{
  private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycleManager.class);

  private final ControlSocketStore socketStore;
  private final HealthChecker healthChecker;
  private final ISshControlClient sshClient;
  private final ConnectionRegistry registry;
  private final ConnectionPoolManager poolManager;
  private final BackgroundTaskRunner taskRunner;
  private final int maxAttempts;
  private final long pollMillis;

  @Inject
  public ConnectionLifecycleManager(ControlSocketStore socketStore, HealthChecker healthChecker,
                                    ISshControlClient sshClient, ConnectionRegistry registry,
                                    ConnectionPoolManager poolManager, BackgroundTaskRunner taskRunner,
                                    IRuntimeConfig config)
  {
    this.socketStore = socketStore;
    this.healthChecker = healthChecker;
    this.sshClient = sshClient;
    this.registry = registry;
    this.poolManager = poolManager;
    this.taskRunner = taskRunner;
    this.maxAttempts = Math.max(1, config.getEstablishMaxAttempts());
    this.pollMillis = Math.max(1, config.getEstablishPollMillis());
  }

  /* **************************************************************************** */
  /*                                Public Methods                                */
  /* **************************************************************************** */

  /**
   * Make sure a healthy session exists for the target.
   * @param target user@host[:port]
   * @return REUSED if a healthy session was already there, ESTABLISHED if a new one was started
   * @throws InvalidTargetFormatException if the target is malformed. Nothing has been changed.
   * @throws ConnectionTimeoutException if the master could not be launched or did not come up in time
   * @throws RegistryIOException if the new session could not be registered
   */
  public ConnectOutcome establish(String target)
          throws InvalidTargetFormatException, ConnectionTimeoutException, RegistryIOException
  {
    SshTarget sshTarget = TargetParser.parse(target);
    if (healthChecker.fullCheck(target))
    {
      log.debug(LibUtils.getMsg("HOSTLINK_CONN_REUSED", target));
      return ConnectOutcome.REUSED;
    }

    Path socket = socketStore.socketPath(target);
    if (socketStore.delete(socket)) log.debug(LibUtils.getMsg("HOSTLINK_CONN_STALE_REMOVED", target, socket));
    try
    {
      socketStore.ensureDir();
      sshClient.startMaster(sshTarget, socket);
    }
    catch (IOException e)
    {
      String msg = LibUtils.getMsg("HOSTLINK_CONN_LAUNCH_ERR", target, e.getMessage());
      log.error(msg, e);
      throw new ConnectionTimeoutException(msg, e);
    }

    awaitReady(target, socket);
    registry.register(target);
    log.info(LibUtils.getMsg("HOSTLINK_CONN_ESTABLISHED", target, socket));
    poolManager.enforceCapacityKeeping(target);
    return ConnectOutcome.ESTABLISHED;
  }

  /**
   * Shut down the session for the target and forget it.
   * @return GRACEFUL if the master accepted the exit request, FORCED if the socket had to be removed instead
   * @throws ConnectionNotFoundException if there is no socket for the target
   */
  public CloseOutcome close(String target)
          throws InvalidTargetFormatException, ConnectionNotFoundException, RegistryIOException
  {
    SshTarget sshTarget = TargetParser.parse(target);
    Path socket = socketStore.socketPath(target);
    if (!socketStore.exists(socket))
    {
      throw new ConnectionNotFoundException(LibUtils.getMsg("HOSTLINK_CONN_NOT_FOUND", target));
    }

    CloseOutcome outcome;
    if (sshClient.exit(sshTarget, socket))
    {
      outcome = CloseOutcome.GRACEFUL;
      log.info(LibUtils.getMsg("HOSTLINK_CONN_CLOSED", target));
    }
    else
    {
      outcome = CloseOutcome.FORCED;
      log.warn(LibUtils.getMsg("HOSTLINK_CONN_FORCE_CLOSED", target, socket));
    }
    // The master normally removes its own socket on exit
    socketStore.delete(socket);
    registry.unregister(target);
    return outcome;
  }

  /**
   * Close, if there is anything to close, then establish. A failure in between leaves the target disconnected.
   */
  public ConnectOutcome reconnect(String target)
          throws InvalidTargetFormatException, ConnectionTimeoutException, RegistryIOException
  {
    TargetParser.parse(target);
    try
    {
      close(target);
    }
    catch (ConnectionNotFoundException e)
    {
      log.debug(e.getMessage());
    }
    return establish(target);
  }

  public RemoteCommandResult execute(String target, String command)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionUnhealthyException,
                 IOException, InterruptedException
  {
    return execute(target, command, null);
  }

  /**
   * Run a command through the existing session. Output and exit code are returned unchanged, nothing is retried.
   * @param timeout null for no limit
   * @throws ConnectionNotFoundException if there is no socket for the target
   * @throws ConnectionUnhealthyException if the socket exists but the master does not answer
   * @throws IOException if the client could not be run
   */
  public RemoteCommandResult execute(String target, String command, Duration timeout)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionUnhealthyException,
                 IOException, InterruptedException
  {
    SshTarget sshTarget = TargetParser.parse(target);
    Path socket = socketStore.socketPath(target);
    if (!socketStore.exists(socket))
      throw new ConnectionNotFoundException(LibUtils.getMsg("HOSTLINK_CONN_NOT_FOUND", target));
    if (!healthChecker.fullCheck(target))
      throw new ConnectionUnhealthyException(LibUtils.getMsg("HOSTLINK_CONN_UNHEALTHY", target));
    log.debug(LibUtils.getMsg("HOSTLINK_CONN_EXEC", target, command));
    return sshClient.exec(sshTarget, socket, command, timeout);
  }

  /* **************************************************************************** */
  /*                               Private Methods                                */
  /* **************************************************************************** */

  /*
   * Poll on the runner's scheduler until the socket is present and healthy. The poll is cancelled on every exit path.
   */
  private void awaitReady(String target, Path socket) throws ConnectionTimeoutException
  {
    CompletableFuture<Void> ready = new CompletableFuture<>();
    ScheduledFuture<?> poll = taskRunner.getScheduler().scheduleWithFixedDelay(() -> {
      if (ready.isDone()) return;
      try
      {
        if (socketStore.exists(socket) && healthChecker.fullCheck(target)) ready.complete(null);
      }
      catch (RuntimeException e)
      {
        ready.completeExceptionally(e);
      }
    }, 0, pollMillis, TimeUnit.MILLISECONDS);

    long budgetMillis = maxAttempts * pollMillis;
    try
    {
      ready.get(budgetMillis, TimeUnit.MILLISECONDS);
    }
    catch (TimeoutException e)
    {
      String msg = LibUtils.getMsg("HOSTLINK_CONN_TIMEOUT", target, budgetMillis);
      log.error(msg);
      throw new ConnectionTimeoutException(msg, e);
    }
    catch (InterruptedException e)
    {
      Thread.currentThread().interrupt();
      throw new ConnectionTimeoutException(LibUtils.getMsg("HOSTLINK_CONN_INTERRUPTED", target), e);
    }
    catch (ExecutionException e)
    {
      String msg = LibUtils.getMsg("HOSTLINK_CONN_POLL_ERR", target, e.getCause().getMessage());
      log.error(msg, e.getCause());
      throw new ConnectionTimeoutException(msg, e.getCause());
    }
    finally
    {
      poll.cancel(true);
    }
  }
}
