package edu.utexas.tacc.tapis.hostlink.lib.workers;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import javax.inject.Inject;

import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.dao.registry.ConnectionRegistry;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.RegistryIOException;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.HealthChecker;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ISshControlClient;
import edu.utexas.tacc.tapis.hostlink.lib.models.RegistryEntry;
import edu.utexas.tacc.tapis.hostlink.lib.models.SweepResult;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;

/**
 * Removes control sockets whose master is gone and registry rows whose socket is gone.
 *
 * A socket with a registry row is judged with the quick health check. A socket without a row may belong to a
 * connection that another process is still setting up, so it is only removed when no local process holds it open.
 * After the socket pass every registry row without a socket file is dropped.
 *
 * Safe to run concurrently with itself and with connection setup in other processes.
 */
@Service
public class StaleConnectionSweeper
{
  private static final Logger log = LoggerFactory.getLogger(StaleConnectionSweeper.class);

  private final ControlSocketStore socketStore;
  private final ConnectionRegistry registry;
  private final HealthChecker healthChecker;
  private final ISshControlClient sshClient;
  private final BackgroundTaskRunner taskRunner;

  @Inject
  public StaleConnectionSweeper(ControlSocketStore socketStore, ConnectionRegistry registry,
                                HealthChecker healthChecker, ISshControlClient sshClient,
                                BackgroundTaskRunner taskRunner)
  {
    this.socketStore = socketStore;
    this.registry = registry;
    this.healthChecker = healthChecker;
    this.sshClient = sshClient;
    this.taskRunner = taskRunner;
  }

  /**
   * Run one sweep in the calling thread.
   * @return counts of sockets and registry rows removed
   * @throws RegistryIOException if the registry cannot be read or rewritten
   */
  public SweepResult sweep() throws RegistryIOException
  {
    Map<String, Path> sockets = socketStore.listSockets();
    Map<String, String> targetsById = new HashMap<>();
    for (RegistryEntry row : registry.listEntries()) targetsById.put(row.getConnectionId(), row.getTarget());

    int socketsRemoved = 0;
    int rowsRemoved = 0;
    for (Map.Entry<String, Path> socket : sockets.entrySet())
    {
      String target = targetsById.get(socket.getKey());
      Path path = socket.getValue();
      if (target != null)
      {
        if (healthChecker.quickCheck(target)) continue;
        log.debug(LibUtils.getMsg("HOSTLINK_SWEEP_STALE", target, path));
        if (socketStore.delete(path)) socketsRemoved++;
        if (registry.unregister(target)) rowsRemoved++;
      }
      else if (!sshClient.isInUse(path))
      {
        log.warn(LibUtils.getMsg("HOSTLINK_SWEEP_ORPHAN", path));
        if (socketStore.delete(path)) socketsRemoved++;
      }
    }

    List<RegistryEntry> dangling =
            registry.retainIf(row -> socketStore.exists(socketStore.socketPathForId(row.getConnectionId())));
    rowsRemoved += dangling.size();

    SweepResult result = new SweepResult(socketsRemoved, rowsRemoved);
    if (result.getTotalRemoved() > 0) log.info(LibUtils.getMsg("HOSTLINK_SWEEP_DONE", socketsRemoved, rowsRemoved));
    return result;
  }

  /**
   * Run a sweep on the background runner. Failures are logged and never reach the caller.
   */
  public CompletableFuture<Void> sweepAsync()
  {
    return taskRunner.submit("stale-sweep", () -> {
      try
      {
        sweep();
      }
      catch (RegistryIOException e)
      {
        log.warn(LibUtils.getMsg("HOSTLINK_SWEEP_FAILED", e.getMessage()));
      }
    });
  }
}
