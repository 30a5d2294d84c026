package edu.utexas.tacc.tapis.hostlink.lib.workers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;

/**
 * Runs fire-and-forget maintenance jobs (sweeps, cache cleanup, cache warming) and provides the scheduler used
 * for readiness polls while a connection is being established.
 *
 * All threads are daemon threads so pending maintenance never keeps the JVM alive. A job that throws is logged
 * and otherwise ignored, a failed background job never reaches the caller that submitted it.
 */
@Service
public class BackgroundTaskRunner
{
  private static final Logger log = LoggerFactory.getLogger(BackgroundTaskRunner.class);

  public static final long SHUTDOWN_TIMEOUT_MILLISECONDS = 5000;

  private final ExecutorService jobExecutor;
  private final ScheduledExecutorService pollScheduler;
  private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();

  public BackgroundTaskRunner()
  {
    jobExecutor = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("hostlink-job-%d").setDaemon(true).build());
    pollScheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("hostlink-poll-%d").setDaemon(true).build());
  }

  /**
   * Run a job in the background.
   * @param jobName name used in log messages
   * @param job work to do
   * @return future completed when the job finishes, normally even if the job failed
   */
  public CompletableFuture<Void> submit(String jobName, Runnable job)
  {
    CompletableFuture<Void> future = CompletableFuture.runAsync(() -> runLogged(jobName, job), jobExecutor);
    pending.add(future);
    future.whenComplete((v, t) -> pending.remove(future));
    return future;
  }

  public ScheduledExecutorService getScheduler() { return pollScheduler; }

  /*
   * Executor for short blocking work owned by the caller, such as draining process output. Work run here is not
   *   tracked by awaitIdle.
   */
  public Executor getJobExecutor() { return jobExecutor; }

  /**
   * Wait for every job submitted so far to finish.
   * @return true if nothing is pending when this returns
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException
  {
    long deadline = System.nanoTime() + timeout.toNanos();
    for (CompletableFuture<Void> future : new ArrayList<>(pending))
    {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) break;
      try
      {
        future.get(remaining, TimeUnit.NANOSECONDS);
      }
      catch (ExecutionException | TimeoutException e)
      {
        log.debug(LibUtils.getMsg("HOSTLINK_JOB_AWAIT", e.getMessage()));
      }
    }
    return pending.isEmpty();
  }

  public void shutdown()
  {
    log.info(LibUtils.getMsg("HOSTLINK_RUNNER_SHUTDOWN"));
    pollScheduler.shutdownNow();
    jobExecutor.shutdown();
    try
    {
      jobExecutor.awaitTermination(SHUTDOWN_TIMEOUT_MILLISECONDS, TimeUnit.MILLISECONDS);
    }
    catch (InterruptedException ex)
    {
      log.warn(LibUtils.getMsg("HOSTLINK_RUNNER_SHUTDOWN_ERR", ex.getMessage()), ex);
      Thread.currentThread().interrupt();
    }
    finally
    {
      if (!jobExecutor.isTerminated()) jobExecutor.shutdownNow();
    }
  }

  private static void runLogged(String jobName, Runnable job)
  {
    log.debug(LibUtils.getMsg("HOSTLINK_JOB_START", jobName));
    try
    {
      job.run();
    }
    catch (Throwable t)
    {
      log.error(LibUtils.getMsg("HOSTLINK_JOB_FAILED", jobName, t.getMessage()), t);
    }
  }
}
