package edu.utexas.tacc.tapis.hostlink.lib.workers;

import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Test(groups = {"unit"})
public class BackgroundTaskRunnerTest
{
  private BackgroundTaskRunner runner;

  @BeforeMethod
  public void setUp()
  {
    runner = new BackgroundTaskRunner();
  }

  @AfterMethod
  public void tearDown()
  {
    runner.shutdown();
  }

  @Test
  public void testJobsRunAndAwaitIdle() throws Exception
  {
    AtomicInteger count = new AtomicInteger();
    for (int i = 0; i < 5; i++) runner.submit("count", count::incrementAndGet);
    Assert.assertTrue(runner.awaitIdle(Duration.ofSeconds(10)));
    Assert.assertEquals(count.get(), 5);
  }

  @Test
  public void testFailingJobIsSwallowed() throws Exception
  {
    CompletableFuture<Void> f = runner.submit("fail", () -> { throw new IllegalStateException("boom"); });
    // Completes normally even though the job threw
    f.get(10, TimeUnit.SECONDS);
    Assert.assertFalse(f.isCompletedExceptionally());
  }

  @Test
  public void testThreadsAreDaemons() throws Exception
  {
    CompletableFuture<Boolean> daemon = new CompletableFuture<>();
    runner.submit("daemon", () -> daemon.complete(Thread.currentThread().isDaemon()));
    Assert.assertTrue(daemon.get(10, TimeUnit.SECONDS));
  }
}
