package edu.utexas.tacc.tapis.hostlink.lib.services;

import edu.utexas.tacc.tapis.hostlink.lib.dao.registry.ConnectionRegistry;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionNotFoundException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionTimeoutException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionUnhealthyException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.InvalidTargetFormatException;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.HealthChecker;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ISshControlClient;
import edu.utexas.tacc.tapis.hostlink.lib.models.CloseOutcome;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConnectOutcome;
import edu.utexas.tacc.tapis.hostlink.lib.models.RemoteCommandResult;
import edu.utexas.tacc.tapis.hostlink.lib.models.SshTarget;
import edu.utexas.tacc.tapis.hostlink.lib.test.AbstractBinderBuilder;
import edu.utexas.tacc.tapis.hostlink.lib.test.TestUtils;
import edu.utexas.tacc.tapis.hostlink.lib.utils.KeyDeriver;
import edu.utexas.tacc.tapis.hostlink.lib.workers.BackgroundTaskRunner;
import org.glassfish.hk2.api.ServiceLocator;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Test(groups = {"unit"})
public class ConnectionLifecycleManagerTest
{
  private static final String TARGET = "admin@192.0.2.10:2200";

  private Path root;
  private ServiceLocator locator;
  private ISshControlClient sshClient;
  private ConnectionLifecycleManager lifecycle;
  private ConnectionRegistry registry;
  private ControlSocketStore store;
  private HealthChecker healthChecker;

  @BeforeMethod
  public void setUp() throws Exception
  {
    root = TestUtils.createTempRoot();
    sshClient = TestUtils.liveSshClient();
    locator = new AbstractBinderBuilder().config(TestUtils.configFor(root)).mockSshClient(sshClient).buildLocator();
    lifecycle = locator.getService(ConnectionLifecycleManager.class);
    registry = locator.getService(ConnectionRegistry.class);
    store = locator.getService(ControlSocketStore.class);
    healthChecker = locator.getService(HealthChecker.class);
  }

  @AfterMethod
  public void tearDown() throws Exception
  {
    locator.getService(BackgroundTaskRunner.class).shutdown();
    locator.shutdown();
    TestUtils.deleteTempRoot(root);
  }

  @Test
  public void testEstablishRegistersConnection() throws Exception
  {
    Assert.assertEquals(lifecycle.establish(TARGET), ConnectOutcome.ESTABLISHED);
    Assert.assertTrue(healthChecker.fullCheck(TARGET));
    Assert.assertEquals(registry.lookupTargetById(KeyDeriver.deriveId(TARGET)).orElseThrow(), TARGET);
    verify(sshClient).startMaster(any(SshTarget.class), eq(store.socketPath(TARGET)));
  }

  @Test
  public void testEstablishIsIdempotent() throws Exception
  {
    Assert.assertEquals(lifecycle.establish(TARGET), ConnectOutcome.ESTABLISHED);
    Assert.assertEquals(lifecycle.establish(TARGET), ConnectOutcome.REUSED);
    verify(sshClient, times(1)).startMaster(any(SshTarget.class), any(Path.class));
    Assert.assertEquals(registry.count(), 1);
  }

  @Test
  public void testEstablishReplacesStaleSocket() throws Exception
  {
    Path socket = TestUtils.touch(store.socketPath(TARGET), Duration.ofHours(3));
    // First check sees the stale socket as dead, later checks follow the socket
    doReturn(false)
            .doAnswer(inv -> Files.exists((Path) inv.getArgument(1)))
            .when(sshClient).check(any(SshTarget.class), any(Path.class), any(Duration.class));

    Assert.assertEquals(lifecycle.establish(TARGET), ConnectOutcome.ESTABLISHED);
    verify(sshClient).startMaster(any(SshTarget.class), eq(socket));
    Assert.assertTrue(Files.exists(socket));
  }

  @Test
  public void testEstablishTimesOut() throws Exception
  {
    // Master never comes up
    doNothing().when(sshClient).startMaster(any(SshTarget.class), any(Path.class));
    try
    {
      lifecycle.establish(TARGET);
      Assert.fail("Expected ConnectionTimeoutException");
    }
    catch (ConnectionTimeoutException e)
    {
      Assert.assertTrue(e.getMessage().contains(TARGET));
    }
    Assert.assertEquals(registry.count(), 0);
  }

  @Test(expectedExceptions = ConnectionTimeoutException.class)
  public void testLaunchFailureIsTimeout() throws Exception
  {
    doThrow(new IOException("no ssh")).when(sshClient).startMaster(any(SshTarget.class), any(Path.class));
    lifecycle.establish(TARGET);
  }

  @Test
  public void testMalformedTargetHasNoSideEffects() throws Exception
  {
    try
    {
      lifecycle.establish("a@b@c");
      Assert.fail("Expected InvalidTargetFormatException");
    }
    catch (InvalidTargetFormatException e)
    {
      // expected
    }
    verify(sshClient, never()).startMaster(any(SshTarget.class), any(Path.class));
    Assert.assertTrue(store.listSockets().isEmpty());
    Assert.assertEquals(registry.count(), 0);
  }

  @Test
  public void testCloseGraceful() throws Exception
  {
    lifecycle.establish(TARGET);
    Assert.assertEquals(lifecycle.close(TARGET), CloseOutcome.GRACEFUL);
    Assert.assertFalse(healthChecker.fullCheck(TARGET));
    Assert.assertEquals(registry.count(), 0);
  }

  @Test
  public void testCloseForced() throws Exception
  {
    lifecycle.establish(TARGET);
    doReturn(false).when(sshClient).exit(any(SshTarget.class), any(Path.class));
    Assert.assertEquals(lifecycle.close(TARGET), CloseOutcome.FORCED);
    Assert.assertFalse(store.exists(TARGET));
    Assert.assertEquals(registry.count(), 0);
  }

  @Test(expectedExceptions = ConnectionNotFoundException.class)
  public void testCloseWithoutSocket() throws Exception
  {
    lifecycle.close(TARGET);
  }

  @Test
  public void testReconnect() throws Exception
  {
    Assert.assertEquals(lifecycle.reconnect(TARGET), ConnectOutcome.ESTABLISHED);
    Assert.assertEquals(lifecycle.reconnect(TARGET), ConnectOutcome.ESTABLISHED);
    verify(sshClient, times(2)).startMaster(any(SshTarget.class), any(Path.class));
    verify(sshClient, times(1)).exit(any(SshTarget.class), any(Path.class));
    Assert.assertEquals(registry.count(), 1);
  }

  @Test
  public void testExecuteReturnsResultUnchanged() throws Exception
  {
    lifecycle.establish(TARGET);
    RemoteCommandResult expected = new RemoteCommandResult("uptime", 3, "out", "err");
    when(sshClient.exec(any(SshTarget.class), any(Path.class), eq("uptime"), isNull())).thenReturn(expected);
    RemoteCommandResult result = lifecycle.execute(TARGET, "uptime");
    Assert.assertSame(result, expected);
    verify(sshClient, times(1)).exec(any(SshTarget.class), any(Path.class), eq("uptime"), isNull());
  }

  @Test
  public void testExecutePassesTimeout() throws Exception
  {
    lifecycle.establish(TARGET);
    Duration timeout = Duration.ofSeconds(5);
    RemoteCommandResult expected = new RemoteCommandResult("sleep 60", RemoteCommandResult.TIMEOUT_EXIT_CODE, "", "");
    when(sshClient.exec(any(SshTarget.class), any(Path.class), eq("sleep 60"), eq(timeout))).thenReturn(expected);
    Assert.assertEquals(lifecycle.execute(TARGET, "sleep 60", timeout).getExitCode(), 124);
  }

  @Test(expectedExceptions = ConnectionNotFoundException.class)
  public void testExecuteWithoutConnection() throws Exception
  {
    lifecycle.execute(TARGET, "uptime");
  }

  @Test(expectedExceptions = ConnectionUnhealthyException.class)
  public void testExecuteOnDeadConnection() throws Exception
  {
    TestUtils.touch(store.socketPath(TARGET), Duration.ZERO);
    doReturn(false).when(sshClient).check(any(SshTarget.class), any(Path.class), any(Duration.class));
    lifecycle.execute(TARGET, "uptime");
  }
}
