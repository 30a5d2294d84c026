package edu.utexas.tacc.tapis.hostlink.lib.kernel;

import edu.utexas.tacc.tapis.hostlink.lib.test.TestUtils;
import edu.utexas.tacc.tapis.hostlink.lib.utils.KeyDeriver;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

@Test(groups = {"unit"})
public class ControlSocketStoreTest
{
  private Path root;
  private ControlSocketStore store;

  @BeforeMethod
  public void setUp() throws Exception
  {
    root = TestUtils.createTempRoot();
    store = new ControlSocketStore(TestUtils.configFor(root), Clock.systemDefaultZone());
  }

  @AfterMethod
  public void tearDown() throws Exception
  {
    TestUtils.deleteTempRoot(root);
  }

  @Test
  public void testPaths()
  {
    String target = "admin@192.0.2.10:2200";
    Path socket = store.socketPath(target);
    Assert.assertEquals(socket.getFileName().toString(), "ssh-" + KeyDeriver.deriveId(target));
    Assert.assertEquals(socket.getParent(), root.resolve("sockets"));
    Assert.assertEquals(store.registryFile().getFileName().toString(), ControlSocketStore.REGISTRY_FILE_NAME);
  }

  @Test
  public void testExistsAgeAndDelete() throws Exception
  {
    String target = "root@h1";
    Assert.assertFalse(store.exists(target));
    Assert.assertFalse(store.ageSeconds(store.socketPath(target)).isPresent());

    TestUtils.touch(store.socketPath(target), Duration.ofSeconds(120));
    Assert.assertTrue(store.exists(target));
    long age = store.ageSeconds(store.socketPath(target)).orElseThrow();
    Assert.assertTrue(age >= 119 && age <= 130, "age was " + age);

    Assert.assertTrue(store.delete(store.socketPath(target)));
    Assert.assertFalse(store.delete(store.socketPath(target)), "second delete is a no-op");
    Assert.assertFalse(store.exists(target));
  }

  @Test
  public void testDirectoryIsNotASocket() throws Exception
  {
    Files.createDirectories(store.socketPath("root@h1"));
    Assert.assertFalse(store.exists("root@h1"));
  }

  @Test
  public void testListSockets() throws Exception
  {
    Assert.assertTrue(store.listSockets().isEmpty(), "missing directory lists nothing");
    TestUtils.touch(store.socketPath("root@h1"), Duration.ZERO);
    TestUtils.touch(store.socketPath("root@h2"), Duration.ZERO);
    TestUtils.touch(store.registryFile(), Duration.ZERO);

    Map<String, Path> sockets = store.listSockets();
    Assert.assertEquals(sockets.size(), 2);
    Assert.assertEquals(sockets.get(KeyDeriver.deriveId("root@h1")), store.socketPath("root@h1"));
    Assert.assertEquals(sockets.get(KeyDeriver.deriveId("root@h2")), store.socketPath("root@h2"));
  }
}
