package edu.utexas.tacc.tapis.hostlink.lib.dao.registry;

import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.models.RegistryEntry;
import edu.utexas.tacc.tapis.hostlink.lib.test.TestUtils;
import edu.utexas.tacc.tapis.hostlink.lib.utils.KeyDeriver;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Test(groups = {"unit"})
public class ConnectionRegistryTest
{
  private Path root;
  private ControlSocketStore store;
  private ConnectionRegistry registry;
  private final AtomicLong now = new AtomicLong(1_700_000_000L);

  @BeforeMethod
  public void setUp() throws Exception
  {
    root = TestUtils.createTempRoot();
    // Clock whose time is advanced by the test so registration times are distinct and known
    Clock clock = new Clock() {
      @Override public ZoneOffset getZone() { return ZoneOffset.UTC; }
      @Override public Clock withZone(ZoneId zone) { return this; }
      @Override public Instant instant() { return Instant.ofEpochSecond(now.get()); }
    };
    store = new ControlSocketStore(TestUtils.configFor(root), clock);
    registry = new ConnectionRegistry(store, clock);
  }

  @AfterMethod
  public void tearDown() throws Exception
  {
    TestUtils.deleteTempRoot(root);
  }

  @Test
  public void testRegisterAndLookup() throws Exception
  {
    RegistryEntry e = registry.register("admin@192.0.2.10:2200");
    String id = KeyDeriver.deriveId("admin@192.0.2.10:2200");
    Assert.assertEquals(e.getConnectionId(), id);
    Assert.assertEquals(registry.lookupTargetById(id).orElseThrow(), "admin@192.0.2.10:2200");
    Assert.assertEquals(registry.lookupRegisteredAt(id).orElseThrow().longValue(), now.get());
    Assert.assertFalse(registry.lookupTargetById("nope").isPresent());
  }

  @Test
  public void testRegisterReplacesExistingRow() throws Exception
  {
    registry.register("root@h1");
    now.addAndGet(10);
    registry.register("root@h2");
    now.addAndGet(10);
    registry.register("root@h1");

    List<RegistryEntry> rows = registry.listEntries();
    Assert.assertEquals(rows.size(), 2);
    Assert.assertEquals(rows.stream().filter(r -> r.getTarget().equals("root@h1")).count(), 1L);
    Assert.assertEquals(registry.lookupRegisteredAt(KeyDeriver.deriveId("root@h1")).orElseThrow().longValue(),
                        now.get());
  }

  @Test
  public void testUnregister() throws Exception
  {
    registry.register("root@h1");
    Assert.assertTrue(registry.unregister("root@h1"));
    Assert.assertFalse(registry.unregister("root@h1"));
    Assert.assertEquals(registry.count(), 0);
    Assert.assertFalse(Files.exists(store.registryFile()), "empty registry is removed");
  }

  @Test
  public void testEvictOldest() throws Exception
  {
    for (int i = 1; i <= 5; i++)
    {
      registry.register("root@h" + i);
      now.addAndGet(5);
    }
    List<RegistryEntry> evicted = registry.evictOldest(3);
    Assert.assertEquals(evicted.stream().map(RegistryEntry::getTarget).collect(Collectors.toList()),
                        List.of("root@h1", "root@h2"));
    Assert.assertEquals(registry.listEntries().stream().map(RegistryEntry::getTarget).collect(Collectors.toList()),
                        List.of("root@h3", "root@h4", "root@h5"));
    Assert.assertTrue(registry.evictOldest(3).isEmpty(), "nothing to evict at the cap");
  }

  @Test
  public void testEvictOldestSameSecondKeepsFileOrder() throws Exception
  {
    // No clock movement, every row has the same registration time
    for (int i = 1; i <= 4; i++) registry.register("root@10.0.0." + i);
    List<RegistryEntry> evicted = registry.evictOldest(2);
    Assert.assertEquals(evicted.stream().map(RegistryEntry::getTarget).collect(Collectors.toList()),
                        List.of("root@10.0.0.1", "root@10.0.0.2"));
  }

  @Test
  public void testEvictOldestNeverDropsKeptRow() throws Exception
  {
    registry.register("root@a");
    registry.register("root@b");
    registry.register("root@new");
    // Re-registering an old target in the same second must still keep it
    registry.register("root@a");
    String keepId = KeyDeriver.deriveId("root@a");

    List<RegistryEntry> evicted = registry.evictOldest(1, keepId);
    Assert.assertEquals(evicted.size(), 2);
    Assert.assertEquals(registry.listEntries().stream().map(RegistryEntry::getTarget).collect(Collectors.toList()),
                        List.of("root@a"));

    // Nothing else to drop, the kept row stays even above the cap
    Assert.assertTrue(registry.evictOldest(0, keepId).isEmpty());
    Assert.assertEquals(registry.count(), 1);
  }

  @Test
  public void testRetainIf() throws Exception
  {
    registry.register("root@keep");
    registry.register("root@drop");
    List<RegistryEntry> removed = registry.retainIf(r -> r.getTarget().endsWith("keep"));
    Assert.assertEquals(removed.size(), 1);
    Assert.assertEquals(removed.get(0).getTarget(), "root@drop");
    Assert.assertEquals(registry.count(), 1);
  }

  @Test
  public void testFindMostRecent() throws Exception
  {
    Assert.assertFalse(registry.findMostRecent().isPresent());
    registry.register("root@old");
    now.addAndGet(100);
    registry.register("root@10.0.0.5:2222");
    now.addAndGet(100);
    Assert.assertEquals(registry.findMostRecent().orElseThrow().getTarget(), "root@10.0.0.5:2222");
  }

  @Test
  public void testUnreadableLinesAreSkipped() throws Exception
  {
    registry.register("root@h1");
    Files.writeString(store.registryFile(), "this is not json\n{\"connectionId\":\"\"}\n",
                      StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    Assert.assertEquals(registry.listEntries().size(), 1);
    // A later write drops the bad lines
    registry.register("root@h2");
    Assert.assertEquals(Files.readAllLines(store.registryFile()).size(), 2);
  }

  @Test
  public void testConcurrentRegistrationsAreNotLost() throws Exception
  {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try
    {
      List<Future<RegistryEntry>> futures = new ArrayList<>();
      for (int i = 0; i < 40; i++)
      {
        String target = "user@host" + i;
        futures.add(pool.submit(() -> registry.register(target)));
      }
      for (Future<RegistryEntry> f : futures) f.get();
    }
    finally
    {
      pool.shutdownNow();
    }
    Assert.assertEquals(registry.count(), 40);
  }
}
