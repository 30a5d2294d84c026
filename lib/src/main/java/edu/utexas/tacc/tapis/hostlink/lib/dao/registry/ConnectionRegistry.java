package edu.utexas.tacc.tapis.hostlink.lib.dao.registry;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import javax.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.Striped;
import org.apache.commons.lang3.StringUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.exceptions.RegistryIOException;
import edu.utexas.tacc.tapis.hostlink.lib.json.TapisObjectMapper;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.models.RegistryEntry;
import edu.utexas.tacc.tapis.hostlink.lib.utils.KeyDeriver;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;

/**
 * Durable table of tracked connections: connection id, target and registration time.
 *
 * The table lives in a single file shared by every process on the host, one JSON object per line.
 * Each read-modify-write holds an exclusive lock on a sibling lock file for its whole duration, and an
 * in-process lock since a JVM cannot hold two overlapping file locks. The new content is written to a temp
 * file and renamed over the registry so readers never see a partial file. Reads take no lock.
 *
 * At most one row exists per connection id.
 */
@Service
public class ConnectionRegistry
{
  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private static final String LOCK_SUFFIX = ".lock";

  // Shared by every instance in the JVM, keyed on the registry path
  private static final Striped<Lock> PROCESS_LOCKS = Striped.lock(16);

  private final ControlSocketStore socketStore;
  private final Clock clock;
  private final ObjectMapper mapper = TapisObjectMapper.getMapper();

  @Inject
  public ConnectionRegistry(ControlSocketStore socketStore, Clock clock)
  {
    this.socketStore = socketStore;
    this.clock = clock;
  }

  /* **************************************************************************** */
  /*                                Public Methods                                */
  /* **************************************************************************** */

  /**
   * Add or replace the row for the target, stamped with the current time.
   * @param target exact target string
   * @return the row written
   * @throws RegistryIOException on error
   */
  public RegistryEntry register(String target) throws RegistryIOException
  {
    String id = KeyDeriver.deriveId(target);
    RegistryEntry entry = new RegistryEntry(id, target, clock.instant().getEpochSecond());
    update(rows -> {
      rows.removeIf(r -> id.equals(r.getConnectionId()));
      rows.add(entry);
      return List.of();
    });
    log.debug(LibUtils.getMsg("HOSTLINK_REGISTRY_REGISTERED", target, id));
    return entry;
  }

  /**
   * Remove the row for the target if there is one.
   * @return true if a row was removed
   */
  public boolean unregister(String target) throws RegistryIOException
  {
    String id = KeyDeriver.deriveId(target);
    List<RegistryEntry> removed = update(rows -> removeMatching(rows, r -> id.equals(r.getConnectionId())));
    if (!removed.isEmpty()) log.debug(LibUtils.getMsg("HOSTLINK_REGISTRY_UNREGISTERED", target, id));
    return !removed.isEmpty();
  }

  public Optional<String> lookupTargetById(String connectionId) throws RegistryIOException
  {
    return findById(connectionId).map(RegistryEntry::getTarget);
  }

  public Optional<Long> lookupRegisteredAt(String connectionId) throws RegistryIOException
  {
    return findById(connectionId).map(RegistryEntry::getRegisteredAt);
  }

  public Optional<RegistryEntry> findById(String connectionId) throws RegistryIOException
  {
    return listEntries().stream().filter(r -> r.getConnectionId().equals(connectionId)).findFirst();
  }

  /**
   * All rows in file order. Lines that cannot be decoded are skipped.
   */
  public List<RegistryEntry> listEntries() throws RegistryIOException
  {
    Path file = socketStore.registryFile();
    if (!Files.exists(file)) return new ArrayList<>();
    try
    {
      return decode(Files.readAllLines(file, StandardCharsets.UTF_8));
    }
    catch (IOException e)
    {
      String msg = LibUtils.getMsg("HOSTLINK_REGISTRY_READ_ERR", file, e.getMessage());
      log.error(msg, e);
      throw new RegistryIOException(msg, e);
    }
  }

  public int count() throws RegistryIOException
  {
    return listEntries().size();
  }

  /**
   * Row with the largest registration time, if any.
   */
  public Optional<RegistryEntry> findMostRecent() throws RegistryIOException
  {
    return listEntries().stream().max(Comparator.comparingLong(RegistryEntry::getRegisteredAt));
  }

  /**
   * Rewrite the registry keeping only rows that match the predicate. The file is removed when no rows remain.
   * @return rows that were dropped
   */
  public List<RegistryEntry> retainIf(Predicate<RegistryEntry> keep) throws RegistryIOException
  {
    return update(rows -> removeMatching(rows, keep.negate()));
  }

  /**
   * Drop the oldest rows until no more than maxConnections remain.
   * @return rows that were dropped, oldest first
   */
  public List<RegistryEntry> evictOldest(int maxConnections) throws RegistryIOException
  {
    return evictOldest(maxConnections, null);
  }

  /**
   * Drop the oldest rows until no more than maxConnections remain, never dropping the row for keepId.
   * Rows with the same registration time are taken in file order, and a re-registered row is always last.
   * @param keepId connection id that is exempt from eviction, may be null
   * @return rows that were dropped, oldest first
   */
  public List<RegistryEntry> evictOldest(int maxConnections, String keepId) throws RegistryIOException
  {
    int max = Math.max(0, maxConnections);
    return update(rows -> {
      if (rows.size() <= max) return List.of();
      List<RegistryEntry> candidates = rows.stream()
              .filter(r -> !r.getConnectionId().equals(keepId))
              .sorted(RegistryEntry.OLDEST_FIRST)
              .collect(Collectors.toList());
      int excess = Math.min(rows.size() - max, candidates.size());
      List<RegistryEntry> evicted = new ArrayList<>(candidates.subList(0, excess));
      rows.removeAll(evicted);
      return evicted;
    });
  }

  /* **************************************************************************** */
  /*                               Private Methods                                */
  /* **************************************************************************** */

  @FunctionalInterface
  private interface RowMutation
  {
    /*
     * Mutate rows in place, return any rows removed.
     */
    List<RegistryEntry> apply(List<RegistryEntry> rows);
  }

  /*
   * Locked read-modify-write of the whole registry.
   */
  private List<RegistryEntry> update(RowMutation mutation) throws RegistryIOException
  {
    Path file = socketStore.registryFile();
    Lock processLock = PROCESS_LOCKS.get(file.toAbsolutePath().normalize());
    processLock.lock();
    try
    {
      socketStore.ensureDir();
      Path lockFile = file.resolveSibling(file.getFileName() + LOCK_SUFFIX);
      try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
           FileLock ignored = channel.lock())
      {
        List<RegistryEntry> rows = Files.exists(file) ? decode(Files.readAllLines(file, StandardCharsets.UTF_8))
                                                      : new ArrayList<>();
        List<RegistryEntry> removed = mutation.apply(rows);
        write(file, rows);
        return removed;
      }
    }
    catch (IOException e)
    {
      String msg = LibUtils.getMsg("HOSTLINK_REGISTRY_WRITE_ERR", file, e.getMessage());
      log.error(msg, e);
      throw new RegistryIOException(msg, e);
    }
    finally
    {
      processLock.unlock();
    }
  }

  private void write(Path file, List<RegistryEntry> rows) throws IOException
  {
    if (rows.isEmpty())
    {
      Files.deleteIfExists(file);
      return;
    }
    StringBuilder sb = new StringBuilder();
    for (RegistryEntry row : rows) sb.append(mapper.writeValueAsString(row)).append('\n');
    LibUtils.writeAtomically(file, sb.toString());
  }

  private List<RegistryEntry> decode(List<String> lines)
  {
    List<RegistryEntry> rows = new ArrayList<>();
    for (String line : lines)
    {
      if (StringUtils.isBlank(line)) continue;
      try
      {
        RegistryEntry row = mapper.readValue(line, RegistryEntry.class);
        if (StringUtils.isBlank(row.getConnectionId()) || StringUtils.isBlank(row.getTarget()))
        {
          log.debug(LibUtils.getMsg("HOSTLINK_REGISTRY_BAD_LINE", line));
          continue;
        }
        rows.add(row);
      }
      catch (JsonProcessingException e)
      {
        log.debug(LibUtils.getMsg("HOSTLINK_REGISTRY_BAD_LINE", line));
      }
    }
    return rows;
  }

  private static List<RegistryEntry> removeMatching(List<RegistryEntry> rows, Predicate<RegistryEntry> drop)
  {
    List<RegistryEntry> removed = rows.stream().filter(drop).collect(Collectors.toList());
    rows.removeAll(removed);
    return removed;
  }
}
