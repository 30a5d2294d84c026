package edu.utexas.tacc.tapis.hostlink.lib.caches;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.CacheCorruptException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.CacheWriteFailedException;
import edu.utexas.tacc.tapis.hostlink.lib.json.TapisObjectMapper;
import edu.utexas.tacc.tapis.hostlink.lib.models.CacheListing;
import edu.utexas.tacc.tapis.hostlink.lib.models.CacheStatsReport;
import edu.utexas.tacc.tapis.hostlink.lib.models.DeviceCacheEntry;
import edu.utexas.tacc.tapis.hostlink.lib.utils.KeyDeriver;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;
import edu.utexas.tacc.tapis.hostlink.lib.workers.BackgroundTaskRunner;

/**
 * File backed cache of device classifications, one file per target.
 *
 * Each entry is stored in {@code <cacheDir>/device-<connectionId>.cache} as a JSON object and replaced as a
 * whole by writing a temp file and renaming it over the entry. Entries older than the configured expiry are
 * treated as absent but stay on disk until cleanupExpired runs. Files that cannot be decoded, miss a required
 * field or carry a different format version are deleted the first time they are loaded.
 *
 * When the number of entries exceeds the configured maximum the oldest files, by modification time, are removed
 * with some slack so that the cleanup does not run again on every save.
 */
@Service
public class DeviceTypeCache
{
  private static final Logger log = LoggerFactory.getLogger(DeviceTypeCache.class);

  public static final String CACHE_VERSION = "2.0";
  public static final String FILE_PREFIX = "device-";
  public static final String FILE_SUFFIX = ".cache";
  // Extra entries removed beyond the maximum when trimming
  public static final int SIZE_HYSTERESIS = 10;
  // Only files modified within this window are read by the warm pass
  public static final long WARM_WINDOW_SECONDS = 86400;

  private final Path cacheDir;
  private final long ttlSeconds;
  private final int maxSize;
  private final int warmMaxFiles;
  private final Clock clock;
  private final CacheMetrics metrics;
  private final BackgroundTaskRunner taskRunner;
  private final ObjectMapper mapper = TapisObjectMapper.getMapper();

  @Inject
  public DeviceTypeCache(IRuntimeConfig config, Clock clock, CacheMetrics metrics, BackgroundTaskRunner taskRunner)
  {
    cacheDir = config.getCacheDir();
    ttlSeconds = config.getCacheExpirySeconds();
    maxSize = config.getCacheMaxSize();
    warmMaxFiles = config.getWarmMaxFiles();
    this.clock = clock;
    this.metrics = metrics;
    this.taskRunner = taskRunner;
  }

  /* **************************************************************************** */
  /*                                Public Methods                                */
  /* **************************************************************************** */

  public Path getCacheDir() { return cacheDir; }
  public long getTtlSeconds() { return ttlSeconds; }
  public CacheMetrics getMetrics() { return metrics; }

  public Path cacheFile(String target)
  {
    return cacheDir.resolve(FILE_PREFIX + KeyDeriver.deriveId(target) + FILE_SUFFIX);
  }

  /**
   * Store a classification for the target, replacing any previous one.
   * @param target exact target string
   * @param deviceType normalized device type
   * @param method how the type was obtained
   * @throws CacheWriteFailedException if the entry could not be written. Any previous entry is left as it was.
   */
  public void save(String target, String deviceType, String method) throws CacheWriteFailedException
  {
    manageSize();
    Path file = cacheFile(target);
    DeviceCacheEntry entry = new DeviceCacheEntry(deviceType, clock.instant().getEpochSecond(), method,
                                                  CACHE_VERSION, target);
    try
    {
      LibUtils.ensurePrivateDir(cacheDir);
      LibUtils.writeAtomically(file, mapper.writeValueAsString(entry));
    }
    catch (IOException e)
    {
      String msg = LibUtils.getMsg("HOSTLINK_CACHE_WRITE_ERR", target, file, e.getMessage());
      log.error(msg, e);
      throw new CacheWriteFailedException(msg, e);
    }
    metrics.recordWrite();
    log.debug(LibUtils.getMsg("HOSTLINK_CACHE_SAVED", target, deviceType, method));
  }

  /**
   * Read the entry for a target regardless of age. An invalid entry is deleted and reported as absent.
   */
  public Optional<DeviceCacheEntry> load(String target)
  {
    Path file = cacheFile(target);
    if (!Files.isRegularFile(file)) return Optional.empty();
    try
    {
      return Optional.of(readEntry(file));
    }
    catch (CacheCorruptException e)
    {
      log.debug(e.getMessage());
      deleteQuietly(file);
      return Optional.empty();
    }
  }

  public boolean isExpired(String target)
  {
    return load(target).map(this::isExpired).orElse(true);
  }

  /**
   * Device type for the target if a valid, unexpired entry exists. Updates hit and miss counts.
   */
  public Optional<String> getValid(String target)
  {
    Optional<DeviceCacheEntry> entry = load(target);
    if (entry.isEmpty())
    {
      metrics.recordMiss();
      log.debug(LibUtils.getMsg("HOSTLINK_CACHE_MISS", target));
      return Optional.empty();
    }
    if (isExpired(entry.get()))
    {
      metrics.recordMiss();
      log.debug(LibUtils.getMsg("HOSTLINK_CACHE_EXPIRED", target, entry.get().getTimestamp()));
      return Optional.empty();
    }
    metrics.recordHit();
    return Optional.of(entry.get().getDeviceType());
  }

  /**
   * Remove the entry for a target.
   * @return false if nothing was cached
   * @throws CacheWriteFailedException if the file exists but could not be removed
   */
  public boolean clear(String target) throws CacheWriteFailedException
  {
    Path file = cacheFile(target);
    try
    {
      boolean removed = Files.deleteIfExists(file);
      if (removed) log.debug(LibUtils.getMsg("HOSTLINK_CACHE_CLEARED", target));
      return removed;
    }
    catch (IOException e)
    {
      String msg = LibUtils.getMsg("HOSTLINK_CACHE_WRITE_ERR", target, file, e.getMessage());
      log.error(msg, e);
      throw new CacheWriteFailedException(msg, e);
    }
  }

  /**
   * One listing per decodable entry. Invalid files are skipped, not deleted.
   */
  public List<CacheListing> listAll()
  {
    long now = clock.instant().getEpochSecond();
    List<CacheListing> listings = new ArrayList<>();
    for (Path file : listCacheFiles())
    {
      try
      {
        DeviceCacheEntry entry = readEntry(file);
        String target = StringUtils.defaultIfBlank(entry.getTarget(), LibUtils.UNKNOWN);
        String method = StringUtils.defaultIfBlank(entry.getMethod(), LibUtils.UNKNOWN);
        listings.add(new CacheListing(target, entry.getDeviceType(), method, now - entry.getTimestamp(),
                                      isExpired(entry)));
      }
      catch (CacheCorruptException e)
      {
        log.debug(e.getMessage());
      }
    }
    return listings;
  }

  public CacheStatsReport stats()
  {
    int total = 0, valid = 0, expired = 0, invalid = 0;
    for (Path file : listCacheFiles())
    {
      total++;
      try
      {
        if (isExpired(readEntry(file))) expired++; else valid++;
      }
      catch (CacheCorruptException e)
      {
        invalid++;
      }
    }
    return new CacheStatsReport(total, valid, expired, invalid, cacheDir, ttlSeconds);
  }

  /**
   * Delete expired and undecodable entries.
   * @return number of files removed
   */
  public int cleanupExpired()
  {
    int removed = 0;
    for (Path file : listCacheFiles())
    {
      boolean drop;
      try
      {
        drop = isExpired(readEntry(file));
      }
      catch (CacheCorruptException e)
      {
        drop = true;
      }
      if (drop && deleteQuietly(file)) removed++;
    }
    if (removed > 0) log.info(LibUtils.getMsg("HOSTLINK_CACHE_CLEANUP", removed, cacheDir));
    return removed;
  }

  /**
   * Trim the cache when it holds more than the maximum number of entries.
   * @return number of files removed
   */
  public int manageSize()
  {
    List<Path> files = listCacheFiles();
    if (files.size() <= maxSize) return 0;
    int toRemove = Math.min(files.size(), files.size() - maxSize + SIZE_HYSTERESIS);
    files.sort(Comparator.comparingLong(this::lastModifiedMillis));
    int removed = 0;
    for (Path file : files.subList(0, toRemove))
    {
      if (deleteQuietly(file)) removed++;
    }
    log.info(LibUtils.getMsg("HOSTLINK_CACHE_TRIMMED", removed, files.size(), maxSize));
    return removed;
  }

  /**
   * Read recently modified entries so they are in the OS page cache. Content is discarded.
   * @return number of files read
   */
  public int warm()
  {
    long cutoffMillis = clock.millis() - WARM_WINDOW_SECONDS * 1000L;
    int read = 0;
    for (Path file : listCacheFiles())
    {
      if (read >= warmMaxFiles) break;
      if (lastModifiedMillis(file) < cutoffMillis) continue;
      try
      {
        Files.readAllBytes(file);
        read++;
      }
      catch (IOException e)
      {
        log.debug(LibUtils.getMsg("HOSTLINK_CACHE_READ_ERR", file, e.getMessage()));
      }
    }
    log.debug(LibUtils.getMsg("HOSTLINK_CACHE_WARMED", read));
    return read;
  }

  /**
   * Startup maintenance. Size is enforced before returning, cleanup and warming run in the background.
   */
  public void init()
  {
    taskRunner.submit("cache-cleanup", this::cleanupExpired);
    manageSize();
    taskRunner.submit("cache-warm", this::warm);
  }

  /* **************************************************************************** */
  /*                               Private Methods                                */
  /* **************************************************************************** */

  private boolean isExpired(DeviceCacheEntry entry)
  {
    return clock.instant().getEpochSecond() - entry.getTimestamp() > ttlSeconds;
  }

  /*
   * Decode and validate a cache file. Every way a file can be unusable is reported as CacheCorruptException.
   */
  private DeviceCacheEntry readEntry(Path file) throws CacheCorruptException
  {
    String content;
    try
    {
      content = Files.readString(file, StandardCharsets.UTF_8);
    }
    catch (IOException e)
    {
      throw new CacheCorruptException(LibUtils.getMsg("HOSTLINK_CACHE_READ_ERR", file, e.getMessage()), e);
    }
    if (StringUtils.isBlank(content))
      throw new CacheCorruptException(LibUtils.getMsg("HOSTLINK_CACHE_CORRUPT", file, "empty file"));

    DeviceCacheEntry entry;
    try
    {
      entry = mapper.readValue(content, DeviceCacheEntry.class);
    }
    catch (JsonProcessingException e)
    {
      throw new CacheCorruptException(LibUtils.getMsg("HOSTLINK_CACHE_CORRUPT", file, e.getOriginalMessage()), e);
    }
    if (entry == null || StringUtils.isBlank(entry.getDeviceType()) || entry.getTimestamp() == null
        || StringUtils.isBlank(entry.getVersion()))
      throw new CacheCorruptException(LibUtils.getMsg("HOSTLINK_CACHE_CORRUPT", file, "missing required field"));
    if (!CACHE_VERSION.equals(entry.getVersion()))
      throw new CacheCorruptException(LibUtils.getMsg("HOSTLINK_CACHE_VERSION", file, entry.getVersion(),
                                                      CACHE_VERSION));
    return entry;
  }

  private List<Path> listCacheFiles()
  {
    List<Path> files = new ArrayList<>();
    if (!Files.isDirectory(cacheDir)) return files;
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDir, FILE_PREFIX + "*" + FILE_SUFFIX))
    {
      for (Path p : stream) if (Files.isRegularFile(p)) files.add(p);
    }
    catch (IOException e)
    {
      log.warn(LibUtils.getMsg("HOSTLINK_CACHE_LIST_ERR", cacheDir, e.getMessage()));
    }
    return files;
  }

  private long lastModifiedMillis(Path file)
  {
    try
    {
      return Files.getLastModifiedTime(file).toMillis();
    }
    catch (IOException e)
    {
      // A file that vanished sorts first and is skipped by the warm pass
      return 0L;
    }
  }

  private boolean deleteQuietly(Path file)
  {
    try
    {
      return Files.deleteIfExists(file);
    }
    catch (IOException e)
    {
      log.warn(LibUtils.getMsg("HOSTLINK_CACHE_DELETE_ERR", file, e.getMessage()));
      return false;
    }
  }
}
