package edu.utexas.tacc.tapis.hostlink.lib.caches;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import javax.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.dao.registry.ConnectionRegistry;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.CacheWriteFailedException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.RegistryIOException;
import edu.utexas.tacc.tapis.hostlink.lib.json.TapisObjectMapper;
import edu.utexas.tacc.tapis.hostlink.lib.models.LastTargetRecord;
import edu.utexas.tacc.tapis.hostlink.lib.models.RegistryEntry;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;

/*
 * Remembers the most recently connected target so commands may omit it.
 * When the pointer file is missing or unreadable the newest registry row is used instead.
 */
@Service
public class LastTargetTracker
{
  private static final Logger log = LoggerFactory.getLogger(LastTargetTracker.class);

  public static final String LAST_TARGET_FILE_NAME = "last_connected_target";

  private final Path lastTargetFile;
  private final Path cacheDir;
  private final ConnectionRegistry registry;
  private final Clock clock;
  private final ObjectMapper mapper = TapisObjectMapper.getMapper();

  @Inject
  public LastTargetTracker(IRuntimeConfig config, ConnectionRegistry registry, Clock clock)
  {
    cacheDir = config.getCacheDir();
    lastTargetFile = cacheDir.resolve(LAST_TARGET_FILE_NAME);
    this.registry = registry;
    this.clock = clock;
  }

  public Path getLastTargetFile() { return lastTargetFile; }

  public void set(String target) throws CacheWriteFailedException
  {
    LastTargetRecord rec = new LastTargetRecord(target, clock.instant().getEpochSecond());
    try
    {
      LibUtils.ensurePrivateDir(cacheDir);
      LibUtils.writeAtomically(lastTargetFile, mapper.writeValueAsString(rec));
    }
    catch (IOException e)
    {
      String msg = LibUtils.getMsg("HOSTLINK_LAST_TARGET_WRITE_ERR", target, lastTargetFile, e.getMessage());
      log.error(msg, e);
      throw new CacheWriteFailedException(msg, e);
    }
    log.debug(LibUtils.getMsg("HOSTLINK_LAST_TARGET_SET", target));
  }

  public Optional<String> get()
  {
    Optional<String> fromFile = readFile();
    if (fromFile.isPresent()) return fromFile;
    try
    {
      return registry.findMostRecent().map(RegistryEntry::getTarget);
    }
    catch (RegistryIOException e)
    {
      log.warn(e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<String> readFile()
  {
    if (!Files.isRegularFile(lastTargetFile)) return Optional.empty();
    try
    {
      String content = Files.readString(lastTargetFile, StandardCharsets.UTF_8);
      if (StringUtils.isBlank(content)) return Optional.empty();
      LastTargetRecord rec = mapper.readValue(content, LastTargetRecord.class);
      if (rec == null || StringUtils.isBlank(rec.getTarget())) return Optional.empty();
      return Optional.of(rec.getTarget());
    }
    catch (IOException e)
    {
      log.debug(LibUtils.getMsg("HOSTLINK_LAST_TARGET_READ_ERR", lastTargetFile, e.getMessage()));
      return Optional.empty();
    }
  }
}
