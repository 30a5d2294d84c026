package edu.utexas.tacc.tapis.hostlink.lib.kernel;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.inject.Inject;

import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.utils.KeyDeriver;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;

/*
 * Filesystem area holding one control socket per target plus the connection registry file.
 *
 * Socket files are named ssh-<connectionId>. Presence of a file says nothing about the master process behind it,
 *   callers must use the HealthChecker before trusting one.
 */
@Service
public class ControlSocketStore
{
  private static final Logger log = LoggerFactory.getLogger(ControlSocketStore.class);

  public static final String SOCKET_PREFIX = "ssh-";
  public static final String REGISTRY_FILE_NAME = "connection_registry";

  private final Path controlDir;
  private final Clock clock;

  @Inject
  public ControlSocketStore(IRuntimeConfig config, Clock clock)
  {
    this.controlDir = config.getControlDir();
    this.clock = clock;
  }

  public Path getControlDir() { return controlDir; }

  /*
   * Create the socket directory if needed. Owner only access when the filesystem supports POSIX permissions.
   */
  public void ensureDir() throws IOException
  {
    LibUtils.ensurePrivateDir(controlDir);
  }

  public Path socketPath(String target)
  {
    return controlDir.resolve(SOCKET_PREFIX + KeyDeriver.deriveId(target));
  }

  public Path socketPathForId(String connectionId)
  {
    return controlDir.resolve(SOCKET_PREFIX + connectionId);
  }

  public Path registryFile()
  {
    return controlDir.resolve(REGISTRY_FILE_NAME);
  }

  public boolean exists(String target)
  {
    return exists(socketPath(target));
  }

  public boolean exists(Path socket)
  {
    return Files.exists(socket) && !Files.isDirectory(socket);
  }

  /*
   * Seconds since the socket was last modified. Empty if the file is gone or unreadable.
   */
  public Optional<Long> ageSeconds(Path socket)
  {
    return lastModifiedEpochSeconds(socket).map(t -> clock.instant().getEpochSecond() - t);
  }

  public Optional<Long> lastModifiedEpochSeconds(Path socket)
  {
    try
    {
      FileTime ft = Files.getLastModifiedTime(socket);
      return Optional.of(ft.toInstant().getEpochSecond());
    }
    catch (IOException e)
    {
      log.debug(LibUtils.getMsg("HOSTLINK_SOCKET_STAT_ERR", socket, e.getMessage()));
      return Optional.empty();
    }
  }

  /*
   * Remove a socket file. Missing files are not an error.
   * Returns true if something was removed.
   */
  public boolean delete(Path socket)
  {
    try
    {
      return Files.deleteIfExists(socket);
    }
    catch (IOException e)
    {
      log.warn(LibUtils.getMsg("HOSTLINK_SOCKET_DELETE_ERR", socket, e.getMessage()));
      return false;
    }
  }

  /*
   * All socket files keyed by connection id, in id order.
   */
  public Map<String, Path> listSockets()
  {
    Map<String, Path> sockets = new TreeMap<>();
    if (!Files.isDirectory(controlDir)) return sockets;
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(controlDir, SOCKET_PREFIX + "*"))
    {
      for (Path p : stream)
      {
        if (Files.isDirectory(p)) continue;
        String id = p.getFileName().toString().substring(SOCKET_PREFIX.length());
        sockets.put(id, p);
      }
    }
    catch (IOException e)
    {
      log.warn(LibUtils.getMsg("HOSTLINK_SOCKET_LIST_ERR", controlDir, e.getMessage()));
    }
    return sockets;
  }
}
