package edu.utexas.tacc.tapis.hostlink.lib.services;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.caches.DeviceTypeCache;
import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.dao.registry.ConnectionRegistry;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.RegistryIOException;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.HealthChecker;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConfiguredHost;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConnectionDetail;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConnectionState;
import edu.utexas.tacc.tapis.hostlink.lib.models.ConnectionStatus;
import edu.utexas.tacc.tapis.hostlink.lib.models.RegistryEntry;
import edu.utexas.tacc.tapis.hostlink.lib.models.SshTarget;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;
import edu.utexas.tacc.tapis.hostlink.lib.utils.SshConfigParser;
import edu.utexas.tacc.tapis.hostlink.lib.utils.SshConfigParser.HostBlock;
import edu.utexas.tacc.tapis.hostlink.lib.utils.TargetParser;

/*
 * Read only reporting on connections. Nothing here removes sockets or registry rows.
 */
@Service
public class ConnectionStatusService
{
  private static final Logger log = LoggerFactory.getLogger(ConnectionStatusService.class);

  public static final String UNREGISTERED_PREFIX = LibUtils.UNKNOWN + ":";

  private final ControlSocketStore socketStore;
  private final HealthChecker healthChecker;
  private final ConnectionRegistry registry;
  private final DeviceTypeCache deviceTypeCache;
  private final Clock clock;
  private final Path sshConfigFile;
  private final String localUser;

  @Inject
  public ConnectionStatusService(ControlSocketStore socketStore, HealthChecker healthChecker,
                                 ConnectionRegistry registry, DeviceTypeCache deviceTypeCache, Clock clock,
                                 IRuntimeConfig config)
  {
    this.sshConfigFile = config.getSshConfigFile();
    this.localUser = config.getLocalUser();
    this.socketStore = socketStore;
    this.healthChecker = healthChecker;
    this.registry = registry;
    this.deviceTypeCache = deviceTypeCache;
    this.clock = clock;
  }

  /**
   * Status of one target based on its socket and the quick health check.
   */
  public ConnectionStatus status(String target)
  {
    Path socket = socketStore.socketPath(target);
    boolean socketExists = socketStore.exists(socket);
    boolean healthy = socketExists && healthChecker.quickCheck(target);
    long connectedAt = socketExists ? socketStore.lastModifiedEpochSeconds(socket).orElse(0L) : 0L;
    return new ConnectionStatus(target, stateOf(socketExists, healthy), socketExists, healthy, connectedAt, socket);
  }

  /**
   * One line per registry row using the full health check. Rows without a socket are reported as disconnected.
   */
  public List<ConnectionDetail> listDetailed() throws RegistryIOException
  {
    List<ConnectionDetail> details = new ArrayList<>();
    for (RegistryEntry row : registry.listEntries())
    {
      String target = row.getTarget();
      boolean socketExists = socketStore.exists(socketStore.socketPathForId(row.getConnectionId()));
      boolean healthy = socketExists && healthChecker.fullCheck(target);
      String deviceType = deviceTypeCache.getValid(target).orElse(LibUtils.UNKNOWN);
      String registeredAt = LibUtils.formatEpochSeconds(row.getRegisteredAt(), clock.getZone());
      details.add(new ConnectionDetail(target, stateOf(socketExists, healthy), healthy, deviceType, registeredAt));
    }
    return details;
  }

  /**
   * Targets for every socket present. Sockets without a registry row are reported as unknown:connectionId.
   */
  public List<String> listActive() throws RegistryIOException
  {
    List<String> targets = new ArrayList<>();
    for (Map.Entry<String, Path> socket : socketStore.listSockets().entrySet())
    {
      Optional<String> target = registry.lookupTargetById(socket.getKey());
      targets.add(target.orElse(UNREGISTERED_PREFIX + socket.getKey()));
    }
    return targets;
  }

  /**
   * Hosts declared in the ssh client configuration file with their connection state. Missing HostName, User and
   * Port default to the alias, the local user and 22. The device type is only looked up for connected hosts.
   * @return hosts in file order, empty when the file is missing or unreadable
   */
  public List<ConfiguredHost> listConfiguredHosts()
  {
    List<ConfiguredHost> hosts = new ArrayList<>();
    if (!Files.isRegularFile(sshConfigFile))
    {
      log.debug(LibUtils.getMsg("HOSTLINK_SSH_CONFIG_MISSING", sshConfigFile));
      return hosts;
    }
    List<String> lines;
    try
    {
      lines = Files.readAllLines(sshConfigFile, StandardCharsets.UTF_8);
    }
    catch (IOException e)
    {
      log.warn(LibUtils.getMsg("HOSTLINK_SSH_CONFIG_READ_ERR", sshConfigFile, e.getMessage()));
      return hosts;
    }

    for (HostBlock block : SshConfigParser.parse(lines))
    {
      String hostName = StringUtils.defaultIfBlank(block.getHostName(), block.getAlias());
      String user = StringUtils.defaultIfBlank(block.getUser(), localUser);
      int port = block.getPort() > 0 ? block.getPort() : SshTarget.DEFAULT_PORT;
      String target = user + "@" + hostName + (port == SshTarget.DEFAULT_PORT ? "" : ":" + port);

      ConnectionState state = ConnectionState.DISCONNECTED;
      String deviceType = LibUtils.UNKNOWN;
      if (!TargetParser.isValid(target))
      {
        log.debug(LibUtils.getMsg("HOSTLINK_SSH_CONFIG_BAD_TARGET", block.getAlias(), target));
      }
      else if (socketStore.exists(target))
      {
        boolean healthy = healthChecker.quickCheck(target);
        state = stateOf(true, healthy);
        if (healthy) deviceType = deviceTypeCache.getValid(target).orElse(LibUtils.UNKNOWN);
      }
      hosts.add(new ConfiguredHost(block.getAlias(), hostName, port, user, target, state, deviceType));
    }
    return hosts;
  }

  private static ConnectionState stateOf(boolean socketExists, boolean healthy)
  {
    if (!socketExists) return ConnectionState.DISCONNECTED;
    return healthy ? ConnectionState.CONNECTED : ConnectionState.STALE;
  }
}
