package edu.utexas.tacc.tapis.hostlink.lib.kernel;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import javax.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.InvalidTargetFormatException;
import edu.utexas.tacc.tapis.hostlink.lib.models.SshTarget;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;
import edu.utexas.tacc.tapis.hostlink.lib.utils.TargetParser;

/*
 * Liveness checks for multiplexed sessions.
 *
 * fullCheck always does a control channel round trip.
 * quickCheck trusts a socket whose modification time is inside the freshness window and only falls back to
 *   fullCheck for older sockets. Callers that must be certain, for example before registering, use fullCheck.
 *
 * Neither check changes any state and neither throws. Every failure is reported as false.
 */
@Service
public class HealthChecker
{
  private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

  private final ControlSocketStore socketStore;
  private final ISshControlClient sshClient;
  private final Duration checkTimeout;
  private final long freshnessSeconds;

  @Inject
  public HealthChecker(ControlSocketStore socketStore, ISshControlClient sshClient, IRuntimeConfig config)
  {
    this.socketStore = socketStore;
    this.sshClient = sshClient;
    this.checkTimeout = Duration.ofSeconds(config.getSshTimeoutSeconds());
    this.freshnessSeconds = config.getQuickCheckFreshnessSeconds();
  }

  public boolean fullCheck(String target)
  {
    if (StringUtils.isBlank(target)) return false;
    Path socket = socketStore.socketPath(target);
    if (!socketStore.exists(socket)) return false;
    Optional<SshTarget> sshTarget = parseQuietly(target);
    if (sshTarget.isEmpty()) return false;
    try
    {
      boolean alive = sshClient.check(sshTarget.get(), socket, checkTimeout);
      log.debug(LibUtils.getMsg("HOSTLINK_HEALTH_FULL", target, alive));
      return alive;
    }
    catch (RuntimeException e)
    {
      log.debug(LibUtils.getMsg("HOSTLINK_HEALTH_CHECK_ERR", target, e.getMessage()));
      return false;
    }
  }

  public boolean quickCheck(String target)
  {
    if (StringUtils.isBlank(target)) return false;
    Path socket = socketStore.socketPath(target);
    if (!socketStore.exists(socket)) return false;
    Optional<Long> age = socketStore.ageSeconds(socket);
    if (age.isPresent() && age.get() <= freshnessSeconds)
    {
      log.debug(LibUtils.getMsg("HOSTLINK_HEALTH_QUICK_FRESH", target, age.get()));
      return true;
    }
    return fullCheck(target);
  }

  private static Optional<SshTarget> parseQuietly(String target)
  {
    try
    {
      return Optional.of(TargetParser.parse(target));
    }
    catch (InvalidTargetFormatException e)
    {
      log.debug(e.getMessage());
      return Optional.empty();
    }
  }
}
