package edu.utexas.tacc.tapis.hostlink.lib.services;

import java.io.IOException;
import java.util.Optional;
import javax.inject.Inject;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionNotFoundException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionUnhealthyException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.InvalidTargetFormatException;
import edu.utexas.tacc.tapis.hostlink.lib.models.RemoteCommandResult;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;

/*
 * Rule based device classification from the output of a few commands run over an existing session.
 *
 * Commands, in order:
 *   uname -a      Linux (refined from os-release), FreeBSD, Darwin, Cygwin/MinGW/MSYS
 *   hostname      cisco, huawei, h3c name patterns
 *   show version  network operating system banners
 * The first command that yields a classification wins. A command that fails or exits non-zero is treated as no match.
 */
@Service
public class DeviceTypeDetector
{
  private static final Logger log = LoggerFactory.getLogger(DeviceTypeDetector.class);

  static final String UNAME_CMD = "uname -a";
  static final String OS_RELEASE_CMD = "cat /etc/os-release 2>/dev/null || cat /etc/openwrt_release 2>/dev/null";
  static final String HOSTNAME_CMD = "hostname";
  static final String SHOW_VERSION_CMD = "show version";

  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n").omitEmptyStrings().trimResults();

  private final ConnectionLifecycleManager lifecycleManager;

  @Inject
  public DeviceTypeDetector(ConnectionLifecycleManager lifecycleManager)
  {
    this.lifecycleManager = lifecycleManager;
  }

  /**
   * Classify the device behind an existing session.
   * @return device type, or unknown if no rule matched
   * @throws ConnectionNotFoundException if there is no session for the target
   * @throws ConnectionUnhealthyException if the session does not answer
   */
  public String detect(String target)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionUnhealthyException,
                 InterruptedException
  {
    Optional<String> uname = runQuiet(target, UNAME_CMD);
    if (uname.isPresent())
    {
      Optional<String> type = classifyUname(uname.get());
      if (type.isPresent())
      {
        if (!"linux".equals(type.get())) return type.get();
        return runQuiet(target, OS_RELEASE_CMD).flatMap(DeviceTypeDetector::classifyOsRelease).orElse("linux");
      }
    }

    Optional<String> type = runQuiet(target, HOSTNAME_CMD).flatMap(DeviceTypeDetector::classifyHostname);
    if (type.isPresent()) return type.get();

    type = runQuiet(target, SHOW_VERSION_CMD).flatMap(DeviceTypeDetector::classifyShowVersion);
    return type.orElse(LibUtils.UNKNOWN);
  }

  /* **************************************************************************** */
  /*                              Classification Rules                            */
  /* **************************************************************************** */

  static Optional<String> classifyUname(String out)
  {
    if (out.contains("Linux")) return Optional.of("linux");
    if (out.contains("FreeBSD")) return Optional.of("freebsd");
    if (out.contains("Darwin")) return Optional.of("macos");
    if (StringUtils.containsAny(out, "CYGWIN", "MINGW", "MSYS")) return Optional.of("windows");
    return Optional.empty();
  }

  /*
   * openwrt marker first, then ID, then NAME. Values that are not valid device types are ignored.
   */
  static Optional<String> classifyOsRelease(String out)
  {
    if (StringUtils.containsIgnoreCase(out, "openwrt")) return Optional.of("openwrt");
    String id = null, name = null;
    for (String line : LINE_SPLITTER.split(out))
    {
      if (id == null && line.startsWith("ID=")) id = releaseValue(line);
      else if (name == null && line.startsWith("NAME=")) name = releaseValue(line);
    }
    if (id != null && DeviceTypeService.isValid(id)) return Optional.of(id);
    if (name != null && DeviceTypeService.isValid(name)) return Optional.of(name);
    return Optional.empty();
  }

  static Optional<String> classifyHostname(String out)
  {
    if (StringUtils.containsAny(out, "cisco", "Cisco")) return Optional.of("cisco");
    if (StringUtils.containsAny(out, "huawei", "Huawei")) return Optional.of("huawei");
    if (StringUtils.containsAny(out, "h3c", "H3C")) return Optional.of("h3c");
    return Optional.empty();
  }

  static Optional<String> classifyShowVersion(String out)
  {
    if (out.contains("Cisco")) return Optional.of("cisco");
    if (out.contains("Huawei")) return Optional.of("huawei");
    if (out.contains("H3C")) return Optional.of("h3c");
    if (out.contains("Juniper")) return Optional.of("juniper");
    if (out.contains("Arista")) return Optional.of("arista");
    return Optional.empty();
  }

  /* **************************************************************************** */
  /*                               Private Methods                                */
  /* **************************************************************************** */

  private static String releaseValue(String line)
  {
    String value = StringUtils.substringAfter(line, "=");
    return StringUtils.remove(value, '"').toLowerCase();
  }

  /*
   * Standard output of a successful command. Empty if it failed to run or exited non-zero.
   */
  private Optional<String> runQuiet(String target, String command)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionUnhealthyException,
                 InterruptedException
  {
    try
    {
      RemoteCommandResult result = lifecycleManager.execute(target, command);
      if (!result.isSuccess())
      {
        log.debug(LibUtils.getMsg("HOSTLINK_DETECT_CMD_FAILED", target, command, result.getExitCode()));
        return Optional.empty();
      }
      return Optional.ofNullable(result.getStdOut());
    }
    catch (IOException e)
    {
      log.debug(LibUtils.getMsg("HOSTLINK_DETECT_CMD_FAILED", target, command, e.getMessage()));
      return Optional.empty();
    }
  }
}
