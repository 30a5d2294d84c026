package edu.utexas.tacc.tapis.hostlink.lib.utils;

import org.apache.commons.lang3.StringUtils;

import edu.utexas.tacc.tapis.hostlink.lib.exceptions.InvalidTargetFormatException;
import edu.utexas.tacc.tapis.hostlink.lib.models.SshTarget;

/*
 * Validates and decomposes user@host[:port] target strings.
 * This class is non-instantiable and has no side effects.
 */
public final class TargetParser
{
  private static final int MIN_PORT = 1;
  private static final int MAX_PORT = 65535;

  private TargetParser() { throw new AssertionError(); }

  /**
   * Parse a target string. The raw string is preserved in the result exactly as given.
   * @param target user@host[:port]
   * @return parsed target
   * @throws InvalidTargetFormatException on multiple or missing @, empty user or host, bad port
   */
  public static SshTarget parse(String target) throws InvalidTargetFormatException
  {
    if (StringUtils.isBlank(target))
      throw new InvalidTargetFormatException(LibUtils.getMsg("HOSTLINK_TARGET_EMPTY"));

    if (StringUtils.countMatches(target, '@') != 1)
      throw new InvalidTargetFormatException(LibUtils.getMsg("HOSTLINK_TARGET_AT_COUNT", target));

    String user = StringUtils.substringBefore(target, "@");
    String hostPart = StringUtils.substringAfter(target, "@");
    String host = hostPart;
    int port = SshTarget.DEFAULT_PORT;

    if (hostPart.contains(":"))
    {
      host = StringUtils.substringBeforeLast(hostPart, ":");
      String portStr = StringUtils.substringAfterLast(hostPart, ":");
      port = parsePort(target, portStr);
    }

    if (StringUtils.isBlank(user))
      throw new InvalidTargetFormatException(LibUtils.getMsg("HOSTLINK_TARGET_EMPTY_USER", target));
    if (StringUtils.isBlank(host) || host.contains(":"))
      throw new InvalidTargetFormatException(LibUtils.getMsg("HOSTLINK_TARGET_BAD_HOST", target));

    return new SshTarget(user, host, port, target);
  }

  /*
   * Quick validity check for callers that only need a yes or no.
   */
  public static boolean isValid(String target)
  {
    try
    {
      parse(target);
      return true;
    }
    catch (InvalidTargetFormatException e)
    {
      return false;
    }
  }

  private static int parsePort(String target, String portStr) throws InvalidTargetFormatException
  {
    // Digits only, so signs and whitespace are rejected. Length check keeps parseInt from overflowing.
    if (!StringUtils.isNumeric(portStr) || portStr.length() > 5)
      throw new InvalidTargetFormatException(LibUtils.getMsg("HOSTLINK_TARGET_BAD_PORT", target, portStr));
    int port = Integer.parseInt(portStr);
    if (port < MIN_PORT || port > MAX_PORT)
      throw new InvalidTargetFormatException(LibUtils.getMsg("HOSTLINK_TARGET_BAD_PORT", target, portStr));
    return port;
  }
}
