package edu.utexas.tacc.tapis.hostlink.lib.services;

import java.util.Optional;
import java.util.regex.Pattern;
import javax.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.caches.DeviceTypeCache;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.CacheWriteFailedException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionNotFoundException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionUnhealthyException;
import edu.utexas.tacc.tapis.hostlink.lib.exceptions.InvalidTargetFormatException;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;

/*
 * Device type lookup, manual override and detection, all backed by the DeviceTypeCache.
 *
 * Device types are free form labels such as linux, ubuntu-22.04 or cisco-ios. They are normalized to lower case
 *   and must match [a-z0-9._-]{1,50} before they are cached.
 */
@Service
public class DeviceTypeService
{
  private static final Logger log = LoggerFactory.getLogger(DeviceTypeService.class);

  public static final String METHOD_MANUAL = "manual";
  public static final String METHOD_RULE = "rule";

  private static final Pattern VALID_TYPE = Pattern.compile("[a-z0-9._-]{1,50}");

  private final DeviceTypeCache cache;
  private final DeviceTypeDetector detector;

  @Inject
  public DeviceTypeService(DeviceTypeCache cache, DeviceTypeDetector detector)
  {
    this.cache = cache;
    this.detector = detector;
  }

  /**
   * Lower case, line breaks removed, trimmed. Blank input and the literal null become unknown.
   */
  public static String normalize(String raw)
  {
    if (raw == null) return LibUtils.UNKNOWN;
    String s = StringUtils.remove(StringUtils.remove(raw, '\r'), '\n').trim().toLowerCase();
    if (s.isEmpty() || "null".equals(s)) return LibUtils.UNKNOWN;
    return s;
  }

  public static boolean isValid(String deviceType)
  {
    return deviceType != null && VALID_TYPE.matcher(deviceType).matches();
  }

  public Optional<String> getCached(String target)
  {
    return cache.getValid(target);
  }

  /**
   * Record a device type supplied by the user.
   * @return the normalized type that was stored
   * @throws IllegalArgumentException if the normalized type is not a valid label
   */
  public String setManual(String target, String rawType) throws CacheWriteFailedException
  {
    String type = normalize(rawType);
    if (!isValid(type))
      throw new IllegalArgumentException(LibUtils.getMsg("HOSTLINK_DEVICE_TYPE_INVALID", rawType));
    cache.save(target, type, METHOD_MANUAL);
    log.info(LibUtils.getMsg("HOSTLINK_DEVICE_TYPE_SET", target, type, METHOD_MANUAL));
    return type;
  }

  public boolean clear(String target) throws CacheWriteFailedException
  {
    return cache.clear(target);
  }

  /**
   * Device type for a connected target. A valid cached value is returned unless force is set, otherwise the
   * rule based detector runs and its answer is cached.
   * @return empty when no rule matched and the type must be supplied manually
   */
  public Optional<String> detect(String target, boolean force)
          throws InvalidTargetFormatException, ConnectionNotFoundException, ConnectionUnhealthyException,
                 CacheWriteFailedException, InterruptedException
  {
    if (!force)
    {
      Optional<String> cached = cache.getValid(target);
      if (cached.isPresent()) return cached;
    }
    String type = normalize(detector.detect(target));
    if (LibUtils.UNKNOWN.equals(type) || !isValid(type))
    {
      log.info(LibUtils.getMsg("HOSTLINK_DEVICE_TYPE_UNDETECTED", target));
      return Optional.empty();
    }
    cache.save(target, type, METHOD_RULE);
    log.info(LibUtils.getMsg("HOSTLINK_DEVICE_TYPE_SET", target, type, METHOD_RULE));
    return Optional.of(type);
  }
}
