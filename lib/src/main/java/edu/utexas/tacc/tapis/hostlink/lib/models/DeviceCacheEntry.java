package edu.utexas.tacc.tapis.hostlink.lib.models;

/*
 * Cached device classification for a target. One JSON object per cache file.
 *   timestamp - epoch seconds when the classification was saved
 *   method    - how it was obtained, for example rule, ai or manual
 *   version   - cache format version, entries with any other version are discarded
 */
public class DeviceCacheEntry
{
  private String deviceType;
  private Long timestamp;
  private String method;
  private String version;
  private String target;

  public DeviceCacheEntry() { }

  public DeviceCacheEntry(String deviceType1, long timestamp1, String method1, String version1, String target1)
  {
    deviceType = deviceType1;
    timestamp = timestamp1;
    method = method1;
    version = version1;
    target = target1;
  }

  public String getDeviceType() { return deviceType; }
  public void setDeviceType(String s) { deviceType = s; }

  public Long getTimestamp() { return timestamp; }
  public void setTimestamp(Long l) { timestamp = l; }

  public String getMethod() { return method; }
  public void setMethod(String s) { method = s; }

  public String getVersion() { return version; }
  public void setVersion(String s) { version = s; }

  public String getTarget() { return target; }
  public void setTarget(String s) { target = s; }

  @Override
  public String toString()
  {
    return String.format("DeviceCacheEntry[target=%s, deviceType=%s, method=%s, timestamp=%s, version=%s]",
                         target, deviceType, method, timestamp, version);
  }
}
