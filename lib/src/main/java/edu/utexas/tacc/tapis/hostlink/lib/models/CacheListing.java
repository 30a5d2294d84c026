package edu.utexas.tacc.tapis.hostlink.lib.models;

public class CacheListing
{
  private final String target;
  private final String deviceType;
  private final String method;
  private final long ageSeconds;
  private final boolean expired;

  public CacheListing(String target1, String deviceType1, String method1, long ageSeconds1, boolean expired1)
  {
    target = target1;
    deviceType = deviceType1;
    method = method1;
    ageSeconds = ageSeconds1;
    expired = expired1;
  }

  public String getTarget() { return target; }
  public String getDeviceType() { return deviceType; }
  public String getMethod() { return method; }
  public long getAgeSeconds() { return ageSeconds; }
  public boolean isExpired() { return expired; }
}
