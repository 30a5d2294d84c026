package edu.utexas.tacc.tapis.hostlink.lib.models;

/*
 * One line of the detailed connection listing, built from a registry row.
 */
public class ConnectionDetail
{
  private final String target;
  private final ConnectionState state;
  private final boolean healthy;
  private final String deviceType;
  private final String registeredAt;

  public ConnectionDetail(String target1, ConnectionState state1, boolean healthy1, String deviceType1,
                          String registeredAt1)
  {
    target = target1;
    state = state1;
    healthy = healthy1;
    deviceType = deviceType1;
    registeredAt = registeredAt1;
  }

  public String getTarget() { return target; }
  public ConnectionState getState() { return state; }
  public boolean isHealthy() { return healthy; }
  public String getDeviceType() { return deviceType; }
  public String getRegisteredAt() { return registeredAt; }

  @Override
  public String toString()
  {
    return String.join(" ", target, state.name(), String.valueOf(healthy), deviceType, registeredAt);
  }
}
