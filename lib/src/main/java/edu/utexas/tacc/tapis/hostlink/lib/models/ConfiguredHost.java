package edu.utexas.tacc.tapis.hostlink.lib.models;

/*
 * One Host block from the user's ssh client configuration together with its current connection state.
 * target is the user@hostName[:port] string used for every other operation, the port is left out when it is 22.
 */
public class ConfiguredHost
{
  private final String alias;
  private final String hostName;
  private final int port;
  private final String user;
  private final String target;
  private final ConnectionState state;
  private final String deviceType;

  public ConfiguredHost(String alias1, String hostName1, int port1, String user1, String target1,
                        ConnectionState state1, String deviceType1)
  {
    alias = alias1;
    hostName = hostName1;
    port = port1;
    user = user1;
    target = target1;
    state = state1;
    deviceType = deviceType1;
  }

  public String getAlias() { return alias; }
  public String getHostName() { return hostName; }
  public int getPort() { return port; }
  public String getUser() { return user; }
  public String getTarget() { return target; }
  public ConnectionState getState() { return state; }
  public String getDeviceType() { return deviceType; }
  public boolean isConnected() { return state == ConnectionState.CONNECTED; }

  @Override
  public String toString()
  {
    return String.join(" ", alias, target, state.name(), deviceType);
  }
}
