package edu.utexas.tacc.tapis.hostlink.lib.models;

import java.util.Objects;

/*
 * A parsed user@host[:port] target.
 * The raw string is kept as given since it, not the parsed form, is what keys sockets, registry rows and cache files.
 */
public class SshTarget
{
  public static final int DEFAULT_PORT = 22;

  private final String user;
  private final String host;
  private final int port;
  private final String raw;

  public SshTarget(String user1, String host1, int port1, String raw1)
  {
    user = user1;
    host = host1;
    port = port1;
    raw = raw1;
  }

  public String getUser() { return user; }
  public String getHost() { return host; }
  public int getPort() { return port; }
  public String getRaw() { return raw; }

  /*
   * user@host, the destination handed to the ssh client together with -p port
   */
  public String getDestination() { return user + "@" + host; }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SshTarget that = (SshTarget) o;
    return Objects.equals(raw, that.raw);
  }

  @Override
  public int hashCode() { return Objects.hash(raw); }

  @Override
  public String toString() { return raw; }
}
