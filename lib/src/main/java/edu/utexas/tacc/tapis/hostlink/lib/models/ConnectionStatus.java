package edu.utexas.tacc.tapis.hostlink.lib.models;

import java.nio.file.Path;

/*
 * Status of a single target as seen from its control socket.
 * connectedAt is the socket modification time in epoch seconds, or 0 when unknown.
 */
public class ConnectionStatus
{
  private final String target;
  private final ConnectionState state;
  private final boolean socketExists;
  private final boolean healthy;
  private final long connectedAt;
  private final Path controlSocket;

  public ConnectionStatus(String target1, ConnectionState state1, boolean socketExists1, boolean healthy1,
                          long connectedAt1, Path controlSocket1)
  {
    target = target1;
    state = state1;
    socketExists = socketExists1;
    healthy = healthy1;
    connectedAt = connectedAt1;
    controlSocket = controlSocket1;
  }

  public String getTarget() { return target; }
  public ConnectionState getState() { return state; }
  public boolean isSocketExists() { return socketExists; }
  public boolean isHealthy() { return healthy; }
  public long getConnectedAt() { return connectedAt; }
  public Path getControlSocket() { return controlSocket; }
}
