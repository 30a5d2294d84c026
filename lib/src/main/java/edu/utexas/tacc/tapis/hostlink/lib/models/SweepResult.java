package edu.utexas.tacc.tapis.hostlink.lib.models;

public class SweepResult
{
  public static final SweepResult EMPTY = new SweepResult(0, 0);

  private final int socketsRemoved;
  private final int rowsRemoved;

  public SweepResult(int socketsRemoved1, int rowsRemoved1)
  {
    socketsRemoved = socketsRemoved1;
    rowsRemoved = rowsRemoved1;
  }

  public int getSocketsRemoved() { return socketsRemoved; }
  public int getRowsRemoved() { return rowsRemoved; }
  public int getTotalRemoved() { return socketsRemoved + rowsRemoved; }
}
