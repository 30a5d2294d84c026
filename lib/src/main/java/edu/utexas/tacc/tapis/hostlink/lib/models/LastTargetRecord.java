package edu.utexas.tacc.tapis.hostlink.lib.models;

/*
 * Single slot pointer to the most recently connected target.
 */
public class LastTargetRecord
{
  private String target;
  private long timestamp;

  public LastTargetRecord() { }

  public LastTargetRecord(String target1, long timestamp1)
  {
    target = target1;
    timestamp = timestamp1;
  }

  public String getTarget() { return target; }
  public void setTarget(String s) { target = s; }

  public long getTimestamp() { return timestamp; }
  public void setTimestamp(long l) { timestamp = l; }
}
