package edu.utexas.tacc.tapis.hostlink.lib.models;

import java.util.Comparator;
import java.util.Objects;

/*
 * One row of the connection registry. Serialized as a single JSON line.
 * registeredAt is in epoch seconds.
 */
public class RegistryEntry
{
  // Oldest first. Used with a stable sort over file order, so rows registered in the same second keep the
  // order they were written in.
  public static final Comparator<RegistryEntry> OLDEST_FIRST = Comparator.comparingLong(RegistryEntry::getRegisteredAt);

  private String connectionId;
  private String target;
  private long registeredAt;

  public RegistryEntry() { }

  public RegistryEntry(String connectionId1, String target1, long registeredAt1)
  {
    connectionId = connectionId1;
    target = target1;
    registeredAt = registeredAt1;
  }

  public String getConnectionId() { return connectionId; }
  public void setConnectionId(String s) { connectionId = s; }

  public String getTarget() { return target; }
  public void setTarget(String s) { target = s; }

  public long getRegisteredAt() { return registeredAt; }
  public void setRegisteredAt(long l) { registeredAt = l; }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    RegistryEntry that = (RegistryEntry) o;
    return registeredAt == that.registeredAt && Objects.equals(connectionId, that.connectionId)
            && Objects.equals(target, that.target);
  }

  @Override
  public int hashCode() { return Objects.hash(connectionId, target, registeredAt); }

  @Override
  public String toString()
  {
    return String.format("RegistryEntry[id=%s, target=%s, registeredAt=%d]", connectionId, target, registeredAt);
  }
}
