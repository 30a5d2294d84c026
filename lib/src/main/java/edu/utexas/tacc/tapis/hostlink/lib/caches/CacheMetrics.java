package edu.utexas.tacc.tapis.hostlink.lib.caches;

import java.util.concurrent.atomic.AtomicLong;

import org.jvnet.hk2.annotations.Service;

/*
 * Hit, miss and write counters for the device type cache.
 * Counters are per instance and are not persisted. The cache holds one instance, injected so tests can inspect it.
 */
@Service
public class CacheMetrics
{
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong writes = new AtomicLong();

  void recordHit() { hits.incrementAndGet(); }
  void recordMiss() { misses.incrementAndGet(); }
  void recordWrite() { writes.incrementAndGet(); }

  public Snapshot snapshot()
  {
    return new Snapshot(hits.get(), misses.get(), writes.get());
  }

  public void reset()
  {
    hits.set(0);
    misses.set(0);
    writes.set(0);
  }

  /*
   * Point in time copy of the counters.
   */
  public static class Snapshot
  {
    private final long hits;
    private final long misses;
    private final long writes;

    Snapshot(long hits1, long misses1, long writes1)
    {
      hits = hits1;
      misses = misses1;
      writes = writes1;
    }

    public long getHits() { return hits; }
    public long getMisses() { return misses; }
    public long getWrites() { return writes; }
    public long getTotalRequests() { return hits + misses; }

    /**
     * Hits as a percentage of lookups, 0 when there have been no lookups.
     */
    public double getHitRatePercent()
    {
      long total = getTotalRequests();
      return total == 0 ? 0.0 : (hits * 100.0) / total;
    }

    @Override
    public String toString()
    {
      return String.format("hits=%d misses=%d writes=%d total_requests=%d hit_rate=%.1f%%",
                           hits, misses, writes, getTotalRequests(), getHitRatePercent());
    }
  }
}
