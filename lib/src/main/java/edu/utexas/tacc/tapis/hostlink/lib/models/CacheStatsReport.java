package edu.utexas.tacc.tapis.hostlink.lib.models;

import java.nio.file.Path;

/*
 * Counts of cache files partitioned by validity, plus the settings they were judged against.
 */
public class CacheStatsReport
{
  private final int total;
  private final int valid;
  private final int expired;
  private final int invalid;
  private final Path cacheDir;
  private final long ttlSeconds;

  public CacheStatsReport(int total1, int valid1, int expired1, int invalid1, Path cacheDir1, long ttlSeconds1)
  {
    total = total1;
    valid = valid1;
    expired = expired1;
    invalid = invalid1;
    cacheDir = cacheDir1;
    ttlSeconds = ttlSeconds1;
  }

  public int getTotal() { return total; }
  public int getValid() { return valid; }
  public int getExpired() { return expired; }
  public int getInvalid() { return invalid; }
  public Path getCacheDir() { return cacheDir; }
  public long getTtlSeconds() { return ttlSeconds; }

  @Override
  public String toString()
  {
    return String.format("total=%d valid=%d expired=%d invalid=%d cache_dir=%s expiry_seconds=%d",
                         total, valid, expired, invalid, cacheDir, ttlSeconds);
  }
}
