package edu.utexas.tacc.tapis.hostlink.lib.exceptions;

/*
 * A cache file could not be decoded. Only used inside the cache, callers see a miss.
 */
public class CacheCorruptException extends HostLinkException {
  public CacheCorruptException(String message) {
    super(message);
  }

  public CacheCorruptException(String message, Throwable cause) {
    super(message, cause);
  }
}
