package edu.utexas.tacc.tapis.hostlink.lib.exceptions;

/*
 * A cache or last-target file could not be written. Prior content is left untouched.
 */
public class CacheWriteFailedException extends HostLinkException {
  public CacheWriteFailedException(String message) {
    super(message);
  }

  public CacheWriteFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
