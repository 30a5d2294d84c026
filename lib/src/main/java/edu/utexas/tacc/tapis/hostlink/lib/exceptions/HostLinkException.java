package edu.utexas.tacc.tapis.hostlink.lib.exceptions;

/*
 * Base class for failures reported to callers of the connection and cache layer.
 */
public class HostLinkException extends Exception {
  public HostLinkException(String message) {
    super(message);
  }

  public HostLinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
