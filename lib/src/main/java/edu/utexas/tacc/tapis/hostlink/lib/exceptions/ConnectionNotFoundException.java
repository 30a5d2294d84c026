package edu.utexas.tacc.tapis.hostlink.lib.exceptions;

/*
 * No control socket exists for the target, or no target could be resolved.
 */
public class ConnectionNotFoundException extends HostLinkException {
  public ConnectionNotFoundException(String message) {
    super(message);
  }

  public ConnectionNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
