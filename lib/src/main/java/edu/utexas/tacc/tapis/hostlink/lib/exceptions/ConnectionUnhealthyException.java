package edu.utexas.tacc.tapis.hostlink.lib.exceptions;

/*
 * A control socket exists but the master session does not answer a check.
 */
public class ConnectionUnhealthyException extends HostLinkException {
  public ConnectionUnhealthyException(String message) {
    super(message);
  }

  public ConnectionUnhealthyException(String message, Throwable cause) {
    super(message, cause);
  }
}
