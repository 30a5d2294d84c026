package edu.utexas.tacc.tapis.hostlink.lib.exceptions;

/*
 * The master session did not become healthy within the readiness budget.
 */
public class ConnectionTimeoutException extends HostLinkException {
  public ConnectionTimeoutException(String message) {
    super(message);
  }

  public ConnectionTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
