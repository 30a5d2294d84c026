package edu.utexas.tacc.tapis.hostlink.lib.exceptions;

/*
 * The connection registry file could not be read, locked or rewritten.
 */
public class RegistryIOException extends HostLinkException {
  public RegistryIOException(String message) {
    super(message);
  }

  public RegistryIOException(String message, Throwable cause) {
    super(message, cause);
  }
}
