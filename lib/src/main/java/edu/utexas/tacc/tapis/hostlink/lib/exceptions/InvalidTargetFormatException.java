package edu.utexas.tacc.tapis.hostlink.lib.exceptions;

/*
 * Target string is not of the form user@host[:port].
 */
public class InvalidTargetFormatException extends HostLinkException {
  public InvalidTargetFormatException(String message) {
    super(message);
  }

  public InvalidTargetFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
