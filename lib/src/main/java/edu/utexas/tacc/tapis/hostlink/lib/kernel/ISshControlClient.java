package edu.utexas.tacc.tapis.hostlink.lib.kernel;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import edu.utexas.tacc.tapis.hostlink.lib.models.RemoteCommandResult;
import edu.utexas.tacc.tapis.hostlink.lib.models.SshTarget;

/*
 * Operations against the installed ssh client running in ControlMaster mode.
 * The ssh protocol itself is never implemented here, every call shells out to the client binary.
 */
public interface ISshControlClient
{
  /**
   * Launch a persistent master session bound to the given control socket. Does not wait for it to come up.
   * @throws IOException if the client binary cannot be started
   */
  void startMaster(SshTarget target, Path controlSocket) throws IOException;

  /**
   * Ask the master behind the socket whether it is alive (ssh -O check).
   * Never throws, any failure or timeout is reported as false.
   */
  boolean check(SshTarget target, Path controlSocket, Duration timeout);

  /**
   * Ask the master behind the socket to shut down (ssh -O exit).
   * Never throws, any failure is reported as false.
   */
  boolean exit(SshTarget target, Path controlSocket);

  /**
   * Run a command through the master session.
   * @param timeout null to wait until the command finishes
   * @throws IOException if the client binary cannot be started or its output cannot be read
   */
  RemoteCommandResult exec(SshTarget target, Path controlSocket, String command, Duration timeout)
          throws IOException, InterruptedException;

  /**
   * Whether any local process currently holds the file open. When this cannot be determined the answer is true
   *   so that callers leave the file alone.
   */
  boolean isInUse(Path controlSocket);
}
