package edu.utexas.tacc.tapis.hostlink.lib.models;

/*
 * Class containing results from running a command over a multiplexed session.
 * Output and exit code are passed through from the remote side unchanged.
 */
public class RemoteCommandResult
{
  // Exit code reported when a caller supplied timeout expires, following the timeout(1) convention
  public static final int TIMEOUT_EXIT_CODE = 124;

  private final String command;
  private final int exitCode;
  private final String stdOut;
  private final String stdErr;

  public RemoteCommandResult(String cmd1, int exitStatus1, String stdOut1, String stdErr1)
  {
    command = cmd1;
    exitCode = exitStatus1;
    stdOut = stdOut1;
    stdErr = stdErr1;
  }

  public String getCommand() { return command; }
  public int getExitCode() { return exitCode; }
  public String getStdOut() { return stdOut; }
  public String getStdErr() { return stdErr; }
  public boolean isSuccess() { return exitCode == 0; }

  @Override
  public String toString()
  {
    return String.format("Command: %s%n ExitCode: %d%n StdOut: %s%n StdErr: %s%n", command, exitCode, stdOut, stdErr);
  }
}
