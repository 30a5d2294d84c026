package edu.utexas.tacc.tapis.hostlink.lib.kernel;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;

import org.apache.commons.io.IOUtils;
import org.jvnet.hk2.annotations.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.models.RemoteCommandResult;
import edu.utexas.tacc.tapis.hostlink.lib.models.SshTarget;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;
import edu.utexas.tacc.tapis.hostlink.lib.workers.BackgroundTaskRunner;

/**
 * ISshControlClient backed by the OpenSSH client binary.
 *
 * The master is started with host key checking disabled since sessions are created unattended. The known hosts
 * file is pointed at /dev/null so unattended runs never write to, or get blocked by, the user's known_hosts.
 */
@Service
public class OpenSshControlClient implements ISshControlClient
{
  private static final Logger log = LoggerFactory.getLogger(OpenSshControlClient.class);

  // Indicates what to do if the server's host key changed or the server is unknown.
  private static final String STRICT_HOSTKEY_CHECKING_OPT = "StrictHostKeyChecking=no";
  private static final String KNOWN_HOSTS_OPT = "UserKnownHostsFile=/dev/null";
  private static final String LOG_LEVEL_OPT = "LogLevel=ERROR";
  private static final long EXIT_WAIT_SECONDS = 10;

  private final String sshBinary;
  private final String fuserBinary;
  private final int connectTimeoutSeconds;
  private final int checkTimeoutSeconds;
  private final int controlPersistSeconds;
  private final Executor drainExecutor;

  @Inject
  public OpenSshControlClient(IRuntimeConfig config, BackgroundTaskRunner taskRunner)
  {
    sshBinary = config.getSshBinary();
    fuserBinary = config.getFuserBinary();
    drainExecutor = taskRunner.getJobExecutor();
    connectTimeoutSeconds = config.getSshConnectTimeoutSeconds();
    checkTimeoutSeconds = config.getSshTimeoutSeconds();
    controlPersistSeconds = config.getSshControlPersistSeconds();
  }

  @Override
  public void startMaster(SshTarget target, Path controlSocket) throws IOException
  {
    List<String> cmd = new ArrayList<>();
    cmd.add(sshBinary);
    addOption(cmd, "ControlMaster=yes");
    addOption(cmd, "ControlPath=" + controlSocket);
    addOption(cmd, "ControlPersist=" + controlPersistSeconds);
    addOption(cmd, "ConnectTimeout=" + connectTimeoutSeconds);
    addOption(cmd, STRICT_HOSTKEY_CHECKING_OPT);
    addOption(cmd, KNOWN_HOSTS_OPT);
    addOption(cmd, LOG_LEVEL_OPT);
    cmd.add("-p");
    cmd.add(String.valueOf(target.getPort()));
    cmd.add("-N");
    cmd.add(target.getDestination());

    log.debug(LibUtils.getMsg("HOSTLINK_SSH_START_MASTER", target, controlSocket));
    ProcessBuilder pb = new ProcessBuilder(cmd);
    pb.redirectInput(ProcessBuilder.Redirect.from(nullFile()));
    pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
    pb.redirectError(ProcessBuilder.Redirect.DISCARD);
    // The master detaches itself once ControlPersist kicks in, so the handle is not kept.
    pb.start();
  }

  @Override
  public boolean check(SshTarget target, Path controlSocket, Duration timeout)
  {
    List<String> cmd = controlCommand(target, controlSocket, "check");
    return runQuietly(cmd, timeout);
  }

  @Override
  public boolean exit(SshTarget target, Path controlSocket)
  {
    List<String> cmd = controlCommand(target, controlSocket, "exit");
    return runQuietly(cmd, Duration.ofSeconds(EXIT_WAIT_SECONDS));
  }

  @Override
  public RemoteCommandResult exec(SshTarget target, Path controlSocket, String command, Duration timeout)
          throws IOException, InterruptedException
  {
    List<String> cmd = new ArrayList<>();
    cmd.add(sshBinary);
    addOption(cmd, "ControlPath=" + controlSocket);
    addOption(cmd, "ConnectTimeout=" + checkTimeoutSeconds);
    addOption(cmd, LOG_LEVEL_OPT);
    cmd.add("-p");
    cmd.add(String.valueOf(target.getPort()));
    cmd.add(target.getDestination());
    cmd.add(command);

    ProcessBuilder pb = new ProcessBuilder(cmd);
    pb.redirectInput(ProcessBuilder.Redirect.from(nullFile()));
    Process process = pb.start();
    // Drain both streams concurrently so a chatty command cannot block on a full pipe
    CompletableFuture<String> stdOut =
            CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), drainExecutor);
    CompletableFuture<String> stdErr =
            CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), drainExecutor);

    int exitCode;
    if (timeout == null)
    {
      exitCode = process.waitFor();
    }
    else if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS))
    {
      exitCode = process.exitValue();
    }
    else
    {
      log.warn(LibUtils.getMsg("HOSTLINK_SSH_EXEC_TIMEOUT", target, timeout.toSeconds(), command));
      process.destroyForcibly();
      exitCode = RemoteCommandResult.TIMEOUT_EXIT_CODE;
    }

    try
    {
      return new RemoteCommandResult(command, exitCode, stdOut.get(), stdErr.get());
    }
    catch (ExecutionException e)
    {
      throw new IOException(LibUtils.getMsg("HOSTLINK_SSH_EXEC_READ_ERR", target, command, e.getMessage()), e.getCause());
    }
  }

  @Override
  public boolean isInUse(Path controlSocket)
  {
    List<String> cmd = List.of(fuserBinary, controlSocket.toString());
    try
    {
      Process process = new ProcessBuilder(cmd).redirectErrorStream(true)
                                               .redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
      if (!process.waitFor(checkTimeoutSeconds, TimeUnit.SECONDS))
      {
        process.destroyForcibly();
        return true;
      }
      // fuser exits 0 when at least one process has the file open
      return process.exitValue() == 0;
    }
    catch (IOException e)
    {
      log.debug(LibUtils.getMsg("HOSTLINK_FUSER_UNAVAILABLE", controlSocket, e.getMessage()));
      return true;
    }
    catch (InterruptedException e)
    {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  /* **************************************************************************** */
  /*                               Private Methods                                */
  /* **************************************************************************** */

  private List<String> controlCommand(SshTarget target, Path controlSocket, String controlOp)
  {
    List<String> cmd = new ArrayList<>();
    cmd.add(sshBinary);
    addOption(cmd, "ControlPath=" + controlSocket);
    addOption(cmd, "ConnectTimeout=" + checkTimeoutSeconds);
    cmd.add("-O");
    cmd.add(controlOp);
    cmd.add("-p");
    cmd.add(String.valueOf(target.getPort()));
    cmd.add(target.getDestination());
    return cmd;
  }

  /*
   * Run a short control command, discarding output. Any failure maps to false.
   */
  private boolean runQuietly(List<String> cmd, Duration timeout)
  {
    Process process = null;
    try
    {
      process = new ProcessBuilder(cmd).redirectInput(ProcessBuilder.Redirect.from(nullFile()))
                                       .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                                       .redirectError(ProcessBuilder.Redirect.DISCARD).start();
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS))
      {
        log.debug(LibUtils.getMsg("HOSTLINK_SSH_CONTROL_TIMEOUT", String.join(" ", cmd), timeout.toSeconds()));
        process.destroyForcibly();
        return false;
      }
      return process.exitValue() == 0;
    }
    catch (IOException e)
    {
      log.debug(LibUtils.getMsg("HOSTLINK_SSH_CONTROL_ERR", String.join(" ", cmd), e.getMessage()));
      return false;
    }
    catch (InterruptedException e)
    {
      Thread.currentThread().interrupt();
      if (process != null) process.destroyForcibly();
      return false;
    }
  }

  private static String drain(InputStream in)
  {
    try (in)
    {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    }
    catch (IOException e)
    {
      throw new UncheckedIOException(e);
    }
  }

  private static void addOption(List<String> cmd, String opt)
  {
    cmd.add("-o");
    cmd.add(opt);
  }

  private static File nullFile()
  {
    return new File("/dev/null");
  }
}
