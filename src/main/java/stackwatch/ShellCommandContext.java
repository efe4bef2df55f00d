package stackwatch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import org.apache.commons.lang3.SystemUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Runs a shell command in the project's base directory, with the user's terminal as its IO.
 *
 * Values that come from the template are passed in {@code environment}, never pasted into the command.
 */
public class ShellCommandContext implements CommandContext {

  private static final Logger log = LoggerFactory.getLogger(ShellCommandContext.class);
  private final Path workingDirectory;
  private final String command;
  private final Map<String, String> environment;

  public ShellCommandContext(Path workingDirectory, String command) {
    this(workingDirectory, command, ImmutableMap.of());
  }

  public ShellCommandContext(Path workingDirectory, String command, Map<String, String> environment) {
    this.workingDirectory = workingDirectory;
    this.command = command;
    this.environment = ImmutableMap.copyOf(environment);
  }

  /** @return a reference to the environment variable {@code name}, quoted for the shell we run commands with */
  public static String quotedVariable(String name) {
    return SystemUtils.IS_OS_WINDOWS ? "\"%" + name + "%\"" : "\"$" + name + "\"";
  }

  @Override
  public void setUp() {
    // the command reads its own inputs every time it runs
  }

  @Override
  public void run() throws IOException, InterruptedException {
    log.debug("Running {} in {} with {}", command, workingDirectory, environment);
    ImmutableList<String> args = SystemUtils.IS_OS_WINDOWS ? ImmutableList.of("cmd", "/c", command) : ImmutableList.of("sh", "-c", command);
    ProcessBuilder builder = new ProcessBuilder(args).directory(workingDirectory.toFile()).inheritIO();
    builder.environment().putAll(environment);
    Process process = builder.start();
    int exitCode;
    try {
      exitCode = process.waitFor();
    } catch (InterruptedException e) {
      process.destroy();
      throw e;
    }
    if (exitCode != 0) {
      throw new CommandFailedException(command, exitCode);
    }
  }

  public String getCommand() {
    return command;
  }

  public Map<String, String> getEnvironment() {
    return environment;
  }

  @Override
  public String toString() {
    return command;
  }

}
