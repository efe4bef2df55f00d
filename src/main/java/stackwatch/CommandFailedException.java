package stackwatch;

/** An external command exited with a non-zero code. */
public class CommandFailedException extends RuntimeException {

  private static final long serialVersionUID = 1L;
  private final String command;
  private final int exitCode;

  public CommandFailedException(String command, int exitCode) {
    super("Command failed with exit code " + exitCode + ": " + command);
    this.command = command;
    this.exitCode = exitCode;
  }

  public String getCommand() {
    return command;
  }

  public int getExitCode() {
    return exitCode;
  }

}
