package stackwatch.trigger;

import java.nio.file.Path;

public class InvalidTemplateFileException extends TriggerSetupException {

  private static final long serialVersionUID = 1L;
  private final Path template;
  private final String stackName;

  public InvalidTemplateFileException(Path template, String stackName) {
    super("Template " + template + (stackName.isEmpty() ? "" : " for stack " + stackName) + " is not a valid template");
    this.template = template;
    this.stackName = stackName;
  }

  public Path getTemplate() {
    return template;
  }

  public String getStackName() {
    return stackName;
  }

}
