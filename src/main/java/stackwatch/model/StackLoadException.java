package stackwatch.model;

import java.nio.file.Path;

/** Thrown when a template (or one of its nested templates) cannot be loaded. */
public class StackLoadException extends Exception {

  private static final long serialVersionUID = 1L;
  private final Path template;

  public StackLoadException(Path template, String message) {
    super(message + ": " + template);
    this.template = template;
  }

  public StackLoadException(Path template, String message, Throwable cause) {
    super(message + ": " + template, cause);
    this.template = template;
  }

  public Path getTemplate() {
    return template;
  }

}
