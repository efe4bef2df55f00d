package stackwatch.trigger;

/**
 * Base class for failures creating a trigger for one resource.
 *
 * Callers catch these per resource, log them, and carry on with the other resources.
 */
public abstract class TriggerSetupException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  protected TriggerSetupException(String message) {
    super(message);
  }

  protected TriggerSetupException(String message, Throwable cause) {
    super(message, cause);
  }

}
