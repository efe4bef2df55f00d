package stackwatch.sync;

import stackwatch.model.ResourceIdentifier;

/** The flow found that its assumptions about the deployed stack are stale. */
public class InfraSyncRequiredException extends RuntimeException {

  private static final long serialVersionUID = 1L;
  private final ResourceIdentifier resourceIdentifier;
  private final String reason;

  public InfraSyncRequiredException(ResourceIdentifier resourceIdentifier, String reason) {
    super("Cannot code sync " + resourceIdentifier + ": " + reason);
    this.resourceIdentifier = resourceIdentifier;
    this.reason = reason;
  }

  public ResourceIdentifier getResourceIdentifier() {
    return resourceIdentifier;
  }

  public String getReason() {
    return reason;
  }

}
