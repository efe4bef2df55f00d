package stackwatch.trigger;

import stackwatch.model.ResourceIdentifier;

/** The resource has no local code (or layer content) directory to watch, e.g. its code lives in S3. */
public class MissingCodeUriException extends TriggerSetupException {

  private static final long serialVersionUID = 1L;
  private final ResourceIdentifier resourceIdentifier;

  public MissingCodeUriException(ResourceIdentifier resourceIdentifier) {
    super("Cannot find a local code location for " + resourceIdentifier);
    this.resourceIdentifier = resourceIdentifier;
  }

  public ResourceIdentifier getResourceIdentifier() {
    return resourceIdentifier;
  }

}
