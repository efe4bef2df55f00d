package stackwatch.sync;

import stackwatch.model.ResourceIdentifier;

/** The deployed stack does not have a resource the flow expected, so an infra sync has to create it first. */
public class MissingPhysicalResourceException extends RuntimeException {

  private static final long serialVersionUID = 1L;
  private final ResourceIdentifier resourceIdentifier;

  public MissingPhysicalResourceException(ResourceIdentifier resourceIdentifier) {
    super("Cannot find " + resourceIdentifier + " in the deployed stack");
    this.resourceIdentifier = resourceIdentifier;
  }

  public ResourceIdentifier getResourceIdentifier() {
    return resourceIdentifier;
  }

}
