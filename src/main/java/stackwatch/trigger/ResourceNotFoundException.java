package stackwatch.trigger;

import stackwatch.model.ResourceIdentifier;

public class ResourceNotFoundException extends TriggerSetupException {

  private static final long serialVersionUID = 1L;
  private final ResourceIdentifier resourceIdentifier;

  public ResourceNotFoundException(ResourceIdentifier resourceIdentifier) {
    super("Cannot find resource " + resourceIdentifier + " in the template");
    this.resourceIdentifier = resourceIdentifier;
  }

  public ResourceIdentifier getResourceIdentifier() {
    return resourceIdentifier;
  }

}
