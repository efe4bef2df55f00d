package stackwatch.trigger;

import stackwatch.model.ResourceIdentifier;

public class MissingLocalDefinitionException extends TriggerSetupException {

  private static final long serialVersionUID = 1L;
  private final ResourceIdentifier resourceIdentifier;
  private final String property;

  public MissingLocalDefinitionException(ResourceIdentifier resourceIdentifier, String property) {
    super("Resource " + resourceIdentifier + " does not have " + property + " pointing at a local file");
    this.resourceIdentifier = resourceIdentifier;
    this.property = property;
  }

  public ResourceIdentifier getResourceIdentifier() {
    return resourceIdentifier;
  }

  public String getProperty() {
    return property;
  }

}
