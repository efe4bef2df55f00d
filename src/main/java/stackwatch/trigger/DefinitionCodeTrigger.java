package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;

import stackwatch.model.ResourceIdentifier;
import stackwatch.model.ResourceTypes;
import stackwatch.model.Stack;
import stackwatch.observer.PathHandler;

/**
 * Watches the external definition file of an API or state machine, e.g. an OpenAPI document,
 * only firing when it parses and has materially changed.
 */
public class DefinitionCodeTrigger extends CodeResourceTrigger {

  private final Path definitionFile;
  private final DefinitionValidator validator;

  public DefinitionCodeTrigger(ResourceIdentifier id, String resourceType, List<Stack> stacks, Path baseDir, Runnable onChange) {
    super(id, stacks, baseDir, onChange);
    String property = ResourceTypes.RESOURCES_WITH_LOCAL_PATHS.get(resourceType).get(0);
    String file = getLocalPathProperty(resource.path("Properties"), property).orElseThrow(() -> new MissingLocalDefinitionException(id, property));
    this.definitionFile = resolve(file);
    this.validator = new DefinitionValidator(definitionFile);
  }

  public Path getDefinitionFile() {
    return definitionFile;
  }

  @Override
  public List<PathHandler> getPathHandlers() {
    return ImmutableList.of(singleFileHandler(definitionFile, this::onDefinitionChanged));
  }

  private void onDefinitionChanged() {
    if (validator.validateChange()) {
      onChange.run();
    }
  }

}
