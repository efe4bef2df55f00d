package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import stackwatch.model.ResourceIdentifier;
import stackwatch.model.ResourceTypes;
import stackwatch.model.Stack;
import stackwatch.model.Stacks;

/**
 * Base class for triggers that watch the local files of one resource in the template.
 */
public abstract class CodeResourceTrigger extends ResourceTrigger {

  protected final ResourceIdentifier resourceIdentifier;
  protected final JsonNode resource;
  protected final Runnable onChange;
  private final List<Stack> stacks;
  private final Path baseDir;

  /**
   * @param baseDir the directory relative paths in the root template are resolved against, usually the template's directory
   * @throws ResourceNotFoundException if {@code resourceIdentifier} is not in {@code stacks}
   */
  protected CodeResourceTrigger(ResourceIdentifier resourceIdentifier, List<Stack> stacks, Path baseDir, Runnable onChange) {
    this.resourceIdentifier = resourceIdentifier;
    this.resource = Stacks.getResourceById(stacks, resourceIdentifier).orElseThrow(() -> new ResourceNotFoundException(resourceIdentifier));
    this.stacks = stacks;
    this.baseDir = baseDir;
    this.onChange = onChange;
  }

  public ResourceIdentifier getResourceIdentifier() {
    return resourceIdentifier;
  }

  /** @return the local path in {@code property}, if it is a string and not an S3/HTTP location */
  protected Optional<String> getLocalPathProperty(JsonNode node, String property) {
    JsonNode value = node.path(property);
    if (value.isTextual() && ResourceTypes.isLocalPath(value.asText())) {
      return Optional.of(value.asText());
    }
    return Optional.empty();
  }

  /** Resolves {@code path} against the base directory, or a nested stack's own template directory. */
  protected Path resolve(String path) {
    Optional<Stack> stack = Stacks.getStackOf(stacks, resourceIdentifier);
    if (stack.isPresent() && !stack.get().isRootStack()) {
      return stack.get().getLocation().getParent().resolve(path).normalize();
    }
    return baseDir.resolve(path).toAbsolutePath().normalize();
  }

}
