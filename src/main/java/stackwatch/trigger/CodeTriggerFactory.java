package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;

import stackwatch.PathRules;
import stackwatch.model.ResourceIdentifier;
import stackwatch.model.ResourceTypes;
import stackwatch.model.Stack;
import stackwatch.model.Stacks;

/**
 * Creates the right {@link CodeResourceTrigger} for a resource, based on its type.
 *
 * Supporting a new resource type is one more entry in {@link #creators}.
 */
public class CodeTriggerFactory {

  private static final Logger log = LoggerFactory.getLogger(CodeTriggerFactory.class);
  /** Never watch our own build/cache output. */
  public static final String AWS_SAM_FOLDER = ".aws-sam";

  @FunctionalInterface
  private interface TriggerCreator {
    CodeResourceTrigger create(ResourceIdentifier id, String resourceType, Runnable onChange, PathRules excludes);
  }

  private final List<Stack> stacks;
  private final Path baseDir;
  private final Map<String, TriggerCreator> creators;

  public CodeTriggerFactory(List<Stack> stacks, Path baseDir) {
    this.stacks = stacks;
    this.baseDir = baseDir;
    TriggerCreator function = this::createFunctionTrigger;
    TriggerCreator layer = (id, type, onChange, excludes) -> new LambdaLayerCodeTrigger(id, stacks, baseDir, onChange, excludes);
    TriggerCreator definition = (id, type, onChange, excludes) -> new DefinitionCodeTrigger(id, type, stacks, baseDir, onChange);
    this.creators = ImmutableMap
      .<String, TriggerCreator> builder()
      .put(ResourceTypes.SERVERLESS_FUNCTION, function)
      .put(ResourceTypes.LAMBDA_FUNCTION, function)
      .put(ResourceTypes.SERVERLESS_LAYER_VERSION, layer)
      .put(ResourceTypes.LAMBDA_LAYER_VERSION, layer)
      .put(ResourceTypes.SERVERLESS_API, definition)
      .put(ResourceTypes.APIGATEWAY_REST_API, definition)
      .put(ResourceTypes.SERVERLESS_HTTP_API, definition)
      .put(ResourceTypes.APIGATEWAY_V2_API, definition)
      .put(ResourceTypes.SERVERLESS_STATE_MACHINE, definition)
      .put(ResourceTypes.STEPFUNCTIONS_STATE_MACHINE, definition)
      .build();
  }

  public CodeResourceTrigger createTrigger(ResourceIdentifier id, Runnable onChange) {
    return createTrigger(id, onChange, new PathRules());
  }

  /**
   * @param extraExcludes patterns to ignore, relative to the watched directory, on top of {@code .aws-sam}
   * @return the trigger, or null if we don't watch resources of this type
   * @throws ResourceNotFoundException if the resource is not in the stacks
   * @throws TriggerSetupException if the resource has no local path to watch
   */
  public CodeResourceTrigger createTrigger(ResourceIdentifier id, Runnable onChange, PathRules extraExcludes) {
    Optional<String> type = Stacks.getResourceType(stacks, id);
    if (!type.isPresent()) {
      if (!Stacks.getResourceById(stacks, id).isPresent()) {
        throw new ResourceNotFoundException(id);
      }
      return null;
    }
    TriggerCreator creator = creators.get(type.get());
    if (creator == null) {
      log.debug("No trigger for {} of type {}", id, type.get());
      return null;
    }
    PathRules excludes = new PathRules(AWS_SAM_FOLDER);
    for (String line : extraExcludes.getLines()) {
      excludes.addRule(line);
    }
    return creator.create(id, type.get(), onChange, excludes);
  }

  private CodeResourceTrigger createFunctionTrigger(ResourceIdentifier id, String type, Runnable onChange, PathRules excludes) {
    JsonNode resource = Stacks.getResourceById(stacks, id).orElseThrow(() -> new ResourceNotFoundException(id));
    if (ResourceTypes.IMAGE_PACKAGE_TYPE.equals(resource.path("Properties").path("PackageType").asText())) {
      return new LambdaImageCodeTrigger(id, stacks, baseDir, onChange, excludes);
    }
    return new LambdaZipCodeTrigger(id, stacks, baseDir, onChange, excludes);
  }

}
