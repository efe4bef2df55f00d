package stackwatch.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Parses YAML/JSON templates from disk, following nested applications and stacks
 * whose location is a local file.
 *
 * CloudFormation short-form tags like {@code !Ref} are read as their plain values,
 * which is all the watch engine needs to find local paths.
 */
public class TemplateStackProvider implements StackProvider {

  private static final Logger log = LoggerFactory.getLogger(TemplateStackProvider.class);
  private static final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

  @Override
  public List<Stack> loadStacks(Path template, Map<String, String> parameterOverrides) throws StackLoadException {
    List<Stack> stacks = new ArrayList<>();
    loadStack(stacks, "", "", template.toAbsolutePath().normalize(), parameterOverrides, null, new HashSet<>());
    return stacks;
  }

  /** Parses {@code template}, without following nested stacks. */
  public static JsonNode readTemplate(Path template) throws StackLoadException {
    if (!Files.isRegularFile(template)) {
      throw new StackLoadException(template, "Template not found");
    }
    JsonNode node;
    try {
      node = yaml.readTree(template.toFile());
    } catch (IOException e) {
      throw new StackLoadException(template, "Could not parse template", e);
    }
    if (node == null || !node.isObject()) {
      throw new StackLoadException(template, "Template is not a map");
    }
    return node;
  }

  private void loadStack(
    List<Stack> stacks,
    String parentStackPath,
    String name,
    Path location,
    Map<String, String> parameters,
    JsonNode metadata,
    Set<Path> ancestors) throws StackLoadException {
    if (!ancestors.add(location)) {
      throw new StackLoadException(location, "Nested stack cycle");
    }
    JsonNode template = readTemplate(location);
    Stack stack = new Stack(parentStackPath, name, location, parameters, template, metadata);
    stacks.add(stack);
    for (Map.Entry<String, JsonNode> e : stack.getResources().entrySet()) {
      JsonNode resource = e.getValue();
      String type = resource.path("Type").asText("");
      if (!type.equals(ResourceTypes.SERVERLESS_APPLICATION) && !type.equals(ResourceTypes.CLOUDFORMATION_STACK)) {
        continue;
      }
      String property = ResourceTypes.RESOURCES_WITH_LOCAL_PATHS.get(type).get(0);
      JsonNode childLocation = resource.path("Properties").path(property);
      if (!childLocation.isTextual() || !ResourceTypes.isLocalPath(childLocation.asText())) {
        log.debug("Skipping nested stack {} with non-local {}", e.getKey(), property);
        continue;
      }
      Path childPath = location.getParent().resolve(childLocation.asText()).normalize();
      loadStack(
        stacks,
        stack.getStackPath(),
        e.getKey(),
        childPath,
        parameters,
        resource.path("Metadata").isObject() ? resource.path("Metadata") : null,
        ancestors);
    }
    ancestors.remove(location);
  }

}
