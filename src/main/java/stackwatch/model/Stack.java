package stackwatch.model;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * One parsed template: the root template, or a nested application/stack it references.
 *
 * Instances are a snapshot of the template as it was when loaded; callers re-load via
 * {@link StackProvider} when they want to see changes.
 */
public final class Stack {

  public static final String SAM_RESOURCE_ID_KEY = "SamResourceId";
  private final String parentStackPath;
  private final String name;
  private final Path location;
  private final Map<String, String> parameters;
  private final JsonNode template;
  private final JsonNode metadata;

  public Stack(String parentStackPath, String name, Path location, Map<String, String> parameters, JsonNode template, JsonNode metadata) {
    this.parentStackPath = parentStackPath;
    this.name = name;
    this.location = location;
    this.parameters = ImmutableMap.copyOf(parameters);
    this.template = template;
    this.metadata = metadata;
  }

  /** @return the logical id of this stack within its parent, empty for the root stack */
  public String getName() {
    return name;
  }

  public Path getLocation() {
    return location;
  }

  public Map<String, String> getParameters() {
    return parameters;
  }

  public JsonNode getTemplate() {
    return template;
  }

  public String getStackId() {
    if (metadata != null && metadata.path(SAM_RESOURCE_ID_KEY).isTextual()) {
      return metadata.path(SAM_RESOURCE_ID_KEY).asText();
    }
    return name;
  }

  /**
   * @return the path of this stack in the nested stack tree, e.g. "" for the root stack, "StackX" for its child, "StackX/StackY" for its grandchild
   */
  public String getStackPath() {
    return joinPath(parentStackPath, getStackId());
  }

  public boolean isRootStack() {
    return getStackPath().isEmpty();
  }

  /** @return the template's resources keyed by logical id, in template order */
  public Map<String, JsonNode> getResources() {
    Map<String, JsonNode> resources = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> i = template.path("Resources").fields();
    while (i.hasNext()) {
      Map.Entry<String, JsonNode> e = i.next();
      if (e.getValue().isObject()) {
        resources.put(e.getKey(), e.getValue());
      }
    }
    return resources;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("stackPath", getStackPath()).add("location", location).toString();
  }

  static String joinPath(String parent, String child) {
    if (parent.isEmpty()) {
      return child;
    } else if (child.isEmpty()) {
      return parent;
    }
    return parent + "/" + child;
  }

}
