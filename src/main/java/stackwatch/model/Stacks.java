package stackwatch.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolves resources across a list of stacks.
 */
public final class Stacks {

  private Stacks() {
  }

  /** @return the ids of every resource in every stack, nested ones prefixed with their stack path */
  public static List<ResourceIdentifier> getAllResourceIds(List<Stack> stacks) {
    List<ResourceIdentifier> ids = new ArrayList<>();
    for (Stack stack : stacks) {
      for (Map.Entry<String, JsonNode> e : stack.getResources().entrySet()) {
        ids.add(new ResourceIdentifier(stack.getStackPath(), getResourceId(e.getValue(), e.getKey())));
      }
    }
    return ids;
  }

  /**
   * Finds the resource for {@code id}.
   *
   * If {@code id} has no stack path, every stack is searched for a matching logical id,
   * otherwise only the stack with that path is.
   */
  public static Optional<JsonNode> getResourceById(List<Stack> stacks, ResourceIdentifier id) {
    boolean searchAllStacks = id.getStackPath().isEmpty();
    for (Stack stack : stacks) {
      if (!searchAllStacks && !stack.getStackPath().equals(id.getStackPath())) {
        continue;
      }
      for (Map.Entry<String, JsonNode> e : stack.getResources().entrySet()) {
        String resourceId = getResourceId(e.getValue(), e.getKey());
        if (resourceId.equals(id.getResourceIacId()) || (searchAllStacks && e.getKey().equals(id.getResourceIacId()))) {
          return Optional.of(e.getValue());
        }
      }
    }
    return Optional.empty();
  }

  public static Optional<String> getResourceType(List<Stack> stacks, ResourceIdentifier id) {
    return getResourceById(stacks, id).map(r -> r.path("Type")).filter(JsonNode::isTextual).map(JsonNode::asText);
  }

  /** @return the stack that declares {@code id}, if any */
  public static Optional<Stack> getStackOf(List<Stack> stacks, ResourceIdentifier id) {
    for (Stack stack : stacks) {
      if (stack.getStackPath().equals(id.getStackPath())) {
        return Optional.of(stack);
      }
    }
    return Optional.empty();
  }

  private static String getResourceId(JsonNode resource, String logicalId) {
    JsonNode samId = resource.path("Metadata").path(Stack.SAM_RESOURCE_ID_KEY);
    return samId.isTextual() ? samId.asText() : logicalId;
  }

}
