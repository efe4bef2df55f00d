package stackwatch.model;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * Names a resource within a (possibly nested) stack, e.g. {@code ChildStack/GrandChild/HelloFunction}.
 *
 * Used as the dedup key for both triggers and queued sync flows.
 */
public final class ResourceIdentifier {

  private final String stackPath;
  private final String resourceIacId;

  public static ResourceIdentifier parse(String identifier) {
    if (identifier.contains("/")) {
      return new ResourceIdentifier(StringUtils.substringBeforeLast(identifier, "/"), StringUtils.substringAfterLast(identifier, "/"));
    }
    return new ResourceIdentifier("", identifier);
  }

  public ResourceIdentifier(String stackPath, String resourceIacId) {
    this.stackPath = Objects.requireNonNull(stackPath);
    this.resourceIacId = Objects.requireNonNull(resourceIacId);
  }

  /** @return the path of stack logical ids leading to this resource; empty for the root stack */
  public String getStackPath() {
    return stackPath;
  }

  /** @return the logical id, or {@code Metadata.SamResourceId} when the template sets one */
  public String getResourceIacId() {
    return resourceIacId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResourceIdentifier)) {
      return false;
    }
    ResourceIdentifier other = (ResourceIdentifier) o;
    return stackPath.equals(other.stackPath) && resourceIacId.equals(other.resourceIacId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(stackPath, resourceIacId);
  }

  @Override
  public String toString() {
    return Stack.joinPath(stackPath, resourceIacId);
  }

}
