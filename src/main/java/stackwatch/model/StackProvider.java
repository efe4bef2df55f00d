package stackwatch.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads a template and its nested stacks.
 *
 * Implementations re-read from disk on every call, so the watch controllers
 * call this at their reload points to get a fresh snapshot.
 */
public interface StackProvider {

  /**
   * @return the root stack first, followed by any nested stacks
   * @throws StackLoadException if the template is missing or cannot be parsed
   */
  List<Stack> loadStacks(Path template, Map<String, String> parameterOverrides) throws StackLoadException;

}
