package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import stackwatch.PathRules;
import stackwatch.model.ResourceIdentifier;
import stackwatch.model.Stack;
import stackwatch.observer.PathHandler;

/**
 * Watches a function's code directory, recursively, including it being deleted or re-created.
 */
public abstract class LambdaFunctionCodeTrigger extends CodeResourceTrigger {

  private final Path codeDirectory;
  private final PathRules excludes;

  protected LambdaFunctionCodeTrigger(ResourceIdentifier id, List<Stack> stacks, Path baseDir, Runnable onChange, PathRules excludes) {
    super(id, stacks, baseDir, onChange);
    String codeUri = getCodeUri().orElseThrow(() -> new MissingCodeUriException(id));
    this.codeDirectory = resolve(codeUri);
    this.excludes = excludes;
  }

  /** @return the local directory holding the function's code, if it has one */
  protected abstract Optional<String> getCodeUri();

  public Path getCodeDirectory() {
    return codeDirectory;
  }

  @Override
  public List<PathHandler> getPathHandlers() {
    return ImmutableList.of(directoryHandler(codeDirectory, excludes, onChange));
  }

}
