package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import stackwatch.PathRules;
import stackwatch.model.ResourceIdentifier;
import stackwatch.model.Stack;

/** Image-packaged functions, watching the Docker build context from {@code Metadata.DockerContext}. */
public class LambdaImageCodeTrigger extends LambdaFunctionCodeTrigger {

  public LambdaImageCodeTrigger(ResourceIdentifier id, List<Stack> stacks, Path baseDir, Runnable onChange, PathRules excludes) {
    super(id, stacks, baseDir, onChange, excludes);
  }

  @Override
  protected Optional<String> getCodeUri() {
    return getLocalPathProperty(resource.path("Metadata"), "DockerContext");
  }

}
