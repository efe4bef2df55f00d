package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import stackwatch.PathRules;
import stackwatch.model.ResourceIdentifier;
import stackwatch.model.Stack;

/** Zip-packaged functions, watching {@code CodeUri} (or a plain-string {@code Code}). */
public class LambdaZipCodeTrigger extends LambdaFunctionCodeTrigger {

  public LambdaZipCodeTrigger(ResourceIdentifier id, List<Stack> stacks, Path baseDir, Runnable onChange, PathRules excludes) {
    super(id, stacks, baseDir, onChange, excludes);
  }

  @Override
  protected Optional<String> getCodeUri() {
    JsonNode properties = resource.path("Properties");
    Optional<String> codeUri = getLocalPathProperty(properties, "CodeUri");
    return codeUri.isPresent() ? codeUri : getLocalPathProperty(properties, "Code");
  }

}
