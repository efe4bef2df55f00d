package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import stackwatch.PathRules;
import stackwatch.model.ResourceIdentifier;
import stackwatch.model.Stack;
import stackwatch.observer.PathHandler;

/** Watches a layer's content directory ({@code ContentUri}, or a plain-string {@code Content}). */
public class LambdaLayerCodeTrigger extends CodeResourceTrigger {

  private final Path contentDirectory;
  private final PathRules excludes;

  public LambdaLayerCodeTrigger(ResourceIdentifier id, List<Stack> stacks, Path baseDir, Runnable onChange, PathRules excludes) {
    super(id, stacks, baseDir, onChange);
    JsonNode properties = resource.path("Properties");
    Optional<String> contentUri = getLocalPathProperty(properties, "ContentUri");
    if (!contentUri.isPresent()) {
      contentUri = getLocalPathProperty(properties, "Content");
    }
    this.contentDirectory = resolve(contentUri.orElseThrow(() -> new MissingCodeUriException(id)));
    this.excludes = excludes;
  }

  public Path getContentDirectory() {
    return contentDirectory;
  }

  @Override
  public List<PathHandler> getPathHandlers() {
    return ImmutableList.of(directoryHandler(contentDirectory, excludes, onChange));
  }

}
