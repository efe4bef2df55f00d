package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;

import stackwatch.PathRules;
import stackwatch.observer.FileEventFilter;
import stackwatch.observer.PathEventHandler;
import stackwatch.observer.PathHandler;

/**
 * Knows which paths to watch for one resource (or a template), and calls {@code onChange} when they change.
 *
 * Triggers are built against one snapshot of the stacks, and thrown away when the stacks are reloaded.
 */
public abstract class ResourceTrigger {

  /** @return the handlers to schedule on a {@link stackwatch.observer.PathObserver} */
  public abstract List<PathHandler> getPathHandlers();

  /** Watches a single file, via its parent directory. */
  protected static PathHandler singleFileHandler(Path file, Runnable onChange) {
    Path absolute = file.toAbsolutePath().normalize();
    return PathHandler.of(absolute.getParent(), FileEventFilter.forFile(absolute, e -> onChange.run()), false);
  }

  /** Watches a directory tree as a stable folder, so re-creating the directory also counts as a change. */
  protected static PathHandler directoryHandler(Path directory, PathRules excludes, Runnable onChange) {
    PathEventHandler handler = FileEventFilter.forDirectory(directory, excludes, e -> onChange.run());
    return PathHandler.stableFolder(directory, handler, true, onChange, onChange);
  }

}
