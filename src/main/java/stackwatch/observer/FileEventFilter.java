package stackwatch.observer;

import java.nio.file.Path;

import stackwatch.PathRules;
import stackwatch.Utils;

/** Narrows the events a {@link PathEventHandler} sees. */
public final class FileEventFilter {

  private FileEventFilter() {
  }

  /** Passes only events for {@code file} itself, as a single file is watched via its parent directory. */
  public static PathEventHandler forFile(Path file, PathEventHandler delegate) {
    Path target = file.toAbsolutePath().normalize();
    return event -> {
      if (event.getKind() == PathEvent.Kind.OVERFLOW || (event.getPath().equals(target) && !event.isDirectory())) {
        delegate.onEvent(event);
      }
    };
  }

  /** Passes events under {@code directory} unless they match {@code excludes}, evaluated relative to {@code directory}. */
  public static PathEventHandler forDirectory(Path directory, PathRules excludes, PathEventHandler delegate) {
    Path root = directory.toAbsolutePath().normalize();
    return event -> {
      Path path = event.getPath();
      if (!path.equals(root) && path.startsWith(root) && excludes.matches(Utils.toRelativePath(root, path), event.isDirectory())) {
        return;
      }
      delegate.onEvent(event);
    };
  }

  /** Drops MODIFIED events for directories, which Linux fires for the parent of every changed file. */
  public static PathEventHandler ignoreDirectoryModified(PathEventHandler delegate) {
    return event -> {
      if (event.getKind() == PathEvent.Kind.MODIFIED && event.isDirectory()) {
        return;
      }
      delegate.onEvent(event);
    };
  }

}
