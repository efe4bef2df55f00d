package stackwatch.observer;

import java.nio.file.Path;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * One watch registration: a directory, the handler for events under it, and how to watch it.
 *
 * {@code stableFolder} means the directory itself may be renamed away, deleted or re-created, and
 * the registration should keep working across that; {@code onSelfCreate}/{@code onSelfDelete} are
 * called when that happens.
 *
 * Immutable; triggers create new instances whenever the stack model is reloaded.
 */
public final class PathHandler {

  private static final Runnable NOOP = () -> {
  };
  private final Path path;
  private final PathEventHandler eventHandler;
  private final boolean recursive;
  private final boolean stableFolder;
  private final Runnable onSelfCreate;
  private final Runnable onSelfDelete;

  public static PathHandler of(Path path, PathEventHandler eventHandler, boolean recursive) {
    return new PathHandler(path, eventHandler, recursive, false, null, null);
  }

  public static PathHandler stableFolder(Path path, PathEventHandler eventHandler, boolean recursive, Runnable onSelfCreate, Runnable onSelfDelete) {
    return new PathHandler(path, eventHandler, recursive, true, onSelfCreate, onSelfDelete);
  }

  private PathHandler(Path path, PathEventHandler eventHandler, boolean recursive, boolean stableFolder, Runnable onSelfCreate, Runnable onSelfDelete) {
    this.path = path.toAbsolutePath().normalize();
    this.eventHandler = Objects.requireNonNull(eventHandler);
    this.recursive = recursive;
    this.stableFolder = stableFolder;
    this.onSelfCreate = onSelfCreate == null ? NOOP : onSelfCreate;
    this.onSelfDelete = onSelfDelete == null ? NOOP : onSelfDelete;
  }

  /** @return a copy of this registration with its events going to {@code handler} instead */
  public PathHandler withEventHandler(PathEventHandler handler) {
    return new PathHandler(path, handler, recursive, stableFolder, onSelfCreate, onSelfDelete);
  }

  public Path getPath() {
    return path;
  }

  public PathEventHandler getEventHandler() {
    return eventHandler;
  }

  public boolean isRecursive() {
    return recursive;
  }

  public boolean isStableFolder() {
    return stableFolder;
  }

  public Runnable getOnSelfCreate() {
    return onSelfCreate;
  }

  public Runnable getOnSelfDelete() {
    return onSelfDelete;
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("path", path)
      .add("recursive", recursive)
      .add("stableFolder", stableFolder)
      .toString();
  }

}
