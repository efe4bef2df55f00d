package stackwatch.observer;

import java.nio.file.Path;

import com.google.common.base.MoreObjects;

/** A filesystem change reported by the {@link DirectoryWatcher}, with an absolute path. */
public final class PathEvent {

  public enum Kind {
    CREATED, MODIFIED, DELETED,
    /** The OS dropped events; the path is the watched root and anything under it may have changed. */
    OVERFLOW
  }

  private final Kind kind;
  private final Path path;
  private final boolean directory;

  public PathEvent(Kind kind, Path path, boolean directory) {
    this.kind = kind;
    this.path = path;
    this.directory = directory;
  }

  public Kind getKind() {
    return kind;
  }

  public Path getPath() {
    return path;
  }

  public boolean isDirectory() {
    return directory;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("kind", kind).add("path", path).add("directory", directory).toString();
  }

}
