package stackwatch.observer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps scheduled handlers in a list, and lets tests fire events at them as the watcher would.
 */
public class StubPathObserver implements PathObserver {

  private final List<PathHandler> scheduled = new ArrayList<>();
  private boolean started;
  private boolean stopped;

  @Override
  public synchronized WatchHandle schedule(PathHandler handler) {
    scheduled.add(handler);
    WatchHandle handle = new WatchHandle(handler, () -> {
      synchronized (this) {
        scheduled.remove(handler);
      }
    });
    return handle;
  }

  @Override
  public List<WatchHandle> scheduleAll(List<PathHandler> handlers) {
    List<WatchHandle> handles = new ArrayList<>();
    for (PathHandler handler : handlers) {
      handles.add(schedule(handler));
    }
    return handles;
  }

  @Override
  public void unschedule(WatchHandle handle) {
    handle.cancel();
  }

  @Override
  public synchronized void unscheduleAll() {
    scheduled.clear();
  }

  @Override
  public synchronized void start() {
    started = true;
  }

  @Override
  public synchronized void stop() {
    stopped = true;
    scheduled.clear();
  }

  public synchronized List<PathHandler> getScheduled() {
    return new ArrayList<>(scheduled);
  }

  public synchronized List<Path> getScheduledPaths() {
    List<Path> paths = new ArrayList<>();
    for (PathHandler handler : scheduled) {
      paths.add(handler.getPath());
    }
    return paths;
  }

  public synchronized boolean isStarted() {
    return started;
  }

  public synchronized boolean isStopped() {
    return stopped;
  }

  /** Delivers an event for {@code path} to every handler watching its parent directory. */
  public void fire(PathEvent.Kind kind, Path path, boolean directory) {
    Path parent = path.toAbsolutePath().normalize().getParent();
    PathEvent event = new PathEvent(kind, path.toAbsolutePath().normalize(), directory);
    for (PathHandler handler : getScheduled()) {
      if (parent.equals(handler.getPath()) || (handler.isRecursive() && parent.startsWith(handler.getPath()))) {
        handler.getEventHandler().onEvent(event);
      }
    }
  }

  public void fireModified(Path file) {
    fire(PathEvent.Kind.MODIFIED, file, false);
  }

  /** Runs the self-delete callback of the stable-folder handler for {@code directory}. */
  public void fireSelfDelete(Path directory) {
    for (PathHandler handler : getScheduled()) {
      if (handler.isStableFolder() && handler.getPath().equals(directory.toAbsolutePath().normalize())) {
        handler.getOnSelfDelete().run();
      }
    }
  }

}
