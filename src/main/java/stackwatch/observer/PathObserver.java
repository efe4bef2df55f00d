package stackwatch.observer;

import java.util.List;

/**
 * Schedules {@link PathHandler}s against the filesystem.
 *
 * Handlers may be scheduled before or after {@link #start()}; events are only delivered
 * while the observer is started.
 */
public interface PathObserver {

  /** @throws java.io.UncheckedIOException if the path cannot be watched, e.g. it does not exist and is not a stable folder */
  WatchHandle schedule(PathHandler handler);

  List<WatchHandle> scheduleAll(List<PathHandler> handlers);

  void unschedule(WatchHandle handle);

  void unscheduleAll();

  void start();

  /** Stops delivering events and unschedules everything; blocks until the watcher thread has finished. */
  void stop();

}
