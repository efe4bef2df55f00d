package stackwatch.observer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stackwatch.tasks.TaskFactory;

/**
 * The {@link PathObserver} used by the controllers, running a {@link DirectoryWatcher} as a task.
 */
public class HandlerObserver implements PathObserver {

  private static final Logger log = LoggerFactory.getLogger(HandlerObserver.class);
  private final Set<WatchHandle> handles = ConcurrentHashMap.newKeySet();
  private final TaskFactory taskFactory;
  private final DirectoryWatcher watcher;

  public static HandlerObserver create(TaskFactory taskFactory) {
    try {
      return new HandlerObserver(taskFactory, FileSystems.getDefault().newWatchService());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public HandlerObserver(TaskFactory taskFactory, WatchService watchService) {
    this.taskFactory = taskFactory;
    this.watcher = new DirectoryWatcher(watchService);
  }

  @Override
  public WatchHandle schedule(PathHandler handler) {
    WatchHandle handle;
    try {
      if (handler.isStableFolder()) {
        StableFolderWatch watch = new StableFolderWatch(watcher, handler);
        watch.start();
        handle = new WatchHandle(handler, watch::cancel);
      } else {
        DirectoryWatcher.Registration r = watcher.register(handler.getPath(), handler.isRecursive(), handler.getEventHandler());
        handle = new WatchHandle(handler, () -> watcher.unregister(r));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Could not watch " + handler.getPath(), e);
    }
    handles.add(handle);
    log.debug("Scheduled {}", handler);
    return handle;
  }

  @Override
  public List<WatchHandle> scheduleAll(List<PathHandler> handlers) {
    List<WatchHandle> scheduled = new ArrayList<>();
    for (PathHandler handler : handlers) {
      scheduled.add(schedule(handler));
    }
    return scheduled;
  }

  @Override
  public void unschedule(WatchHandle handle) {
    handles.remove(handle);
    handle.cancel();
  }

  @Override
  public void unscheduleAll() {
    for (WatchHandle handle : new ArrayList<>(handles)) {
      unschedule(handle);
    }
  }

  @Override
  public void start() {
    if (!taskFactory.isRunning(watcher)) {
      taskFactory.runTask(watcher);
    }
  }

  @Override
  public void stop() {
    taskFactory.stopTask(watcher);
    unscheduleAll();
  }

  int getHandleCount() {
    return handles.size();
  }

  int getWatchedDirectoryCount() {
    return watcher.getWatchedDirectoryCount();
  }

}
