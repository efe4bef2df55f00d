package stackwatch.observer;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stackwatch.tasks.TaskLogic;

/**
 * Watches directories with a single {@link WatchService}, and dispatches events to the
 * registrations whose tree they fall under.
 *
 * Several registrations can cover the same directory (e.g. a function's code directory and the
 * stable-folder watch on its parent); the directory is watched once, and stays watched until no
 * registration covers it.
 *
 * Renames are reported as a DELETE of the old name and a CREATE of the new one, with nothing about
 * the children, which are moved silently. Worse, the WatchKey of a renamed directory keeps
 * firing with its original path, see https://bugs.openjdk.java.net/browse/JDK-7057783, so we
 * drop watches for a deleted directory's whole subtree, and never trust {@code watchKey.watchable()}.
 * {@link StableFolderWatch} builds on this to survive the watched directory itself being renamed.
 */
public class DirectoryWatcher implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);
  // two maps maintained by hand, as with renames the same key can briefly be seen for two paths
  private final Map<WatchKey, Path> keyToPath = new ConcurrentHashMap<>();
  private final Map<Path, WatchKey> pathToKey = new ConcurrentHashMap<>();
  private final List<Registration> registrations = new CopyOnWriteArrayList<>();
  private final WatchService watchService;

  /** One caller's interest in a directory (and, if recursive, everything under it). */
  static final class Registration {
    private final Path root;
    private final boolean recursive;
    private final PathEventHandler handler;
    private volatile boolean active = true;

    private Registration(Path root, boolean recursive, PathEventHandler handler) {
      this.root = root;
      this.recursive = recursive;
      this.handler = handler;
    }

    Path getRoot() {
      return root;
    }

    private boolean covers(Path directory) {
      return directory.equals(root) || (recursive && directory.startsWith(root));
    }
  }

  public DirectoryWatcher(WatchService watchService) {
    this.watchService = watchService;
  }

  /**
   * Starts watching {@code root}, which must be an existing directory.
   *
   * Safe to call from the watcher thread, e.g. from within a handler.
   */
  synchronized Registration register(Path root, boolean recursive, PathEventHandler handler) throws IOException {
    Path dir = root.toAbsolutePath().normalize();
    if (!Files.isDirectory(dir)) {
      throw new NoSuchFileException(dir.toString(), null, "not a directory");
    }
    Registration r = new Registration(dir, recursive, handler);
    if (recursive) {
      watchTree(dir, null);
    } else {
      watchDirectory(dir);
    }
    registrations.add(r);
    return r;
  }

  /** Stops delivering events to {@code r}, and drops any directory watch nothing else needs. */
  synchronized void unregister(Registration r) {
    r.active = false;
    registrations.remove(r);
    for (Map.Entry<Path, WatchKey> e : new ArrayList<>(pathToKey.entrySet())) {
      if (!isCovered(e.getKey())) {
        unwatchDirectory(e.getValue(), e.getKey());
      }
    }
  }

  int getWatchedDirectoryCount() {
    return pathToKey.size();
  }

  int getRegistrationCount() {
    return registrations.size();
  }

  @Override
  public void onStop() {
    try {
      watchService.close();
    } catch (IOException e) {
      log.warn("Exception when shutting down the watch service", e);
    }
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    try {
      WatchKey watchKey = watchService.take();
      Path parentDir = keyToPath.get(watchKey);
      for (WatchEvent<?> watchEvent : watchKey.pollEvents()) {
        WatchEvent.Kind<?> eventKind = watchEvent.kind();
        if (log.isTraceEnabled()) {
          log.trace("WatchEvent {} {} {}", eventKind, parentDir, watchEvent.context());
        }
        if (eventKind == OVERFLOW) {
          onOverflow();
          continue;
        }
        if (parentDir == null) {
          // an event for a key we've already cancelled, e.g. a deleted directory
          log.debug("Missing parentDir for {}: {}", watchKey.watchable(), watchEvent.context());
          continue;
        }
        Path child = parentDir.resolve((Path) watchEvent.context());
        if (eventKind == ENTRY_CREATE) {
          onCreatedPath(parentDir, child);
        } else if (eventKind == ENTRY_MODIFY) {
          dispatch(parentDir, new PathEvent(PathEvent.Kind.MODIFIED, child, Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)));
        } else if (eventKind == ENTRY_DELETE) {
          onDeletedPath(parentDir, child);
        }
      }
      watchKey.reset();
    } catch (ClosedWatchServiceException e) {
      // shutting down
      return Duration.ofMillis(-1);
    }
    return null;
  }

  private void onCreatedPath(Path parentDir, Path child) {
    boolean isDirectory = Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS);
    if (isDirectory && isCoveredRecursively(child)) {
      // anything created in the new directory before we watched it would be missed, so report it as well
      List<Path> created = new ArrayList<>();
      try {
        synchronized (this) {
          watchTree(child, created::add);
        }
      } catch (NoSuchFileException e) {
        // deleted before we got to it
      } catch (IOException e) {
        log.warn("Could not watch new directory {}", child, e);
      }
      // dispatch outside the lock, as handlers may (un)register
      for (Path p : created) {
        dispatch(p.getParent(), new PathEvent(PathEvent.Kind.CREATED, p, Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS)));
      }
    } else {
      dispatch(parentDir, new PathEvent(PathEvent.Kind.CREATED, child, isDirectory));
    }
  }

  private void onDeletedPath(Path parentDir, Path child) {
    boolean wasDirectory;
    synchronized (this) {
      wasDirectory = pathToKey.containsKey(child);
      // the subtree was either deleted or moved away, either way its keys are stale now
      for (Map.Entry<Path, WatchKey> e : new ArrayList<>(pathToKey.entrySet())) {
        if (e.getKey().startsWith(child)) {
          unwatchDirectory(e.getValue(), e.getKey());
        }
      }
    }
    dispatch(parentDir, new PathEvent(PathEvent.Kind.DELETED, child, wasDirectory));
  }

  private void onOverflow() {
    log.warn("Filesystem events overflowed, treating every watched directory as modified");
    for (Registration r : registrations) {
      deliver(r, new PathEvent(PathEvent.Kind.OVERFLOW, r.root, true));
    }
  }

  private void dispatch(Path parentDir, PathEvent event) {
    for (Registration r : registrations) {
      if (r.covers(parentDir)) {
        deliver(r, event);
      }
    }
  }

  private void deliver(Registration r, PathEvent event) {
    if (!r.active) {
      return;
    }
    try {
      r.handler.onEvent(event);
    } catch (RuntimeException e) {
      log.error("Handler for {} failed on {}", r.root, event, e);
    }
  }

  private boolean isCovered(Path directory) {
    for (Registration r : registrations) {
      if (r.covers(directory)) {
        return true;
      }
    }
    return false;
  }

  private boolean isCoveredRecursively(Path directory) {
    for (Registration r : registrations) {
      if (r.recursive && directory.startsWith(r.root) && !directory.equals(r.root)) {
        return true;
      }
    }
    return false;
  }

  private interface CreatedListener {
    void onCreated(Path path);
  }

  private void watchTree(Path directory, CreatedListener listener) throws IOException {
    Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
        watchDirectory(dir);
        if (listener != null) {
          listener.onCreated(dir);
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (listener != null) {
          listener.onCreated(file);
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) {
        // deleted while we walked
        return FileVisitResult.CONTINUE;
      }
    });
  }

  private void watchDirectory(Path directory) throws IOException {
    if (pathToKey.containsKey(directory)) {
      return;
    }
    WatchKey key = directory.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
    if (log.isTraceEnabled()) {
      log.trace("Putting " + key + " = " + directory);
    }
    keyToPath.put(key, directory);
    pathToKey.put(directory, key);
  }

  private void unwatchDirectory(WatchKey key, Path directory) {
    if (log.isTraceEnabled()) {
      log.trace("Removing " + key + " = " + directory);
    }
    pathToKey.remove(directory);
    // a re-registered directory can get the same key back, so only drop the reverse entry if it's still ours
    keyToPath.remove(key, directory);
    key.cancel();
  }

}
