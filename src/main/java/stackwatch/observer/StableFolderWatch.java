package stackwatch.observer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a directory that may be renamed away, deleted, or re-created.
 *
 * A plain watch on such a directory keeps reporting events under a stale key after a rename,
 * so instead we watch its parent, filtered to events for the directory's own name, and only
 * watch the directory itself while it exists. Whenever the parent reports a change to the name,
 * we re-check the directory: gone means {@code onSelfDelete}, back means {@code onSelfCreate},
 * and a different file key (e.g. inode) means it was replaced, so both.
 *
 * This relies on the parent watch reporting the rename, which some backends do unreliably;
 * callers that need more (the template) also poll.
 */
class StableFolderWatch {

  private static final Logger log = LoggerFactory.getLogger(StableFolderWatch.class);
  private final DirectoryWatcher watcher;
  private final PathHandler handler;
  private final Path target;
  private DirectoryWatcher.Registration parentRegistration;
  private DirectoryWatcher.Registration targetRegistration;
  private Object targetFileKey;
  private boolean cancelled;

  StableFolderWatch(DirectoryWatcher watcher, PathHandler handler) {
    this.watcher = watcher;
    this.handler = handler;
    this.target = handler.getPath();
  }

  synchronized void start() throws IOException {
    Path parent = target.getParent();
    parentRegistration = watcher.register(parent, false, event -> {
      if (event.getKind() == PathEvent.Kind.OVERFLOW || event.getPath().equals(target)) {
        onParentEvent(event);
      }
    });
    if (Files.isDirectory(target)) {
      watchTarget();
    }
  }

  synchronized void cancel() {
    cancelled = true;
    if (parentRegistration != null) {
      watcher.unregister(parentRegistration);
      parentRegistration = null;
    }
    unwatchTarget();
  }

  synchronized boolean isTargetWatched() {
    return targetRegistration != null;
  }

  synchronized boolean isCancelled() {
    return cancelled;
  }

  /**
   * Re-checks the target after its parent saw an event for it.
   *
   * The callbacks run after our lock is released, as they usually take a lock of their own that is
   * also held while cancelling this watch.
   */
  void onParentEvent(PathEvent event) {
    boolean deleted = false;
    boolean created = false;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      Object fileKey = readFileKey(target);
      boolean exists = fileKey != null || Files.isDirectory(target);
      if (!exists && targetRegistration != null) {
        log.debug("Watched directory {} is gone", target);
        unwatchTarget();
        deleted = true;
      } else if (exists && targetRegistration == null) {
        log.debug("Watched directory {} is back", target);
        created = watchTarget();
      } else if (exists && fileKey != null && !Objects.equals(fileKey, targetFileKey)) {
        log.debug("Watched directory {} was replaced", target);
        unwatchTarget();
        deleted = true;
        created = watchTarget();
      }
    }
    if (deleted && !isCancelled()) {
      handler.getOnSelfDelete().run();
    }
    if (created && !isCancelled()) {
      handler.getOnSelfCreate().run();
    }
  }

  private boolean watchTarget() {
    try {
      targetRegistration = watcher.register(target, handler.isRecursive(), handler.getEventHandler());
      targetFileKey = readFileKey(target);
      return true;
    } catch (IOException e) {
      // removed again before we could watch it, the parent watch will tell us if it comes back
      log.debug("Could not watch {}", target, e);
      return false;
    }
  }

  private void unwatchTarget() {
    if (targetRegistration != null) {
      watcher.unregister(targetRegistration);
      targetRegistration = null;
      targetFileKey = null;
    }
  }

  private static Object readFileKey(Path path) {
    try {
      BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
      return attrs.isDirectory() ? attrs.fileKey() : null;
    } catch (IOException e) {
      return null;
    }
  }

}
