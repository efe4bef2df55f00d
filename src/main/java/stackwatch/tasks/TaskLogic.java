package stackwatch.tasks;

import java.time.Duration;

import org.apache.commons.lang3.StringUtils;

/**
 * A loop to be executed on a dedicated thread, e.g. the filesystem watcher, a debouncer,
 * or a controller's main loop.
 */
public interface TaskLogic {

  /**
   * Runs one iteration.
   *
   * @return how long to sleep before the next iteration; null to loop again immediately, negative to finish the task
   */
  Duration runOneLoop() throws InterruptedException;

  /** Called on the task thread, before we start calling {@link #runOneLoop()} in a loop. */
  default void onStart() throws InterruptedException {
  }

  /** Called on the task thread, after {@link #runOneLoop()} has thrown. */
  default void onFailure() throws InterruptedException {
  }

  /** Called on the task thread, after we've interrupted/stopped calling {@link #runOneLoop()}. */
  default void onStop() throws InterruptedException {
  }

  /**
   * Called off the task thread, when we're trying to interrupt the task.
   *
   * Only needed by tasks that block on something thread.interrupt() does not wake up.
   */
  default void onInterrupt() {
  }

  default String getName() {
    String name = getClass().getSimpleName();
    // lambdas and anonymous classes don't have simple names
    if (name.equals("")) {
      name = StringUtils.substringAfterLast(getClass().getName(), ".");
    }
    return name;
  }
}
