package stackwatch.tasks;

/**
 * An abstraction for running tasks on dedicated threads, e.g. the watch loops.
 *
 * Instead of creating, running, and shutting down threads directly, code asks for tasks
 * to be ran/stopped, which lets tests swap in a factory that ticks tasks on the test thread.
 */
public interface TaskFactory {

  default TaskHandle runTask(TaskLogic logic) {
    return runTask(logic, null);
  }

  /** @param onFailure called (off the caller's thread) if the task's loop throws, may be null */
  TaskHandle runTask(TaskLogic logic, Runnable onFailure);

  /** Stops {@code logic} if it is running, blocking until it has finished. */
  void stopTask(TaskLogic logic);

  boolean isRunning(TaskLogic logic);

}
