package stackwatch.tasks;

/** Returned from {@link TaskFactory#runTask(TaskLogic)} so callers can stop just that task. */
@FunctionalInterface
public interface TaskHandle {

  /** Stops the task, blocking until its thread has finished. */
  void stop();

}
