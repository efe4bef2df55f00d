package stackwatch.tasks;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each task on a dedicated thread.
 */
public class ThreadBasedTaskFactory implements TaskFactory {

  private final ConcurrentHashMap<TaskLogic, ThreadBasedTask> tasks = new ConcurrentHashMap<>();

  @Override
  public TaskHandle runTask(TaskLogic logic, Runnable onFailure) {
    ThreadBasedTask task = new ThreadBasedTask(logic, onFailure, () -> {
      // the task is already finishing, we just need to drop our entry for it
      tasks.remove(logic);
    });
    if (tasks.putIfAbsent(logic, task) != null) {
      throw new IllegalStateException(logic.getName() + " is already running");
    }
    task.start();
    return () -> stopTask(logic);
  }

  // Not synchronized, as while we block on task.stop, that task's onStop might
  // ask us to stop one of its own child tasks from its thread.
  @Override
  public void stopTask(TaskLogic logic) {
    ThreadBasedTask task = tasks.remove(logic);
    if (task != null) {
      task.stop();
    }
  }

  @Override
  public boolean isRunning(TaskLogic logic) {
    ThreadBasedTask task = tasks.get(logic);
    return task != null && !task.isFinished();
  }

}
