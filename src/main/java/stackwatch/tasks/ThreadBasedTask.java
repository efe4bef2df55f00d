package stackwatch.tasks;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import stackwatch.Utils;

/**
 * Runs a {@link TaskLogic} in a loop on its own daemon thread.
 */
class ThreadBasedTask {

  private static final Logger log = LoggerFactory.getLogger(ThreadBasedTask.class);
  private static final AtomicInteger nextThreadId = new AtomicInteger();
  private final AtomicBoolean shutdown = new AtomicBoolean(false);
  private final CountDownLatch isStarted = new CountDownLatch(1);
  private final CountDownLatch isShutdown = new CountDownLatch(1);
  private final Thread thread;
  private final TaskLogic task;
  private final Runnable onFailure;
  private final Runnable onFinished;

  ThreadBasedTask(TaskLogic task, Runnable onFailure, Runnable onFinished) {
    this.task = task;
    this.onFailure = onFailure;
    this.onFinished = onFinished;
    thread = new ThreadFactoryBuilder() //
      .setDaemon(true)
      .setNameFormat(nextThreadId.getAndIncrement() + "-" + task.getName() + "-%s")
      .build()
      .newThread(this::run);
  }

  void start() {
    thread.start();
    Utils.resetIfInterrupted(isStarted::await);
  }

  void stop() {
    if (shutdown.compareAndSet(false, true)) {
      Utils.resetIfInterrupted(isStarted::await);
      // stopping ourselves from our own thread (e.g. a controller's onStop) would deadlock on isShutdown
      if (Thread.currentThread() == thread) {
        return;
      }
      thread.interrupt();
      task.onInterrupt();
      Utils.resetIfInterrupted(isShutdown::await);
    }
  }

  boolean isFinished() {
    return isShutdown.getCount() == 0;
  }

  private void run() {
    try {
      isStarted.countDown();
      try {
        task.onStart();
        while (!shouldStop()) {
          Duration wait = task.runOneLoop();
          if (wait != null) {
            if (wait.isNegative()) {
              break;
            }
            Thread.sleep(wait.toMillis());
          }
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        // shutting down
      } catch (Exception e) {
        log.error("Task {} failed", task.getName(), e);
        callTaskFailureCallback();
        callFactoryFailureCallback();
      }
      // clear the interrupt so onStop can block on its own shutdown work (e.g. draining an executor)
      Thread.interrupted();
      task.onStop();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      log.error("Task {} failed while stopping", task.getName(), e);
    } finally {
      callFinishedCallback();
      isShutdown.countDown();
    }
  }

  private void callTaskFailureCallback() {
    try {
      task.onFailure();
    } catch (Exception e) {
      log.error("{}.onFailure() call failed", task.getName(), e);
    }
  }

  private void callFactoryFailureCallback() {
    if (onFailure != null) {
      try {
        onFailure.run();
      } catch (Exception e) {
        log.error("onFailure call failed", e);
      }
    }
  }

  private void callFinishedCallback() {
    try {
      onFinished.run();
    } catch (Exception e) {
      log.error("onFinished call failed", e);
    }
  }

  private boolean shouldStop() {
    return shutdown.get() || Thread.currentThread().isInterrupted();
  }

}
