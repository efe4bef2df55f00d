package stackwatch;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stackwatch.tasks.TaskLogic;

/**
 * Collapses a burst of signals into one call of {@code action}, once no new signal has arrived for {@code wait}.
 *
 * Signals are put on a queue and only this task's thread reads them, so there is no timer to
 * race against; a new signal restarts the wait, and {@link #cancel()} drops a pending action.
 */
public class Debouncer implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(Debouncer.class);
  private final BlockingQueue<Boolean> signals = new LinkedBlockingQueue<>();
  private final String name;
  private final Duration wait;
  private final Runnable action;

  public Debouncer(String name, Duration wait, Runnable action) {
    this.name = name;
    this.wait = wait;
    this.action = action;
  }

  /** Schedules the action, or pushes back an already scheduled one. */
  public void signal() {
    signals.add(Boolean.TRUE);
  }

  public void cancel() {
    signals.add(Boolean.FALSE);
  }

  /** @return true if every signal so far has been handled */
  boolean isIdle() {
    return signals.isEmpty();
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    if (!signals.take()) {
      // nothing pending to cancel
      return null;
    }
    while (true) {
      Boolean next = signals.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
      if (next == null) {
        break;
      } else if (!next) {
        log.debug("{} cancelled", name);
        return null;
      }
    }
    try {
      action.run();
    } catch (RuntimeException e) {
      log.error("{} failed", name, e);
    }
    return null;
  }

  @Override
  public String getName() {
    return name;
  }

}
