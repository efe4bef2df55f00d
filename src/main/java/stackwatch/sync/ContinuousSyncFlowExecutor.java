package stackwatch.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import stackwatch.Utils;

/**
 * Runs sync flows submitted with a delay, on a small worker pool, until stopped.
 *
 * Submissions are keyed by resource (when deduped), and a newer submission for the same key replaces
 * the pending one and restarts its delay, so a burst of saves turns into one sync. A flow is also held
 * back while an equal flow is still running, so one resource is never synced twice at once.
 */
public class ContinuousSyncFlowExecutor {

  private static final Logger log = LoggerFactory.getLogger(ContinuousSyncFlowExecutor.class);
  public static final int DEFAULT_MAX_WORKERS = 4;
  static final Duration LOOP_INTERVAL = Duration.ofMillis(100);
  private final Object lock = new Object();
  // insertion ordered, so flows that are due at the same time run in submission order
  private final Map<Object, DelayedFlow> delayedFlows = new LinkedHashMap<>();
  private final List<RunningFlow> runningFlows = new ArrayList<>();
  private final Clock clock;
  private final int maxWorkers;
  private volatile boolean stopping;
  private CountDownLatch executionDone;

  private static final class DelayedFlow {
    private final SyncFlow flow;
    private final Instant dueAt;

    private DelayedFlow(SyncFlow flow, Instant dueAt) {
      this.flow = flow;
      this.dueAt = dueAt;
    }
  }

  private static final class RunningFlow {
    private final SyncFlow flow;
    private final Future<?> future;

    private RunningFlow(SyncFlow flow, Future<?> future) {
      this.flow = flow;
      this.future = future;
    }
  }

  public ContinuousSyncFlowExecutor() {
    this(Clock.systemUTC(), DEFAULT_MAX_WORKERS);
  }

  public ContinuousSyncFlowExecutor(Clock clock, int maxWorkers) {
    this.clock = clock;
    this.maxWorkers = maxWorkers;
  }

  /**
   * Queues {@code flow} to run once {@code waitTime} has passed.
   *
   * @param dedup true to replace any pending flow for the same resource
   */
  public void addDelayedSyncFlow(SyncFlow flow, boolean dedup, Duration waitTime) {
    synchronized (lock) {
      if (stopping) {
        log.debug("Dropping {} as the executor is stopping", flow.getLogName());
        return;
      }
      Object key = dedup ? flow.getResourceIdentifier() : new Object();
      // remove first so the replacement moves to the end of the queue
      if (delayedFlows.remove(key) != null) {
        log.debug("Replacing pending sync for {}", flow.getResourceIdentifier());
      }
      delayedFlows.put(key, new DelayedFlow(flow, clock.instant().plus(waitTime)));
    }
  }

  /**
   * Runs queued flows until {@link #stop()} is called (or this thread is interrupted), then waits for
   * the running ones to finish. Failures go to {@code exceptionHandler} and do not stop the loop.
   */
  public void execute(Consumer<SyncFlowException> exceptionHandler) {
    ExecutorService pool = Executors.newFixedThreadPool(
      maxWorkers,
      new ThreadFactoryBuilder().setDaemon(true).setNameFormat("SyncFlow-%s").build());
    CountDownLatch done = new CountDownLatch(1);
    synchronized (lock) {
      executionDone = done;
    }
    try {
      while (!stopping) {
        executeStep(pool, exceptionHandler);
        Thread.sleep(LOOP_INTERVAL.toMillis());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      awaitTermination(pool);
      synchronized (lock) {
        executionDone = null;
      }
      done.countDown();
    }
  }

  /** Drops the flows that are still waiting, without waiting for the running ones. Safe to call from a flow's thread. */
  public void clearDelayedSyncFlows() {
    synchronized (lock) {
      delayedFlows.clear();
    }
  }

  /** Drops the flows that are still waiting, and blocks until the running ones have finished. */
  public void stop() {
    CountDownLatch done;
    synchronized (lock) {
      stopping = true;
      if (!delayedFlows.isEmpty()) {
        log.info("Dropping {} pending syncs", delayedFlows.size());
      }
      delayedFlows.clear();
      done = executionDone;
    }
    try {
      if (done != null) {
        Utils.resetIfInterrupted(done::await);
      }
    } finally {
      stopping = false;
    }
  }

  /** Hands every due flow to {@code pool}; exposed so tests can step the executor by hand. */
  void executeStep(ExecutorService pool, Consumer<SyncFlowException> exceptionHandler) {
    List<SyncFlow> toRun = new ArrayList<>();
    synchronized (lock) {
      runningFlows.removeIf(r -> r.future.isDone());
      Instant now = clock.instant();
      Iterator<DelayedFlow> i = delayedFlows.values().iterator();
      while (i.hasNext()) {
        DelayedFlow delayed = i.next();
        if (delayed.dueAt.isAfter(now) || isRunning(delayed.flow)) {
          continue;
        }
        i.remove();
        toRun.add(delayed.flow);
      }
    }
    for (SyncFlow flow : toRun) {
      Future<?> future = pool.submit(() -> runSyncFlow(flow, exceptionHandler));
      synchronized (lock) {
        runningFlows.add(new RunningFlow(flow, future));
      }
    }
  }

  int getPendingCount() {
    synchronized (lock) {
      return delayedFlows.size();
    }
  }

  private boolean isRunning(SyncFlow flow) {
    for (RunningFlow r : runningFlows) {
      if (r.flow.equals(flow) && !r.future.isDone()) {
        return true;
      }
    }
    return false;
  }

  private void runSyncFlow(SyncFlow flow, Consumer<SyncFlowException> exceptionHandler) {
    try {
      for (SyncFlow dependency : flow.execute()) {
        addDelayedSyncFlow(dependency, true, Duration.ZERO);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("{} was interrupted", flow.getLogName());
    } catch (Exception e) {
      log.debug("{} failed", flow.getLogName(), e);
      try {
        exceptionHandler.accept(new SyncFlowException(flow, e));
      } catch (RuntimeException handlerFailure) {
        log.error("Exception handler failed for {}", flow.getLogName(), handlerFailure);
      }
    }
  }

  private static void awaitTermination(ExecutorService pool) {
    pool.shutdown();
    // we may be here because our thread was interrupted, but still want to wait for in-flight syncs
    boolean interrupted = Thread.interrupted();
    try {
      while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
        log.debug("Waiting for running syncs to finish");
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      interrupted = true;
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

}
