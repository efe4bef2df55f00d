package stackwatch;

import java.time.Duration;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stackwatch.model.ResourceIdentifier;
import stackwatch.model.StackProvider;
import stackwatch.observer.PathObserver;
import stackwatch.sync.ContinuousSyncFlowExecutor;
import stackwatch.sync.InfraSyncRequiredException;
import stackwatch.sync.MissingPhysicalResourceException;
import stackwatch.sync.SyncFlow;
import stackwatch.sync.SyncFlowException;
import stackwatch.sync.SyncFlowFactory;
import stackwatch.sync.SyncFlowFactoryLoader;
import stackwatch.tasks.TaskFactory;
import stackwatch.tasks.TaskLogic;

/**
 * Watches the template and every resource's code, running an infra sync (build, package, deploy)
 * when the template changes, and a per-resource code sync when a resource's code changes.
 *
 * An infra sync always wins: once one is pending, code changes are dropped (the infra sync deploys
 * them anyway), queued code syncs are discarded, and running ones are waited for before it starts.
 * Code syncs that find the deployed stack out of date queue an infra sync.
 */
public class SyncWatchController extends WatchController {

  private static final Logger log = LoggerFactory.getLogger(SyncWatchController.class);
  public static final Duration DEFAULT_CODE_SYNC_WAIT = Duration.ofSeconds(1);
  private final InfraSyncExecutor infraSyncExecutor;
  private final SyncFlowFactoryLoader syncFlowFactoryLoader;
  private final ContinuousSyncFlowExecutor syncFlowExecutor;
  private final boolean disableInfraSyncs;
  private final Duration codeSyncWait;
  private SyncWatchState state = SyncWatchState.IDLE;
  private SyncFlowFactory syncFlowFactory;
  private TaskLogic codeSyncTask;

  public SyncWatchController(
    WatchConfig config,
    InfraSyncExecutor infraSyncExecutor,
    SyncFlowFactoryLoader syncFlowFactoryLoader,
    StackProvider stackProvider,
    PathObserver observer,
    TaskFactory taskFactory,
    boolean disableInfraSyncs) {
    this(config, infraSyncExecutor, syncFlowFactoryLoader, stackProvider, observer, taskFactory, new ContinuousSyncFlowExecutor(), disableInfraSyncs, DEFAULT_CODE_SYNC_WAIT);
  }

  SyncWatchController(
    WatchConfig config,
    InfraSyncExecutor infraSyncExecutor,
    SyncFlowFactoryLoader syncFlowFactoryLoader,
    StackProvider stackProvider,
    PathObserver observer,
    TaskFactory taskFactory,
    ContinuousSyncFlowExecutor syncFlowExecutor,
    boolean disableInfraSyncs,
    Duration codeSyncWait) {
    super(config, stackProvider, observer, taskFactory, false);
    this.infraSyncExecutor = infraSyncExecutor;
    this.syncFlowFactoryLoader = syncFlowFactoryLoader;
    this.syncFlowExecutor = syncFlowExecutor;
    this.disableInfraSyncs = disableInfraSyncs;
    this.codeSyncWait = codeSyncWait;
  }

  @Override
  public void onStart() {
    if (disableInfraSyncs) {
      // nothing to deploy first, start watching what's already there
      startSync();
    } else {
      queueInfraSync();
    }
    observer.start();
    log.info("Sync watch started.");
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    if (getState() == SyncWatchState.INFRA_SYNC_PENDING) {
      executeInfraSync();
    }
    return LOOP_INTERVAL;
  }

  @Override
  public void onStop() {
    log.info("Shutting down sync watch...");
    observer.stop();
    stopCodeSync();
    synchronized (lock) {
      state = SyncWatchState.STOPPED;
    }
    log.info("Sync watch stopped.");
  }

  /** Queues an infra sync for the next loop, unless infra syncs are disabled. */
  public void queueInfraSync() {
    if (disableInfraSyncs) {
      log.warn("Infra changes detected, but infra syncs are disabled by --code. Run without --code to sync them.");
      return;
    }
    synchronized (lock) {
      if (state == SyncWatchState.STOPPED) {
        return;
      }
      state = SyncWatchState.INFRA_SYNC_PENDING;
    }
    // queued code syncs would only deploy against the stack the infra sync is about to replace
    syncFlowExecutor.clearDelayedSyncFlows();
  }

  public SyncWatchState getState() {
    synchronized (lock) {
      return state;
    }
  }

  void executeInfraSync() throws InterruptedException {
    synchronized (lock) {
      if (state != SyncWatchState.INFRA_SYNC_PENDING) {
        return;
      }
      state = SyncWatchState.INFRA_SYNC_RUNNING;
    }
    log.info("Queued infra sync. Waiting for in progress code syncs to complete...");
    stopCodeSync();
    synchronized (lock) {
      observer.unscheduleAll();
    }
    try {
      log.info("Starting infra sync.");
      infraSyncExecutor.executeInfraSync();
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      log.error("Failed to sync infra. Code sync is paused until the template/stack is fixed.", e);
      synchronized (lock) {
        observer.unscheduleAll();
        addTemplateTriggers(this::onTemplateChange);
        if (state == SyncWatchState.INFRA_SYNC_RUNNING) {
          state = SyncWatchState.INFRA_FAILED;
        }
      }
      return;
    }
    log.info("Infra sync completed.");
    boolean started = startSync();
    synchronized (lock) {
      if (state == SyncWatchState.INFRA_SYNC_RUNNING) {
        state = started ? SyncWatchState.IDLE : SyncWatchState.INFRA_FAILED;
      }
    }
  }

  /**
   * Reloads the stacks, re-creates the sync flow and trigger factories, re-schedules all triggers, and starts code syncs.
   *
   * @return false if only the template triggers could be scheduled, as the stacks didn't load
   */
  boolean startSync() {
    synchronized (lock) {
      observer.unscheduleAll();
      if (!updateStacks()) {
        syncFlowFactory = null;
        addTemplateTriggers(this::onTemplateChange);
        return false;
      }
      syncFlowFactory = syncFlowFactoryLoader.load(stacks);
      try {
        syncFlowFactory.loadPhysicalIdMapping();
      } catch (Exception e) {
        log.error("Could not load the deployed resources of the stack, code syncs may fail", e);
      }
      addTemplateTriggers(this::onTemplateChange);
      addCodeTriggers(onCodeChange());
    }
    startCodeSync();
    return true;
  }

  private void startCodeSync() {
    synchronized (lock) {
      if (codeSyncTask != null || state == SyncWatchState.STOPPED) {
        return;
      }
      codeSyncTask = new CodeSyncTask();
      taskFactory.runTask(codeSyncTask);
    }
  }

  /** Stops the executor, blocking until the running code syncs are done. */
  private void stopCodeSync() {
    syncFlowExecutor.stop();
    TaskLogic task;
    synchronized (lock) {
      task = codeSyncTask;
      codeSyncTask = null;
    }
    if (task != null) {
      taskFactory.stopTask(task);
    }
  }

  private void onTemplateChange() {
    log.info("Template change detected. Queuing infra sync.");
    queueInfraSync();
  }

  private Function<ResourceIdentifier, Runnable> onCodeChange() {
    return id -> () -> {
      synchronized (lock) {
        if (state == SyncWatchState.INFRA_SYNC_PENDING || state == SyncWatchState.INFRA_SYNC_RUNNING || syncFlowFactory == null) {
          log.debug("Dropping code change for {}, an infra sync will pick it up", id);
          return;
        }
        SyncFlow flow = syncFlowFactory.createSyncFlow(id);
        if (flow == null) {
          log.debug("No code sync for {}", id);
          return;
        }
        log.info("Code change detected for {}. Queuing code sync.", id);
        syncFlowExecutor.addDelayedSyncFlow(flow, true, codeSyncWait);
      }
    };
  }

  void onSyncFlowException(SyncFlowException e) {
    Throwable cause = e.getCause();
    if (cause instanceof MissingPhysicalResourceException) {
      log.warn("Cannot find {} in the deployed stack. Queuing infra sync.", ((MissingPhysicalResourceException) cause).getResourceIdentifier());
      queueInfraSync();
    } else if (cause instanceof InfraSyncRequiredException) {
      InfraSyncRequiredException required = (InfraSyncRequiredException) cause;
      log.warn("Cannot code sync {}: {}. Queuing infra sync.", required.getResourceIdentifier(), required.getReason());
      queueInfraSync();
    } else {
      log.error("Failed to sync {}", e.getSyncFlow().getLogName(), cause);
    }
  }

  /** Runs the sync flow executor on its own thread until {@link #stopCodeSync()}. */
  private class CodeSyncTask implements TaskLogic {
    @Override
    public Duration runOneLoop() {
      syncFlowExecutor.execute(SyncWatchController.this::onSyncFlowException);
      return Duration.ofMillis(-1);
    }

    @Override
    public String getName() {
      return "CodeSync";
    }
  }

}
