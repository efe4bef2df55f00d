package stackwatch;

import java.time.Duration;
import java.util.function.Function;

import org.apache.commons.lang3.SystemUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stackwatch.model.ResourceIdentifier;
import stackwatch.model.StackProvider;
import stackwatch.observer.PathObserver;
import stackwatch.tasks.TaskFactory;

/**
 * Watches the template and every resource's code, and re-runs the build when they change.
 *
 * Code changes are debounced, so saving many files at once means one build; template changes
 * queue a build straight away. After every build, successful or not, the stacks are reloaded and
 * all triggers re-created, as the build may have changed what resources there are.
 */
public class BuildWatchController extends WatchController {

  private static final Logger log = LoggerFactory.getLogger(BuildWatchController.class);
  public static final Duration DEFAULT_BUILD_WAIT = Duration.ofSeconds(1);
  private final CommandContext buildContext;
  private final Debouncer debouncer;
  private final TemplatePoller templatePoller;
  private BuildWatchState state = BuildWatchState.IDLE;
  private boolean firstBuild = true;

  public BuildWatchController(WatchConfig config, CommandContext buildContext, StackProvider stackProvider, PathObserver observer, TaskFactory taskFactory) {
    this(config, buildContext, stackProvider, observer, taskFactory, SystemUtils.IS_OS_LINUX, DEFAULT_BUILD_WAIT, TemplatePoller.DEFAULT_INTERVAL);
  }

  BuildWatchController(
    WatchConfig config,
    CommandContext buildContext,
    StackProvider stackProvider,
    PathObserver observer,
    TaskFactory taskFactory,
    boolean ignoreDirectoryModified,
    Duration buildWait,
    Duration pollInterval) {
    super(config, stackProvider, observer, taskFactory, ignoreDirectoryModified);
    this.buildContext = buildContext;
    this.debouncer = new Debouncer("BuildDebouncer", buildWait, this::queueBuild);
    this.templatePoller = new TemplatePoller(config.template, pollInterval, this::onTemplateChange);
  }

  @Override
  public void onStart() {
    WatchExclusions.checkWatchSafety(config);
    queueBuild();
    startWatch();
    observer.start();
    taskFactory.runTask(debouncer);
    taskFactory.runTask(templatePoller);
    log.info("Build watch started.");
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    if (getState() == BuildWatchState.PENDING_BUILD) {
      executeBuild();
    }
    return LOOP_INTERVAL;
  }

  @Override
  public void onStop() {
    log.info("Shutting down build watch...");
    observer.stop();
    taskFactory.stopTask(debouncer);
    taskFactory.stopTask(templatePoller);
    synchronized (lock) {
      state = BuildWatchState.STOPPED;
    }
    log.info("Build watch stopped.");
  }

  /** Queues a build for the next loop, dropping any debounced one as it would be redundant. */
  public void queueBuild() {
    synchronized (lock) {
      if (state == BuildWatchState.STOPPED) {
        return;
      }
      state = BuildWatchState.PENDING_BUILD;
    }
    debouncer.cancel();
  }

  /** Queues a build once no other change has come in for the debounce wait. */
  public void queueDebouncedBuild() {
    debouncer.signal();
  }

  public BuildWatchState getState() {
    synchronized (lock) {
      return state;
    }
  }

  Debouncer getDebouncer() {
    return debouncer;
  }

  TemplatePoller getTemplatePoller() {
    return templatePoller;
  }

  /** Drops all watches, reloads the stacks, and schedules the template and code triggers again. */
  void startWatch() {
    synchronized (lock) {
      observer.unscheduleAll();
      updateStacks();
      addTemplateTriggers(this::onTemplateChange);
      addCodeTriggers(onCodeChange());
    }
  }

  void executeBuild() throws InterruptedException {
    boolean first;
    synchronized (lock) {
      if (state != BuildWatchState.PENDING_BUILD) {
        return;
      }
      state = BuildWatchState.BUILDING;
      first = firstBuild;
      firstBuild = false;
    }
    log.info(first ? "Starting initial build." : "File changes detected. Starting build.");
    try {
      // re-read the template first, so the build sees new resources
      if (!first) {
        buildContext.setUp();
      }
      buildContext.run();
      log.info("Build completed.");
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      log.error("Build failed. Watching for file changes to retry.", e);
    }
    synchronized (lock) {
      // a change that came in while building has already moved us to PENDING_BUILD
      if (state == BuildWatchState.BUILDING) {
        state = BuildWatchState.IDLE;
      }
    }
    startWatch();
  }

  private void onTemplateChange() {
    log.info("Template change detected. Starting build...");
    queueBuild();
  }

  private Function<ResourceIdentifier, Runnable> onCodeChange() {
    return id -> () -> {
      log.info("File changes detected for {}", id);
      queueDebouncedBuild();
    };
  }

}
