package stackwatch;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stackwatch.model.ResourceIdentifier;
import stackwatch.model.Stack;
import stackwatch.model.StackLoadException;
import stackwatch.model.StackProvider;
import stackwatch.model.Stacks;
import stackwatch.observer.FileEventFilter;
import stackwatch.observer.PathHandler;
import stackwatch.observer.PathObserver;
import stackwatch.tasks.TaskFactory;
import stackwatch.tasks.TaskLogic;
import stackwatch.trigger.CodeResourceTrigger;
import stackwatch.trigger.CodeTriggerFactory;
import stackwatch.trigger.InvalidTemplateFileException;
import stackwatch.trigger.TemplateTrigger;
import stackwatch.trigger.TriggerSetupException;

/**
 * The stack reloading and trigger scheduling shared by the build and sync controllers.
 *
 * Everything here is guarded by {@link #lock}, which filesystem callbacks also take before
 * touching controller state, so a callback never sees a half-reloaded set of triggers.
 */
abstract class WatchController implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(WatchController.class);
  protected static final Duration LOOP_INTERVAL = Duration.ofSeconds(1);
  protected final Object lock = new Object();
  protected final WatchConfig config;
  protected final StackProvider stackProvider;
  protected final PathObserver observer;
  protected final TaskFactory taskFactory;
  protected final WatchExclusions exclusions;
  private final boolean ignoreDirectoryModified;
  protected List<Stack> stacks = Collections.emptyList();
  protected CodeTriggerFactory triggerFactory;

  protected WatchController(
    WatchConfig config,
    StackProvider stackProvider,
    PathObserver observer,
    TaskFactory taskFactory,
    boolean ignoreDirectoryModified) {
    this.config = config;
    this.stackProvider = stackProvider;
    this.observer = observer;
    this.taskFactory = taskFactory;
    this.exclusions = WatchExclusions.forConfig(config);
    this.ignoreDirectoryModified = ignoreDirectoryModified;
  }

  /** @return true if the stacks loaded; if not, there are no stacks and no trigger factory */
  protected boolean updateStacks() {
    try {
      stacks = stackProvider.loadStacks(config.template, config.getParameterOverrides());
      triggerFactory = new CodeTriggerFactory(stacks, config.baseDir);
      return true;
    } catch (StackLoadException e) {
      log.warn("Could not load {}, only watching the template until it is fixed: {}", config.template, e.getMessage());
      stacks = Collections.emptyList();
      triggerFactory = null;
      return false;
    }
  }

  /** Schedules a trigger for the root template and every nested template; invalid templates are still watched. */
  protected void addTemplateTriggers(Runnable onTemplateChange) {
    Set<Path> templates = new LinkedHashSet<>();
    templates.add(config.template);
    for (Stack stack : stacks) {
      templates.add(stack.getLocation());
    }
    for (Path template : templates) {
      String stackName = stackNameOf(template);
      TemplateTrigger trigger = new TemplateTrigger(template, stackName, onTemplateChange);
      try {
        trigger.validateTemplate();
      } catch (InvalidTemplateFileException e) {
        log.warn(e.getMessage());
      }
      schedule(trigger.getPathHandlers(), template.toString());
    }
  }

  /** Schedules a code trigger for every resource that has one, skipping (and logging) resources that can't be watched. */
  protected void addCodeTriggers(Function<ResourceIdentifier, Runnable> onCodeChange) {
    if (triggerFactory == null) {
      return;
    }
    for (ResourceIdentifier id : Stacks.getAllResourceIds(stacks)) {
      try {
        CodeResourceTrigger trigger = triggerFactory.createTrigger(id, onCodeChange.apply(id), exclusions.forResource(id));
        if (trigger == null) {
          continue;
        }
        schedule(trigger.getPathHandlers(), id.toString());
      } catch (TriggerSetupException e) {
        log.warn("Cannot watch {}: {}", id, e.getMessage());
      }
    }
  }

  protected List<Stack> getStacks() {
    synchronized (lock) {
      return stacks;
    }
  }

  private void schedule(List<PathHandler> handlers, String what) {
    List<PathHandler> toSchedule = new ArrayList<>();
    for (PathHandler handler : handlers) {
      toSchedule.add(ignoreDirectoryModified ? handler.withEventHandler(FileEventFilter.ignoreDirectoryModified(handler.getEventHandler())) : handler);
    }
    try {
      observer.scheduleAll(toSchedule);
    } catch (UncheckedIOException e) {
      log.warn("Cannot watch {}: {}", what, e.getMessage());
    }
  }

  private String stackNameOf(Path template) {
    for (Stack stack : stacks) {
      if (stack.getLocation().equals(template)) {
        return stack.getStackPath();
      }
    }
    return "";
  }

}
