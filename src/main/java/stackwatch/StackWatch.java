package stackwatch;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.jar.Manifest;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.rvesse.airline.annotations.Cli;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.help.Help;

import stackwatch.StackWatch.BuildCommand;
import stackwatch.StackWatch.SyncCommand;
import stackwatch.StackWatch.VersionCommand;
import stackwatch.model.TemplateStackProvider;
import stackwatch.observer.HandlerObserver;
import stackwatch.sync.ShellSyncFlowFactory;
import stackwatch.sync.SyncFlowFactoryLoader;
import stackwatch.tasks.TaskFactory;
import stackwatch.tasks.TaskLogic;
import stackwatch.tasks.ThreadBasedTaskFactory;

@Cli(name = "stackwatch", description = "re-runs build/sync of a serverless template as its code changes", commands = {
  BuildCommand.class,
  SyncCommand.class,
  VersionCommand.class }, defaultCommand = Help.class)
public class StackWatch {

  private static final Logger log = LoggerFactory.getLogger(StackWatch.class);

  static {
    LoggingConfig.init();
  }

  public static void main(String[] args) throws Exception {
    com.github.rvesse.airline.Cli<Runnable> cli = new com.github.rvesse.airline.Cli<>(StackWatch.class);
    cli.parse(args).run();
  }

  @Command(name = "version")
  public static class VersionCommand implements Runnable {
    @Override
    public void run() {
      System.out.println("Current Version: " + getVersion());
    }
  }

  public static abstract class BaseCommand implements Runnable {
    @Option(name = "--skip-limit-checks", description = "skip system file descriptor/watches checks")
    public boolean skipLimitChecks;

    @Option(name = "--enable-log-file", description = "enables logging debug statements to stackwatch.log")
    public boolean enableLogFile;

    @Option(name = "--debug", description = "log debug statements to the console")
    public boolean debug;

    @Option(name = { "-t", "--template" }, description = "template to watch, default: template.yaml")
    public String template = "template.yaml";

    @Option(name = { "--base-dir" }, description = "directory relative code paths are resolved against, default: the template's directory")
    public String baseDir;

    @Option(name = { "--build-dir" }, description = "where the build writes its artifacts, default: " + WatchConfig.DEFAULT_BUILD_DIR)
    public String buildDir;

    @Option(name = { "--cache-dir" }, description = "where the build caches, default: " + WatchConfig.DEFAULT_CACHE_DIR)
    public String cacheDir;

    @Option(name = { "--build-in-source" }, description = "the build writes into the code directories, so exclude common build outputs")
    public boolean buildInSource;

    @Option(name = { "--watch-exclude" }, description = "RESOURCE=PATTERN of files to not watch, .gitignore-style; use * as the resource for all of them")
    public List<String> watchExcludes = new ArrayList<>();

    @Option(name = { "--parameter-overrides" }, description = "KEY=VALUE template parameters")
    public List<String> parameterOverrides = new ArrayList<>();

    @Option(name = { "--build-command" }, description = "command that builds the template, default: sam build")
    public String buildCommand = "sam build";

    @Override
    public final void run() {
      if (debug) {
        LoggingConfig.enableDebug();
      }
      if (enableLogFile) {
        LoggingConfig.enableLogFile();
      }
      if (!skipLimitChecks && !SystemChecks.checkLimits()) {
        // SystemChecks will have log.error'd some output
        System.exit(-1);
      }
      runIfChecksOkay();
    }

    protected abstract void runIfChecksOkay();

    protected WatchConfig newConfig() {
      Path templatePath = Paths.get(template).toAbsolutePath().normalize();
      Path base = baseDir == null ? templatePath.getParent() : Paths.get(baseDir).toAbsolutePath().normalize();
      return new WatchConfig(
        templatePath,
        base,
        base.resolve(StringUtils.defaultIfEmpty(buildDir, WatchConfig.DEFAULT_BUILD_DIR)),
        base.resolve(StringUtils.defaultIfEmpty(cacheDir, WatchConfig.DEFAULT_CACHE_DIR)),
        buildInSource,
        parseWatchExcludes(watchExcludes),
        parseKeyValues(parameterOverrides));
    }

    /** Runs {@code controller} until the user hits control-c, then shuts it down in order. */
    protected void runUntilInterrupted(TaskFactory taskFactory, TaskLogic controller) {
      CountDownLatch stopped = new CountDownLatch(1);
      taskFactory.runTask(controller, stopped::countDown);
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        taskFactory.stopTask(controller);
        stopped.countDown();
      }, "ShutdownHook"));
      try {
        stopped.await();
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @Command(name = "build", description = "re-runs the build whenever the template or a resource's code changes")
  public static class BuildCommand extends BaseCommand {
    @Override
    protected void runIfChecksOkay() {
      WatchConfig config = newConfig();
      TaskFactory taskFactory = new ThreadBasedTaskFactory();
      BuildWatchController controller = new BuildWatchController(
        config,
        new ShellCommandContext(config.baseDir, buildCommand),
        new TemplateStackProvider(),
        HandlerObserver.create(taskFactory),
        taskFactory);
      runUntilInterrupted(taskFactory, controller);
    }
  }

  @Command(name = "sync", description = "deploys the template when it changes, and syncs just the changed resource when code changes")
  public static class SyncCommand extends BaseCommand {
    @Option(name = { "--package-command" }, description = "command that packages the build, default: sam package")
    public String packageCommand = "sam package";

    @Option(name = { "--deploy-command" }, description = "command that deploys the package, default: sam deploy")
    public String deployCommand = "sam deploy";

    @Option(name = { "--code-sync-command" }, description = "command that syncs one resource's code, with "
      + ShellSyncFlowFactory.RESOURCE_PLACEHOLDER
      + " for the resource id (also set as $"
      + ShellSyncFlowFactory.RESOURCE_VARIABLE
      + "); without it, code changes are left to the next infra sync")
    public String codeSyncCommand;

    @Option(name = { "--code" }, description = "only do code syncs, never build/package/deploy the template")
    public boolean code;

    @Override
    protected void runIfChecksOkay() {
      WatchConfig config = newConfig();
      TaskFactory taskFactory = new ThreadBasedTaskFactory();
      InfraSyncExecutor infraSync = new InfraSyncExecutor(
        new ShellCommandContext(config.baseDir, buildCommand),
        new ShellCommandContext(config.baseDir, packageCommand),
        new ShellCommandContext(config.baseDir, deployCommand));
      SyncFlowFactoryLoader loader = ShellSyncFlowFactory.loader(config.baseDir, codeSyncCommand);
      if (codeSyncCommand == null) {
        log.info("No --code-sync-command, code changes will wait for the next infra sync");
      }
      SyncWatchController controller = new SyncWatchController(
        config,
        infraSync,
        loader,
        new TemplateStackProvider(),
        HandlerObserver.create(taskFactory),
        taskFactory,
        code);
      runUntilInterrupted(taskFactory, controller);
    }
  }

  static Map<String, List<String>> parseWatchExcludes(List<String> values) {
    Map<String, List<String>> excludes = new LinkedHashMap<>();
    for (String value : values) {
      if (!value.contains("=")) {
        throw new IllegalArgumentException("--watch-exclude should be RESOURCE=PATTERN, got " + value);
      }
      excludes.computeIfAbsent(StringUtils.substringBefore(value, "="), k -> new ArrayList<>()).add(StringUtils.substringAfter(value, "="));
    }
    return excludes;
  }

  static Map<String, String> parseKeyValues(List<String> values) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String value : values) {
      if (!value.contains("=")) {
        throw new IllegalArgumentException("Expected KEY=VALUE, got " + value);
      }
      map.put(StringUtils.substringBefore(value, "="), StringUtils.substringAfter(value, "="));
    }
    return map;
  }

  public static String getVersion() {
    String version = null;
    URL url = StackWatch.class.getResource("/META-INF/MANIFEST.MF");
    try {
      try (InputStream in = url.openStream()) {
        Manifest m = new Manifest(in);
        version = m.getMainAttributes().getValue("StackWatch-Version");
      }
    } catch (Exception e) {
      log.error("Error loading manifest", e);
    }
    return StringUtils.defaultIfEmpty(version, "unspecified");
  }

}
