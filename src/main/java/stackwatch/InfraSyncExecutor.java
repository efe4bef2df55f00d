package stackwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a full infra sync: build, then package, then deploy.
 */
public class InfraSyncExecutor {

  private static final Logger log = LoggerFactory.getLogger(InfraSyncExecutor.class);
  private final CommandContext build;
  private final CommandContext packager;
  private final CommandContext deploy;

  public InfraSyncExecutor(CommandContext build, CommandContext packager, CommandContext deploy) {
    this.build = build;
    this.packager = packager;
    this.deploy = deploy;
  }

  /** @throws Exception whatever the first failing step threw; later steps are not run */
  public void executeInfraSync() throws Exception {
    Utils.time(log, "build", () -> {
      build.setUp();
      build.run();
    });
    Utils.time(log, "package", () -> {
      packager.setUp();
      packager.run();
    });
    Utils.time(log, "deploy", () -> {
      deploy.setUp();
      deploy.run();
    });
  }

}
