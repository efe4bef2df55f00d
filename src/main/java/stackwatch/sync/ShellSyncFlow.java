package stackwatch.sync;

import java.util.Collections;
import java.util.List;

import stackwatch.CommandContext;
import stackwatch.CommandFailedException;
import stackwatch.model.ResourceIdentifier;

/**
 * Syncs a resource by running a user-provided command.
 *
 * The command reports why it could not sync through its exit code: {@link #EXIT_MISSING_PHYSICAL_RESOURCE}
 * when the resource isn't deployed yet, {@link #EXIT_INFRA_SYNC_REQUIRED} when only an infra sync can
 * apply the change. Other non-zero codes are plain failures.
 */
public class ShellSyncFlow extends SyncFlow {

  public static final int EXIT_MISSING_PHYSICAL_RESOURCE = 2;
  public static final int EXIT_INFRA_SYNC_REQUIRED = 3;
  private final CommandContext command;

  public ShellSyncFlow(ResourceIdentifier resourceIdentifier, CommandContext command) {
    super(resourceIdentifier, "Sync " + resourceIdentifier);
    this.command = command;
  }

  CommandContext getCommand() {
    return command;
  }

  @Override
  public void setUp() throws Exception {
    command.setUp();
  }

  @Override
  public void gatherResources() {
    // the command finds its own artifacts
  }

  @Override
  public boolean compareRemote() {
    return false;
  }

  @Override
  public void sync() throws Exception {
    try {
      command.run();
    } catch (CommandFailedException e) {
      if (e.getExitCode() == EXIT_MISSING_PHYSICAL_RESOURCE) {
        throw new MissingPhysicalResourceException(getResourceIdentifier());
      } else if (e.getExitCode() == EXIT_INFRA_SYNC_REQUIRED) {
        throw new InfraSyncRequiredException(getResourceIdentifier(), "sync command asked for an infra sync");
      }
      throw e;
    }
  }

  @Override
  public List<SyncFlow> gatherDependencies() {
    return Collections.emptyList();
  }

}
