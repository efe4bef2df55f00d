package stackwatch.sync;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

import stackwatch.ShellCommandContext;
import stackwatch.model.ResourceIdentifier;
import stackwatch.model.ResourceTypes;
import stackwatch.model.Stack;
import stackwatch.model.Stacks;

/**
 * Creates a {@link ShellSyncFlow} for each code-syncable resource, running {@code commandTemplate}.
 *
 * The resource's id is passed to the command as {@link #RESOURCE_VARIABLE}, and {@code {resource}}
 * is replaced by a quoted reference to it, so ids from the template are never parsed by the shell.
 *
 * With no command, no resource gets a flow, so every change waits for the next infra sync.
 */
public class ShellSyncFlowFactory implements SyncFlowFactory {

  private static final Logger log = LoggerFactory.getLogger(ShellSyncFlowFactory.class);
  public static final String RESOURCE_PLACEHOLDER = "{resource}";
  public static final String RESOURCE_VARIABLE = "STACKWATCH_RESOURCE";
  private final List<Stack> stacks;
  private final Path workingDirectory;
  private final String commandTemplate;

  /** @return a loader that builds a factory for each reload of the stacks */
  public static SyncFlowFactoryLoader loader(Path workingDirectory, String commandTemplate) {
    return stacks -> new ShellSyncFlowFactory(stacks, workingDirectory, commandTemplate);
  }

  public ShellSyncFlowFactory(List<Stack> stacks, Path workingDirectory, String commandTemplate) {
    this.stacks = stacks;
    this.workingDirectory = workingDirectory;
    this.commandTemplate = commandTemplate;
  }

  @Override
  public void loadPhysicalIdMapping() {
    // the sync command resolves physical ids itself
    log.debug("Loaded {} resources for code sync", Stacks.getAllResourceIds(stacks).size());
  }

  @Override
  public SyncFlow createSyncFlow(ResourceIdentifier id) {
    if (commandTemplate == null) {
      return null;
    }
    Optional<String> type = Stacks.getResourceType(stacks, id);
    if (!type.isPresent() || !ResourceTypes.CODE_SYNCABLE_RESOURCES.contains(type.get())) {
      return null;
    }
    String command = commandTemplate.replace(RESOURCE_PLACEHOLDER, ShellCommandContext.quotedVariable(RESOURCE_VARIABLE));
    return new ShellSyncFlow(id, new ShellCommandContext(workingDirectory, command, ImmutableMap.of(RESOURCE_VARIABLE, id.toString())));
  }

}
