package stackwatch.sync;

import java.util.List;

import stackwatch.model.Stack;

/** Builds a {@link SyncFlowFactory} for freshly reloaded stacks. */
@FunctionalInterface
public interface SyncFlowFactoryLoader {

  SyncFlowFactory load(List<Stack> stacks);

}
