package stackwatch.sync;

import stackwatch.model.ResourceIdentifier;

/** Creates the sync flow for a resource, against one snapshot of the stacks. */
public interface SyncFlowFactory {

  /** Looks up the deployed (physical) ids of the stack's resources; called once per infra sync. */
  void loadPhysicalIdMapping() throws Exception;

  /** @return the flow to sync {@code id} on its own, or null if its type can't be synced without an infra sync */
  SyncFlow createSyncFlow(ResourceIdentifier id);

}
