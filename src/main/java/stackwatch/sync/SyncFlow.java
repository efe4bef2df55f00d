package stackwatch.sync;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stackwatch.model.ResourceIdentifier;

/**
 * Syncs one resource's local state to its deployed counterpart, without a full infra sync.
 *
 * Two flows are equal if they are the same kind of flow for the same resource, which is how
 * the executor tells that a newer submission should replace (or wait for) an older one.
 */
public abstract class SyncFlow {

  private static final Logger log = LoggerFactory.getLogger(SyncFlow.class);
  private final ResourceIdentifier resourceIdentifier;
  private final String logName;

  protected SyncFlow(ResourceIdentifier resourceIdentifier, String logName) {
    this.resourceIdentifier = resourceIdentifier;
    this.logName = logName;
  }

  public ResourceIdentifier getResourceIdentifier() {
    return resourceIdentifier;
  }

  public String getLogName() {
    return logName;
  }

  /** Re-reads whatever inputs the flow needs, e.g. build artifacts; called first on every execution. */
  public void setUp() throws Exception {
  }

  /** Collects the local state to sync. */
  public abstract void gatherResources() throws Exception;

  /** @return true if the remote already matches the local state, so {@link #sync()} can be skipped */
  public abstract boolean compareRemote() throws Exception;

  public abstract void sync() throws Exception;

  /** @return flows that need to run because this one did, e.g. functions using a just-synced layer */
  public abstract List<SyncFlow> gatherDependencies() throws Exception;

  /** @return the dependent flows to queue next */
  public final List<SyncFlow> execute() throws Exception {
    log.debug("{}: Setting up", logName);
    setUp();
    gatherResources();
    if (compareRemote()) {
      log.info("{}: Skipping sync, local and remote are the same", logName);
    } else {
      log.info("{}: Syncing", logName);
      sync();
    }
    List<SyncFlow> dependencies = gatherDependencies();
    log.debug("{}: Finished, {} dependencies", logName, dependencies.size());
    return dependencies;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return resourceIdentifier.equals(((SyncFlow) o).resourceIdentifier);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), resourceIdentifier);
  }

  @Override
  public String toString() {
    return logName;
  }

}
