package stackwatch.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import stackwatch.model.ResourceIdentifier;

/**
 * A flow that records what it was asked to do; the label tells apart equal flows for the same resource.
 */
public class StubSyncFlow extends SyncFlow {

  public final String label;
  public final AtomicInteger syncs = new AtomicInteger();
  public final CountDownLatch executed = new CountDownLatch(1);
  public final List<SyncFlow> dependencies = new ArrayList<>();
  public RuntimeException failure;
  public boolean remoteMatches;
  public CountDownLatch blockUntil;

  public StubSyncFlow(String resourceId, String label) {
    super(ResourceIdentifier.parse(resourceId), "Stub " + resourceId + " " + label);
    this.label = label;
  }

  @Override
  public void gatherResources() throws Exception {
    if (blockUntil != null) {
      blockUntil.await();
    }
  }

  @Override
  public boolean compareRemote() {
    return remoteMatches;
  }

  @Override
  public void sync() {
    syncs.incrementAndGet();
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public List<SyncFlow> gatherDependencies() {
    executed.countDown();
    return dependencies;
  }

}
