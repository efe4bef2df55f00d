package stackwatch.sync;

/** Wraps whatever a {@link SyncFlow} threw, along with the flow, for the executor's exception handler. */
public class SyncFlowException extends RuntimeException {

  private static final long serialVersionUID = 1L;
  private final transient SyncFlow syncFlow;

  public SyncFlowException(SyncFlow syncFlow, Throwable cause) {
    super(syncFlow.getLogName() + " failed: " + cause.getMessage(), cause);
    this.syncFlow = syncFlow;
  }

  public SyncFlow getSyncFlow() {
    return syncFlow;
  }

}
