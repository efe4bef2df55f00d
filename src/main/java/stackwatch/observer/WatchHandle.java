package stackwatch.observer;

/** The result of {@link PathObserver#schedule(PathHandler)}; pass it back to {@link PathObserver#unschedule(WatchHandle)}. */
public final class WatchHandle {

  private final PathHandler handler;
  private final Runnable canceller;
  private volatile boolean cancelled;

  WatchHandle(PathHandler handler, Runnable canceller) {
    this.handler = handler;
    this.canceller = canceller;
  }

  public PathHandler getHandler() {
    return handler;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  synchronized void cancel() {
    if (!cancelled) {
      cancelled = true;
      canceller.run();
    }
  }

  @Override
  public String toString() {
    return "WatchHandle " + handler.getPath();
  }

}
