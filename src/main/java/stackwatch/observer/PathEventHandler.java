package stackwatch.observer;

/** Receives events for a {@link PathHandler}; called on the watcher thread. */
@FunctionalInterface
public interface PathEventHandler {

  void onEvent(PathEvent event);

}
