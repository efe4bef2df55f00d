package stackwatch;

/** States of the {@link BuildWatchController}. */
public enum BuildWatchState {
  IDLE, PENDING_BUILD, BUILDING, STOPPED
}
