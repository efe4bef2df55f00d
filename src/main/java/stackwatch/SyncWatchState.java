package stackwatch;

/**
 * States of the {@link SyncWatchController}.
 *
 * Code syncs only run while {@code IDLE}.
 */
public enum SyncWatchState {
  IDLE, INFRA_SYNC_PENDING, INFRA_SYNC_RUNNING, INFRA_FAILED, STOPPED
}
