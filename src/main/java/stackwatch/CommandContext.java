package stackwatch;

/**
 * One of the black-box steps of an infra sync (build, package, deploy) or a code sync.
 */
public interface CommandContext {

  /** Re-reads the step's inputs; called before every {@link #run()} but the first build's. */
  void setUp() throws Exception;

  void run() throws Exception;

}
