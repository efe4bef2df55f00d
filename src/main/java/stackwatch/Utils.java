package stackwatch;

import java.io.File;
import java.nio.file.Path;

import org.slf4j.Logger;

public class Utils {

  @FunctionalInterface
  public interface InterruptedRunnable {
    void run() throws InterruptedException;
  }

  @FunctionalInterface
  public interface ThrowingRunnable {
    void run() throws Exception;
  }

  public static void resetIfInterrupted(InterruptedRunnable r) {
    try {
      r.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  /** Runs {@code r}, logging how long {@code action} took; failures propagate to the caller un-logged. */
  public static void time(Logger log, String action, ThrowingRunnable r) throws Exception {
    log.info("Starting " + action);
    long start = System.currentTimeMillis();
    r.run();
    long stop = System.currentTimeMillis();
    log.info("Completed " + action + ": " + (stop - start) + "ms");
  }

  /** @return {@code path} relative to {@code root} with forward slashes, e.g. for matching against {@link PathRules}. */
  public static String toRelativePath(Path root, Path path) {
    return root.relativize(path).toString().replace(File.separator, "/");
  }

}
