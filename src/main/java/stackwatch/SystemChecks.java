package stackwatch;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jnr.constants.platform.RLIMIT;
import jnr.posix.POSIX;
import jnr.posix.POSIXFactory;
import jnr.posix.RLimit;

/**
 * Does some very basic checks against system/OS limits.
 *
 * Every directory under a function/layer code directory costs one inotify
 * watch, and node_modules-heavy projects run out quickly. The values are
 * "you'll probably need at least x,000" guesses; the user can opt-out
 * with a CLI flag.
 */
public class SystemChecks {

  private static final Logger log = LoggerFactory.getLogger(SystemChecks.class);
  private static final File maxUserWatchesFile = new File("/proc/sys/fs/inotify/max_user_watches");

  /**
   * @return true if the system passes our best-guess capacity checks
   */
  public static boolean checkLimits() {
    return checkFileDescriptorLimit() && checkMaxUserWatches();
  }

  private static boolean checkFileDescriptorLimit() {
    if (SystemUtils.IS_OS_WINDOWS) {
      return true;
    }
    POSIX posix = POSIXFactory.getNativePOSIX();
    RLimit limit = posix.getrlimit(RLIMIT.RLIMIT_NOFILE.intValue());
    if (limit.rlimCur() < limit.rlimMax()) {
      log.info("Increasing file limit to {}", limit.rlimMax());
      posix.setrlimit(RLIMIT.RLIMIT_NOFILE.intValue(), limit.rlimMax(), limit.rlimMax());
      limit = posix.getrlimit(RLIMIT.RLIMIT_NOFILE.intValue());
    }
    if (limit.rlimCur() < 10240) {
      log.error("Your file limit is {} and should probably be increased", limit.rlimCur());
      log.info("  E.g. run: ulimit -n 10240");
      log.info("  Or use --skip-limit-checks to ignore this");
      return false;
    }
    return true;
  }

  private static boolean checkMaxUserWatches() {
    // only exists on linux, which is all we need to check
    if (!maxUserWatchesFile.exists()) {
      return true;
    }
    try {
      int maxUserWatches = Integer.parseInt(StringUtils.trim(FileUtils.readFileToString(maxUserWatchesFile, UTF_8)));
      if (maxUserWatches < 10_000) {
        log.error("Your max_user_watches is {} and should probably be increased (each directory == 1 watch)", maxUserWatches);
        log.info("  E.g. run: echo fs.inotify.max_user_watches=524288 | sudo tee -a /etc/sysctl.conf && sudo sysctl -p");
        log.info("  Or use --skip-limit-checks to ignore this");
        return false;
      }
    } catch (IOException | NumberFormatException e) {
      log.warn("Could not read {}", maxUserWatchesFile, e);
    }
    return true;
  }

}
