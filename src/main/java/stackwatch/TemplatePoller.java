package stackwatch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stackwatch.tasks.TaskLogic;

/**
 * Re-stats the template every few seconds, for editors and filesystems whose change events for it get lost.
 */
public class TemplatePoller implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(TemplatePoller.class);
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);
  private final Path template;
  private final Duration interval;
  private final Runnable onChange;
  private FileTime lastModified;

  public TemplatePoller(Path template, Duration interval, Runnable onChange) {
    this.template = template;
    this.interval = interval;
    this.onChange = onChange;
    this.lastModified = readLastModified();
  }

  @Override
  public Duration runOneLoop() {
    poll();
    return interval;
  }

  /** @return true if the template's modification time changed since the last poll */
  boolean poll() {
    FileTime current = readLastModified();
    if (current == null || Objects.equals(current, lastModified)) {
      return false;
    }
    lastModified = current;
    log.info("Template modification detected via polling");
    onChange.run();
    return true;
  }

  private FileTime readLastModified() {
    try {
      return Files.getLastModifiedTime(template);
    } catch (IOException e) {
      // mid-save, or deleted; the next poll will see it
      return null;
    }
  }

}
