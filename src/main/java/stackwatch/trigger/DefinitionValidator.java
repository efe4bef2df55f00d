package stackwatch.trigger;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import stackwatch.model.StackLoadException;
import stackwatch.model.TemplateStackProvider;

/**
 * Parses a YAML/JSON definition file (a template, an API definition) and remembers the last good
 * version, so saves that are unparsable, or that don't change the document, can be ignored.
 */
public class DefinitionValidator {

  private static final Logger log = LoggerFactory.getLogger(DefinitionValidator.class);
  private final Path path;
  private final boolean detectChange;
  private JsonNode lastData;

  public DefinitionValidator(Path path) {
    this(path, true);
  }

  /** @param detectChange false to accept every valid version, even an identical one */
  public DefinitionValidator(Path path, boolean detectChange) {
    this.path = path;
    this.detectChange = detectChange;
    this.lastData = parse();
  }

  /** @return true if the file currently parses */
  public synchronized boolean validateFile() {
    return parse() != null;
  }

  /**
   * @return true if the file parses and differs from the last version we accepted; the new version becomes the baseline
   */
  public synchronized boolean validateChange() {
    JsonNode data = parse();
    if (data == null) {
      return false;
    }
    boolean changed = !detectChange || !data.equals(lastData);
    lastData = data;
    return changed;
  }

  private JsonNode parse() {
    try {
      return TemplateStackProvider.readTemplate(path);
    } catch (StackLoadException e) {
      log.debug("{} is not valid: {}", path, e.getMessage());
      return null;
    }
  }

}
