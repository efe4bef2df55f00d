package stackwatch.trigger;

import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;

import stackwatch.observer.PathHandler;

/**
 * Watches a template file, only firing when the template parses and has materially changed.
 */
public class TemplateTrigger extends ResourceTrigger {

  private final Path templateFile;
  private final String stackName;
  private final Runnable onChange;
  private final DefinitionValidator validator;

  public TemplateTrigger(Path templateFile, String stackName, Runnable onChange) {
    this.templateFile = templateFile.toAbsolutePath().normalize();
    this.stackName = stackName;
    this.onChange = onChange;
    this.validator = new DefinitionValidator(this.templateFile);
  }

  /** @throws InvalidTemplateFileException if the template does not currently parse */
  public void validateTemplate() {
    if (!validator.validateFile()) {
      throw new InvalidTemplateFileException(templateFile, stackName);
    }
  }

  public Path getTemplateFile() {
    return templateFile;
  }

  @Override
  public List<PathHandler> getPathHandlers() {
    return ImmutableList.of(singleFileHandler(templateFile, this::onTemplateChanged));
  }

  private void onTemplateChanged() {
    if (validator.validateChange()) {
      onChange.run();
    }
  }

}
