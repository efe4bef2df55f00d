package stackwatch.trigger;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DefinitionValidatorTest {

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private File file;

  @Before
  public void writeDefinition() throws Exception {
    file = temp.newFile("api.yaml");
    write("openapi: '3.0'\npaths: {}");
  }

  @Test
  public void testUnchangedIsNotAChange() throws Exception {
    DefinitionValidator v = new DefinitionValidator(file.toPath());
    // reformatting without changing the document
    write("openapi:   '3.0'\n\npaths: {}  # comment");
    assertThat(v.validateChange(), is(false));
  }

  @Test
  public void testChangeIsAcceptedOnce() throws Exception {
    DefinitionValidator v = new DefinitionValidator(file.toPath());
    write("openapi: '3.0'\npaths: {/hello: {}}");
    assertThat(v.validateChange(), is(true));
    // it is the new baseline
    assertThat(v.validateChange(), is(false));
  }

  @Test
  public void testInvalidIsNotAChange() throws Exception {
    DefinitionValidator v = new DefinitionValidator(file.toPath());
    write("openapi: [");
    assertThat(v.validateFile(), is(false));
    assertThat(v.validateChange(), is(false));
    // fixing it back to the original is not a change either
    write("openapi: '3.0'\npaths: {}");
    assertThat(v.validateChange(), is(false));
  }

  @Test
  public void testWithoutChangeDetection() throws Exception {
    DefinitionValidator v = new DefinitionValidator(file.toPath(), false);
    assertThat(v.validateChange(), is(true));
  }

  @Test
  public void testMissingFile() {
    DefinitionValidator v = new DefinitionValidator(temp.getRoot().toPath().resolve("missing.yaml"));
    assertThat(v.validateFile(), is(false));
    assertThat(v.validateChange(), is(false));
  }

  private void write(String content) throws Exception {
    FileUtils.writeStringToFile(file, content + "\n", StandardCharsets.UTF_8);
  }

}
