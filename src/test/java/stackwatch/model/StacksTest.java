package stackwatch.model;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

public class StacksTest {

  private static final ObjectMapper json = new ObjectMapper();

  @Test
  public void testParseIdentifier() {
    assertThat(ResourceIdentifier.parse("HelloFunction"), is(new ResourceIdentifier("", "HelloFunction")));
    assertThat(ResourceIdentifier.parse("Child/GrandChild/Fn"), is(new ResourceIdentifier("Child/GrandChild", "Fn")));
    assertThat(ResourceIdentifier.parse("Child/GrandChild/Fn").toString(), is("Child/GrandChild/Fn"));
    assertThat(new ResourceIdentifier("", "Fn").toString(), is("Fn"));
  }

  @Test
  public void testAllResourceIds() throws Exception {
    List<Stack> stacks = stacks();
    assertThat(Stacks.getAllResourceIds(stacks).toString(), is("[HelloFunction, Renamed, Child, Child/ChildFunction]"));
  }

  @Test
  public void testGetResourceById() throws Exception {
    List<Stack> stacks = stacks();
    // nested resources need their stack path
    assertThat(Stacks.getResourceType(stacks, ResourceIdentifier.parse("Child/ChildFunction")), is(Optional.of("AWS::Serverless::Function")));
    assertThat(Stacks.getResourceById(stacks, ResourceIdentifier.parse("Other/ChildFunction")).isPresent(), is(false));
    // but a bare logical id searches every stack
    assertThat(Stacks.getResourceById(stacks, ResourceIdentifier.parse("ChildFunction")).isPresent(), is(true));
    // and either the SamResourceId or the logical id finds a renamed resource
    assertThat(Stacks.getResourceById(stacks, ResourceIdentifier.parse("Renamed")).isPresent(), is(true));
    assertThat(Stacks.getResourceById(stacks, ResourceIdentifier.parse("LayerABC")).isPresent(), is(true));
    assertThat(Stacks.getResourceById(stacks, ResourceIdentifier.parse("Missing")).isPresent(), is(false));
  }

  @Test
  public void testGetStackOf() throws Exception {
    List<Stack> stacks = stacks();
    assertThat(Stacks.getStackOf(stacks, ResourceIdentifier.parse("Child/ChildFunction")).get().getName(), is("Child"));
    assertThat(Stacks.getStackOf(stacks, ResourceIdentifier.parse("HelloFunction")).get().isRootStack(), is(true));
  }

  @Test
  public void testLocalPaths() {
    assertThat(ResourceTypes.isLocalPath("src/"), is(true));
    assertThat(ResourceTypes.isLocalPath("s3://bucket/key.zip"), is(false));
    assertThat(ResourceTypes.isLocalPath("https://example.com/api.yaml"), is(false));
    assertThat(ResourceTypes.isLocalPath(""), is(false));
  }

  private static List<Stack> stacks() throws Exception {
    JsonNode root = json.readTree("{\"Resources\": {"
      + "\"HelloFunction\": {\"Type\": \"AWS::Serverless::Function\"},"
      + "\"LayerABC\": {\"Type\": \"AWS::Serverless::LayerVersion\", \"Metadata\": {\"SamResourceId\": \"Renamed\"}},"
      + "\"Child\": {\"Type\": \"AWS::Serverless::Application\"},"
      + "\"NotAResource\": \"oops\"}}");
    JsonNode child = json.readTree("{\"Resources\": {\"ChildFunction\": {\"Type\": \"AWS::Serverless::Function\"}}}");
    return ImmutableList.of(
      new Stack("", "", Paths.get("/app/template.yaml"), Collections.emptyMap(), root, null),
      new Stack("", "Child", Paths.get("/app/child/template.yaml"), Collections.emptyMap(), child, null));
  }

}
