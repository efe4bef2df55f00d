package stackwatch.sync;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeFalse;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.SystemUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.InOrder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import stackwatch.CommandContext;
import stackwatch.CommandFailedException;
import stackwatch.ShellCommandContext;
import stackwatch.model.ResourceIdentifier;
import stackwatch.model.Stack;

public class ShellSyncFlowTest {

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();

  private final CommandContext command = mock(CommandContext.class);
  private final ShellSyncFlow flow = new ShellSyncFlow(ResourceIdentifier.parse("HelloFunction"), command);

  @Test
  public void testRunsCommand() throws Exception {
    assertThat(flow.execute(), is(Collections.emptyList()));
    InOrder o = inOrder(command);
    o.verify(command).setUp();
    o.verify(command).run();
  }

  @Test
  public void testMissingPhysicalResource() throws Exception {
    doThrow(new CommandFailedException("sync", ShellSyncFlow.EXIT_MISSING_PHYSICAL_RESOURCE)).when(command).run();
    assertThat(failureOf(flow), is(instanceOf(MissingPhysicalResourceException.class)));
  }

  @Test
  public void testInfraSyncRequired() throws Exception {
    doThrow(new CommandFailedException("sync", ShellSyncFlow.EXIT_INFRA_SYNC_REQUIRED)).when(command).run();
    assertThat(failureOf(flow), is(instanceOf(InfraSyncRequiredException.class)));
  }

  @Test
  public void testOtherFailure() throws Exception {
    doThrow(new CommandFailedException("sync", 1)).when(command).run();
    assertThat(failureOf(flow), is(instanceOf(CommandFailedException.class)));
  }

  @Test
  public void testEquality() {
    ShellSyncFlow same = new ShellSyncFlow(ResourceIdentifier.parse("HelloFunction"), mock(CommandContext.class));
    ShellSyncFlow other = new ShellSyncFlow(ResourceIdentifier.parse("OtherFunction"), command);
    assertThat(flow.equals(same), is(true));
    assertThat(flow.hashCode(), is(same.hashCode()));
    assertThat(flow.equals(other), is(false));
  }

  @Test
  public void testFactory() throws Exception {
    ObjectMapper json = new ObjectMapper();
    List<Stack> stacks = ImmutableList.of(new Stack(
      "",
      "",
      Paths.get("/app/template.yaml"),
      Collections.emptyMap(),
      json.readTree("{\"Resources\": {\"HelloFunction\": {\"Type\": \"AWS::Serverless::Function\"}, \"Queue\": {\"Type\": \"AWS::SQS::Queue\"}}}"),
      null));
    SyncFlowFactory factory = ShellSyncFlowFactory.loader(Paths.get("/app"), "deploy-one {resource}").load(stacks);
    SyncFlow hello = factory.createSyncFlow(ResourceIdentifier.parse("HelloFunction"));
    assertThat(hello, is(instanceOf(ShellSyncFlow.class)));
    ShellCommandContext context = (ShellCommandContext) ((ShellSyncFlow) hello).getCommand();
    assertThat(context.getEnvironment().get(ShellSyncFlowFactory.RESOURCE_VARIABLE), is("HelloFunction"));
    assertThat(context.getCommand(), is("deploy-one " + ShellCommandContext.quotedVariable(ShellSyncFlowFactory.RESOURCE_VARIABLE)));
    assertThat(factory.createSyncFlow(ResourceIdentifier.parse("Queue")), is(nullValue()));
    assertThat(factory.createSyncFlow(ResourceIdentifier.parse("Missing")), is(nullValue()));
    // and with no command, nothing is code synced
    assertThat(ShellSyncFlowFactory.loader(Paths.get("/app"), null).load(stacks).createSyncFlow(ResourceIdentifier.parse("HelloFunction")), is(nullValue()));
  }

  @Test
  public void testResourceIdIsNotParsedByTheShell() throws Exception {
    assumeFalse(SystemUtils.IS_OS_WINDOWS);
    // given a function whose id has shell syntax in it
    String id = "Hello$(touch injected);touch injected2";
    ObjectNode resources = new ObjectMapper().createObjectNode();
    resources.putObject(id).put("Type", "AWS::Serverless::Function");
    ObjectNode template = new ObjectMapper().createObjectNode();
    template.set("Resources", resources);
    Path dir = temp.getRoot().toPath();
    List<Stack> stacks = ImmutableList.of(new Stack("", "", dir.resolve("template.yaml"), Collections.emptyMap(), template, null));
    SyncFlow flow = ShellSyncFlowFactory.loader(dir, "printf %s {resource} > seen.txt").load(stacks).createSyncFlow(ResourceIdentifier.parse(id));
    // when it's synced
    flow.execute();
    // then the command got the id as-is, and nothing in it ran
    assertThat(new String(Files.readAllBytes(dir.resolve("seen.txt")), StandardCharsets.UTF_8), is(id));
    assertThat(Files.exists(dir.resolve("injected")), is(false));
    assertThat(Files.exists(dir.resolve("injected2")), is(false));
  }

  private static Exception failureOf(SyncFlow flow) {
    try {
      flow.execute();
      fail();
      return null;
    } catch (Exception e) {
      return e;
    }
  }

}
