package stackwatch;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.jooq.lambda.Seq;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.InOrder;

import stackwatch.model.ResourceIdentifier;
import stackwatch.model.TemplateStackProvider;
import stackwatch.observer.StubPathObserver;
import stackwatch.sync.ContinuousSyncFlowExecutor;
import stackwatch.sync.InfraSyncRequiredException;
import stackwatch.sync.MissingPhysicalResourceException;
import stackwatch.sync.StubSyncFlow;
import stackwatch.sync.SyncFlowException;
import stackwatch.sync.SyncFlowFactory;
import stackwatch.tasks.StubTaskFactory;

public class SyncWatchControllerTest {

  private static final Duration wait = Duration.ofMillis(10);
  private static final String ONE_FUNCTION = String.join("\n", //
    "Resources:",
    "  HelloFunction:",
    "    Type: AWS::Serverless::Function",
    "    Properties:",
    "      CodeUri: hello/");

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private final InfraSyncExecutor infraSync = mock(InfraSyncExecutor.class);
  private final SyncFlowFactory syncFlowFactory = mock(SyncFlowFactory.class);
  private final ContinuousSyncFlowExecutor executor = mock(ContinuousSyncFlowExecutor.class);
  private final StubPathObserver observer = new StubPathObserver();
  private final StubTaskFactory taskFactory = new StubTaskFactory();
  private final StubSyncFlow helloFlow = new StubSyncFlow("HelloFunction", "hello");
  private Path root;
  private Path template;

  @Before
  public void setup() throws Exception {
    root = temp.getRoot().toPath().toAbsolutePath().normalize();
    template = root.resolve("template.yaml");
    write("template.yaml", ONE_FUNCTION);
    write("hello/app.py", "def handler(event, context): pass");
    when(syncFlowFactory.createSyncFlow(ResourceIdentifier.parse("HelloFunction"))).thenReturn(helloFlow);
  }

  @Test
  public void testStartsWithInfraSync() throws Exception {
    SyncWatchController controller = newController(false);
    // when started
    controller.onStart();
    // then an infra sync is queued, and only that
    assertThat(controller.getState(), is(SyncWatchState.INFRA_SYNC_PENDING));
    verify(infraSync, never()).executeInfraSync();
    // and the first loop runs it, then starts code syncs
    controller.runOneLoop();
    verify(infraSync).executeInfraSync();
    verify(syncFlowFactory).loadPhysicalIdMapping();
    assertThat(controller.getState(), is(SyncWatchState.IDLE));
    assertThat(observer.getScheduledPaths(), hasItem(root.resolve("hello")));
    assertThat(taskFactory.getRunningNames(), hasItem("CodeSync"));
  }

  @Test
  public void testCodeChangeQueuesCodeSync() throws Exception {
    SyncWatchController controller = startedController();
    observer.fireModified(root.resolve("hello/app.py"));
    verify(executor).addDelayedSyncFlow(helloFlow, true, wait);
  }

  @Test
  public void testResourceWithoutFlowIsNotSynced() throws Exception {
    when(syncFlowFactory.createSyncFlow(any())).thenReturn(null);
    startedController();
    observer.fireModified(root.resolve("hello/app.py"));
    verify(executor, never()).addDelayedSyncFlow(any(), anyBoolean(), any());
  }

  @Test
  public void testMissingPhysicalResourceQueuesOneInfraSync() throws Exception {
    SyncWatchController controller = startedController();
    // when the code sync can't find the deployed function, twice over
    controller.onSyncFlowException(new SyncFlowException(helloFlow, new MissingPhysicalResourceException(helloFlow.getResourceIdentifier())));
    controller.onSyncFlowException(new SyncFlowException(helloFlow, new MissingPhysicalResourceException(helloFlow.getResourceIdentifier())));
    // then one infra sync is queued
    assertThat(controller.getState(), is(SyncWatchState.INFRA_SYNC_PENDING));
    controller.runOneLoop();
    controller.runOneLoop();
    verify(infraSync, times(2)).executeInfraSync();
    assertThat(controller.getState(), is(SyncWatchState.IDLE));
  }

  @Test
  public void testInfraSyncRequiredQueuesInfraSync() throws Exception {
    SyncWatchController controller = startedController();
    controller.onSyncFlowException(new SyncFlowException(helloFlow, new InfraSyncRequiredException(helloFlow.getResourceIdentifier(), "runtime changed")));
    assertThat(controller.getState(), is(SyncWatchState.INFRA_SYNC_PENDING));
  }

  @Test
  public void testOtherSyncFailuresAreOnlyLogged() throws Exception {
    SyncWatchController controller = startedController();
    controller.onSyncFlowException(new SyncFlowException(helloFlow, new IllegalStateException("throttled")));
    assertThat(controller.getState(), is(SyncWatchState.IDLE));
  }

  @Test
  public void testTemplateChangePreemptsCodeSync() throws Exception {
    SyncWatchController controller = startedController();
    clearInvocations(executor, infraSync);
    // given a code sync is queued
    observer.fireModified(root.resolve("hello/app.py"));
    verify(executor).addDelayedSyncFlow(helloFlow, true, wait);
    // when the template changes
    write("template.yaml", ONE_FUNCTION + "\n      Timeout: 3");
    observer.fireModified(template);
    // then the queued code sync is dropped
    assertThat(controller.getState(), is(SyncWatchState.INFRA_SYNC_PENDING));
    verify(executor).clearDelayedSyncFlows();
    // and further code changes wait for the infra sync
    observer.fireModified(root.resolve("hello/app.py"));
    verify(executor, times(1)).addDelayedSyncFlow(any(), anyBoolean(), any());
    // which waits for running code syncs before deploying
    controller.runOneLoop();
    InOrder o = inOrder(executor, infraSync);
    o.verify(executor).stop();
    o.verify(infraSync).executeInfraSync();
  }

  @Test
  public void testInfraSyncFailureOnlyWatchesTemplate() throws Exception {
    // given the deploy fails
    doThrow(new CommandFailedException("sam deploy", 1)).when(infraSync).executeInfraSync();
    SyncWatchController controller = newController(false);
    controller.onStart();
    // when
    controller.runOneLoop();
    // then code syncs are paused, with only the template watched
    assertThat(controller.getState(), is(SyncWatchState.INFRA_FAILED));
    assertThat(observer.getScheduledPaths(), is(Seq.of(root).toList()));
    assertThat(taskFactory.getRunningNames().isEmpty(), is(true));
    // until the template is fixed
    write("template.yaml", ONE_FUNCTION + "\n      Timeout: 3");
    observer.fireModified(template);
    assertThat(controller.getState(), is(SyncWatchState.INFRA_SYNC_PENDING));
  }

  @Test
  public void testInvalidTemplateAfterInfraSync() throws Exception {
    SyncWatchController controller = newController(false);
    controller.onStart();
    write("template.yaml", "Resources: [");
    controller.runOneLoop();
    assertThat(controller.getState(), is(SyncWatchState.INFRA_FAILED));
    assertThat(observer.getScheduledPaths(), is(Seq.of(root).toList()));
  }

  @Test
  public void testCodeOnlyNeverRunsInfraSync() throws Exception {
    SyncWatchController controller = newController(true);
    // when started with --code
    controller.onStart();
    // then code syncs start straight away
    assertThat(controller.getState(), is(SyncWatchState.IDLE));
    assertThat(taskFactory.getRunningNames(), hasItem("CodeSync"));
    // and infra changes are refused
    controller.onSyncFlowException(new SyncFlowException(helloFlow, new MissingPhysicalResourceException(helloFlow.getResourceIdentifier())));
    write("template.yaml", ONE_FUNCTION + "\n      Timeout: 3");
    observer.fireModified(template);
    assertThat(controller.getState(), is(SyncWatchState.IDLE));
    controller.runOneLoop();
    verify(infraSync, never()).executeInfraSync();
    // while code changes still sync
    observer.fireModified(root.resolve("hello/app.py"));
    verify(executor).addDelayedSyncFlow(eq(helloFlow), eq(true), eq(wait));
  }

  @Test
  public void testStop() throws Exception {
    SyncWatchController controller = startedController();
    controller.onStop();
    assertThat(observer.isStopped(), is(true));
    verify(executor, times(2)).stop();
    assertThat(taskFactory.getRunningNames().isEmpty(), is(true));
    assertThat(controller.getState(), is(SyncWatchState.STOPPED));
    controller.queueInfraSync();
    assertThat(controller.getState(), is(SyncWatchState.STOPPED));
  }

  private SyncWatchController startedController() throws Exception {
    SyncWatchController controller = newController(false);
    controller.onStart();
    controller.runOneLoop();
    assertThat(controller.getState(), is(SyncWatchState.IDLE));
    return controller;
  }

  private SyncWatchController newController(boolean codeOnly) {
    return new SyncWatchController(
      new WatchConfig(template, root, root.resolve(".aws-sam/build"), root.resolve(".aws-sam/cache"), false, Collections.emptyMap(), Collections.emptyMap()),
      infraSync,
      stacks -> syncFlowFactory,
      new TemplateStackProvider(),
      observer,
      taskFactory,
      executor,
      codeOnly,
      wait);
  }

  private void write(String path, String content) throws Exception {
    FileUtils.writeStringToFile(new File(temp.getRoot(), path), content + "\n", StandardCharsets.UTF_8);
  }

}
