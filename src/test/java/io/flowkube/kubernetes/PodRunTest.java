package io.flowkube.kubernetes;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.flowkube.kubernetes.exceptions.WatchTimeoutException;
import io.flowkube.kubernetes.models.RunResult;
import io.flowkube.kubernetes.models.TerminalStatus;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.InstanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PodRunTest {
    private ClusterSession session;
    private NonNamespaceOperation<Pod, PodList, PodResource> pods;
    private PodResource toCreate;
    private PodResource named;
    private RunContext runContext;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        session = mock(ClusterSession.class);
        pods = mock(NonNamespaceOperation.class);
        toCreate = mock(PodResource.class);
        named = mock(PodResource.class, RETURNS_DEEP_STUBS);
        runContext = new RunContext(LoggerFactory.getLogger(PodRunTest.class), connection -> session);

        when(session.pods("default")).thenReturn(pods);
        when(pods.resource(any(Pod.class))).thenReturn(toCreate);
        when(pods.withName("hello-pod")).thenReturn(named);
    }

    private void watchEmits(Consumer<Watcher<Pod>> events) {
        when(pods.watch(any())).thenAnswer(invocation -> {
            Watcher<Pod> watcher = invocation.getArgument(0);
            events.accept(watcher);
            return mock(Watch.class);
        });
    }

    private static Pod pod(String phase) {
        return new PodBuilder()
            .withNewMetadata().withName("hello-pod").withNamespace("default").endMetadata()
            .withNewStatus().withPhase(phase).endStatus()
            .build();
    }

    private static PodRun task(Duration waitRunning) {
        return PodRun.builder()
            .image("busybox")
            .args(List.of("echo", "{\"ok\": true}"))
            .podName("hello-pod")
            .waitRunning(waitRunning)
            .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void runCapturesParsedOutputAndDeletesThePod() throws Exception {
        watchEmits(watcher -> {
            watcher.eventReceived(Watcher.Action.ADDED, pod("Pending"));
            watcher.eventReceived(Watcher.Action.MODIFIED, pod("Succeeded"));
        });
        when(named.inContainer("main-container").tailingLines(1000).getLogInputStream())
            .thenReturn(new ByteArrayInputStream("{\"ok\": true}\n".getBytes(StandardCharsets.UTF_8)));

        RunResult result = task(Duration.ofSeconds(5)).run(runContext);

        assertThat(result.getName(), is("hello-pod"));
        assertThat(result.getTerminalStatus(), is(TerminalStatus.SUCCEEDED));
        assertThat(result.getRawOutput(), is("{\"ok\": true}\n"));
        assertThat((Map<String, Object>) result.getOutput(), hasEntry("ok", (Object) true));
        assertThat(result.isCleaned(), is(true));
        verify(named, times(1)).delete();

        ArgumentCaptor<Pod> created = ArgumentCaptor.forClass(Pod.class);
        verify(pods).resource(created.capture());
        assertThat(created.getValue().getSpec().getRestartPolicy(), is("Never"));
        assertThat(created.getValue().getSpec().getContainers().get(0).getName(), is("main-container"));
        assertThat(created.getValue().getMetadata().getLabels(), hasEntry(InstanceService.MANAGED_LABEL, InstanceService.MANAGED_VALUE));
    }

    @Test
    void failedPodIsReportedNotRaised() throws Exception {
        watchEmits(watcher -> watcher.eventReceived(Watcher.Action.MODIFIED, pod("Failed")));
        when(named.inContainer("main-container").tailingLines(1000).getLogInputStream())
            .thenReturn(new ByteArrayInputStream("oops".getBytes(StandardCharsets.UTF_8)));

        RunResult result = task(Duration.ofSeconds(5)).run(runContext);

        assertThat(result.getTerminalStatus(), is(TerminalStatus.FAILED));
        assertThat(result.getOutput(), is((Object) "oops"));
        verify(named, times(1)).delete();
    }

    @Test
    void timeoutStillDeletesThePodOnce() {
        watchEmits(watcher -> watcher.eventReceived(Watcher.Action.ADDED, pod("Running")));

        WatchTimeoutException e = assertThrows(WatchTimeoutException.class, () -> task(Duration.ofMillis(200)).run(runContext));

        assertThat(e.getName(), is("hello-pod"));
        verify(named, times(1)).delete();
    }

    @Test
    void watchErrorStillDeletesThePodOnce() {
        watchEmits(watcher -> watcher.onClose(new WatcherException("stream reset by peer")));

        ClusterCallException e = assertThrows(ClusterCallException.class, () -> task(Duration.ofSeconds(5)).run(runContext));

        assertThat(e.getOperation(), is("watch"));
        verify(named, times(1)).delete();
    }

    @Test
    void abortedWatchReturnsEmptyOutput() throws Exception {
        watchEmits(Watcher::onClose);

        RunResult result = task(Duration.ofSeconds(5)).run(runContext);

        assertThat(result.getTerminalStatus(), is(TerminalStatus.UNKNOWN));
        assertThat(result.getRawOutput(), is(""));
        verify(named, times(1)).delete();
    }

    @Test
    void deleteFailureIsNotFatal() throws Exception {
        watchEmits(watcher -> watcher.eventReceived(Watcher.Action.MODIFIED, pod("Succeeded")));
        when(named.inContainer("main-container").tailingLines(1000).getLogInputStream())
            .thenReturn(new ByteArrayInputStream("done".getBytes(StandardCharsets.UTF_8)));
        when(named.delete()).thenThrow(new KubernetesClientException("forbidden"));

        RunResult result = task(Duration.ofSeconds(5)).run(runContext);

        assertThat(result.getRawOutput(), is("done"));
        assertThat(result.isCleaned(), is(false));
    }

    @Test
    void createFailureNeverDeletes() {
        when(toCreate.create()).thenThrow(new KubernetesClientException("quota exceeded"));

        ClusterCallException e = assertThrows(ClusterCallException.class, () -> task(Duration.ofSeconds(5)).run(runContext));

        assertThat(e.getOperation(), is("create"));
        verify(pods, never()).withName(anyString());
    }

    @Test
    void invalidNameFailsBeforeAnyCall() {
        PodRun invalid = PodRun.builder()
            .image("busybox")
            .podName("Hello_Pod")
            .build();

        assertThrows(ValidationException.class, () -> invalid.run(runContext));
        verifyNoInteractions(session);
    }
}
