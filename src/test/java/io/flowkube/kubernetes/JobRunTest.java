package io.flowkube.kubernetes;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.PodListBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobList;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.dsl.FilterWatchListDeletable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.fabric8.kubernetes.client.dsl.ScalableResource;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.flowkube.kubernetes.models.RestartPolicy;
import io.flowkube.kubernetes.models.RunResult;
import io.flowkube.kubernetes.models.TerminalStatus;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.JobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JobRunTest {
    private ClusterSession session;
    private NonNamespaceOperation<Job, JobList, ScalableResource<Job>> jobs;
    private NonNamespaceOperation<Pod, PodList, PodResource> pods;
    private ScalableResource<Job> named;
    private PodResource pod;
    private final AtomicReference<String> createdName = new AtomicReference<>();
    private RunContext runContext;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        session = mock(ClusterSession.class);
        jobs = mock(NonNamespaceOperation.class);
        pods = mock(NonNamespaceOperation.class);
        named = mock(ScalableResource.class, RETURNS_DEEP_STUBS);
        pod = mock(PodResource.class, RETURNS_DEEP_STUBS);
        ScalableResource<Job> toCreate = mock(ScalableResource.class);
        FilterWatchListDeletable<Pod, PodList, PodResource> byJobName = mock(FilterWatchListDeletable.class);
        runContext = new RunContext(LoggerFactory.getLogger(JobRunTest.class), connection -> session);

        when(session.jobs("default")).thenReturn(jobs);
        when(session.pods("default")).thenReturn(pods);
        when(jobs.resource(any(Job.class))).thenAnswer(invocation -> {
            Job job = invocation.getArgument(0);
            createdName.set(job.getMetadata().getName());
            return toCreate;
        });
        when(jobs.withName(anyString())).thenReturn(named);

        when(pods.withLabel(eq(JobService.JOB_NAME_LABEL), anyString())).thenReturn(byJobName);
        when(byJobName.list()).thenReturn(new PodListBuilder()
            .withItems(new PodBuilder().withNewMetadata().withName("report-pod").endMetadata().build())
            .build()
        );
        when(pods.withName("report-pod")).thenReturn(pod);
    }

    private void jobEnds(int succeeded, int failed) {
        when(jobs.watch(any())).thenAnswer(invocation -> {
            Watcher<Job> watcher = invocation.getArgument(0);
            watcher.eventReceived(Watcher.Action.MODIFIED, new JobBuilder()
                .withNewMetadata().withName(createdName.get()).withNamespace("default").endMetadata()
                .withNewStatus().withSucceeded(succeeded).withFailed(failed).endStatus()
                .build()
            );
            return mock(Watch.class);
        });
    }

    private void logsAre(String text) {
        when(pod.inContainer("main-container").tailingLines(1000).getLogInputStream())
            .thenReturn(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    private static JobRun task() {
        return JobRun.builder()
            .image("busybox")
            .args(List.of("echo", "hello"))
            .jobName("report")
            .waitRunning(Duration.ofSeconds(5))
            .build();
    }

    @Test
    void runCapturesLogsAndCleansUp() throws Exception {
        jobEnds(1, 0);
        logsAre("hello\n");

        RunResult result = task().run(runContext);

        assertThat(result.getName(), matchesPattern("report-[a-z0-9]{6}"));
        assertThat(result.getName(), is(createdName.get()));
        assertThat(result.getTerminalStatus(), is(TerminalStatus.SUCCEEDED));
        assertThat(result.getOutput(), is((Object) "hello\n"));
        assertThat(result.isCleaned(), is(true));

        ArgumentCaptor<Job> created = ArgumentCaptor.forClass(Job.class);
        verify(jobs).resource(created.capture());
        var podSpec = created.getValue().getSpec().getTemplate().getSpec();
        assertThat(podSpec.getRestartPolicy(), is(RestartPolicy.NEVER.getValue()));
        assertThat(podSpec.getContainers().get(0).getArgs(), is(List.of("echo", "hello")));
    }

    @Test
    void failedJobIsAResultNotAnError() throws Exception {
        jobEnds(0, 1);
        logsAre("boom");

        RunResult result = task().run(runContext);

        assertThat(result.getTerminalStatus(), is(TerminalStatus.FAILED));
        assertThat(result.getRawOutput(), is("boom"));
    }

    @Test
    void unreadableLogsFallBackToStatusSentence() throws Exception {
        jobEnds(1, 0);
        when(pod.inContainer("main-container").tailingLines(1000).getLogInputStream())
            .thenThrow(new KubernetesClientException("container not found"));

        RunResult result = task().run(runContext);

        assertThat(result.getTerminalStatus(), is(TerminalStatus.SUCCEEDED));
        assertThat(result.getOutput(), is((Object) "Job completed successfully. 1 pod(s) succeeded."));
    }

    @Test
    void failedCleanupIsReported() throws Exception {
        jobEnds(1, 0);
        logsAre("ok");
        when(jobs.withName(anyString())).thenThrow(new KubernetesClientException("forbidden"));

        RunResult result = task().run(runContext);

        assertThat(result.getRawOutput(), is("ok"));
        assertThat(result.isCleaned(), is(false));
    }

    @Test
    void noCleanupWhenDisabled() throws Exception {
        jobEnds(1, 0);
        logsAre("ok");

        RunResult result = JobRun.builder()
            .image("busybox")
            .jobName("report")
            .cleanup(false)
            .waitRunning(Duration.ofSeconds(5))
            .build()
            .run(runContext);

        assertThat(result.isCleaned(), is(false));
        verify(jobs, never()).withName(anyString());
    }

    @Test
    void abortedWatchIsUnknownAndKeepsTheJob() throws Exception {
        when(jobs.watch(any())).thenAnswer(invocation -> {
            Watcher<Job> watcher = invocation.getArgument(0);
            watcher.onClose();
            return mock(Watch.class);
        });

        RunResult result = task().run(runContext);

        assertThat(result.getTerminalStatus(), is(TerminalStatus.UNKNOWN));
        assertThat(result.getOutput(), is((Object) AbstractJob.ABORTED_OUTPUT));
        assertThat(result.isCleaned(), is(false));
        verify(jobs, never()).withName(anyString());
    }

    @Test
    void invalidNameFailsBeforeAnyCall() {
        JobRun invalid = JobRun.builder()
            .image("busybox")
            .jobName("Report_Job")
            .build();

        assertThrows(ValidationException.class, () -> invalid.run(runContext));
        verifyNoInteractions(session);
    }

    @Test
    void tooLongNameFailsBeforeAnyCall() {
        JobRun invalid = JobRun.builder()
            .image("busybox")
            .jobName("a".repeat(60))
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> invalid.run(runContext));
        assertThat(e.getMessage().contains("too long"), is(true));
        verifyNoInteractions(session);
    }
}
