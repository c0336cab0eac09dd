package io.flowkube.kubernetes;

import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.flowkube.kubernetes.models.ConditionOutcome;
import io.flowkube.kubernetes.models.RunResult;
import io.flowkube.kubernetes.models.TerminalStatus;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.JobService;
import io.flowkube.kubernetes.services.OutputService;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.slf4j.Logger;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
public abstract class AbstractJob extends AbstractRun {
    public static final String ABORTED_OUTPUT = "Job watch was aborted";

    @Schema(
        title = "Whether to delete the job once it completed",
        description = "Pods are deleted in the background. A failed delete is reported by `cleaned: false`, it never fails the run."
    )
    @NotNull
    @Builder.Default
    protected Boolean cleanup = true;

    /**
     * Waits for the created job, reads the logs of its first pod, then deletes it when asked to.
     *
     * @param container the container to read, the first container of the pod when null
     * @throws io.flowkube.kubernetes.exceptions.WatchTimeoutException when the job doesn't complete in time
     * @throws ClusterCallException when the job watch fails
     */
    protected RunResult.RunResultBuilder complete(ClusterSession session, Logger logger, String jobName, String container) throws InterruptedException {
        ConditionOutcome<Job> outcome = JobService.waitForCompletion(session, logger, namespace, jobName, waitRunning);
        Job job = outcome.orElseThrow(namespace);

        if (outcome.isAborted()) {
            logger.warn("Job watch was aborted for job '{}' in namespace '{}', result is unknown", jobName, namespace);

            return RunResult.builder()
                .name(jobName)
                .namespace(namespace)
                .terminalStatus(TerminalStatus.UNKNOWN)
                .rawOutput(ABORTED_OUTPUT)
                .output(ABORTED_OUTPUT)
                .cleaned(false);
        }

        TerminalStatus status = JobService.terminalStatus(job);
        logger.info("Job '{}' completed with status {}", jobName, status);

        String rawOutput;
        try {
            rawOutput = JobService.logs(session, logger, namespace, jobName, container);
        } catch (ClusterCallException | ValidationException e) {
            logger.warn("Failed to get logs for job '{}' in namespace '{}': {}", jobName, namespace, e.getMessage());
            rawOutput = JobService.statusSentence(job);
        }

        boolean cleaned = cleanup && JobService.delete(session, logger, namespace, jobName);

        return RunResult.builder()
            .name(jobName)
            .namespace(namespace)
            .terminalStatus(status)
            .rawOutput(rawOutput)
            .output(OutputService.format(rawOutput))
            .cleaned(cleaned);
    }
}
