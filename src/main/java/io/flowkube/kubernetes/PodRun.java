package io.flowkube.kubernetes;

import io.fabric8.kubernetes.api.model.Pod;
import io.flowkube.kubernetes.models.ConditionOutcome;
import io.flowkube.kubernetes.models.LogOptions;
import io.flowkube.kubernetes.models.RunResult;
import io.flowkube.kubernetes.models.TerminalStatus;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.runners.RunnableOperation;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.OutputService;
import io.flowkube.kubernetes.services.PodLogService;
import io.flowkube.kubernetes.services.PodService;
import io.flowkube.kubernetes.services.ValidationService;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.slf4j.Logger;

import java.util.List;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
@Schema(
    title = "Run a pod to completion and capture its output.",
    description = "The pod runs a single container with `restartPolicy: Never`. Once its phase is Succeeded or Failed, " +
        "the last 1000 log lines are captured and the pod is deleted, whatever the outcome."
)
public class PodRun extends AbstractRun implements RunnableOperation<RunResult> {
    @Schema(
        title = "The container image"
    )
    @NotBlank
    private String image;

    @Schema(
        title = "The container arguments"
    )
    private List<String> args;

    @Schema(
        title = "The pod name",
        description = "Generated as `flowkube-pod-<epoch millis>` when not set."
    )
    private String podName;

    @Override
    public RunResult run(RunContext runContext) throws Exception {
        this.validate();

        Logger logger = runContext.logger();
        String name = this.podName != null ? this.podName : PodService.generatedName();
        ValidationService.validateName(name);

        try (ClusterSession session = this.session(runContext)) {
            PodService.create(session, logger, PodService.runOnce(name, namespace, image, args));

            TerminalStatus status;
            String rawOutput;
            boolean cleaned = false;

            try {
                ConditionOutcome<Pod> outcome = PodService.waitForCompletion(session, logger, namespace, name, waitRunning);
                Pod ended = outcome.orElseThrow(namespace);

                if (outcome.isAborted()) {
                    logger.warn("Watch aborted for pod '{}' in namespace '{}', returning empty output", name, namespace);
                    status = TerminalStatus.UNKNOWN;
                    rawOutput = "";
                } else {
                    status = PodService.terminalStatus(ended);
                    logger.info("Pod '{}' completed with status {}", name, status);
                    rawOutput = PodLogService.collect(session, logger, namespace, name, PodService.MAIN_CONTAINER, LogOptions.builder().build());
                }
            } finally {
                cleaned = PodService.delete(session, logger, namespace, name);
            }

            return RunResult.builder()
                .name(name)
                .namespace(namespace)
                .terminalStatus(status)
                .rawOutput(rawOutput)
                .output(OutputService.format(rawOutput))
                .cleaned(cleaned)
                .build();
        }
    }
}
