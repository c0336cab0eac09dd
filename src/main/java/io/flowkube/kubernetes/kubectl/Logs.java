package io.flowkube.kubernetes.kubectl;

import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.runners.RunnableOperation;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.OutputService;
import io.flowkube.kubernetes.services.PodLogService;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
@Schema(
    title = "Get the logs of a pod."
)
public class Logs extends AbstractLogs implements RunnableOperation<Logs.Output> {
    @Schema(
        title = "The name of the pod"
    )
    @NotBlank
    private String podName;

    @Override
    public Output run(RunContext runContext) throws Exception {
        this.validate();

        try (ClusterSession session = this.session(runContext)) {
            String logs = PodLogService.collect(session, runContext.logger(), namespace, podName, container, this.logOptions());
            runContext.logger().info("Read {} characters of logs from pod '{}' in namespace '{}'", logs.length(), podName, namespace);

            return Output.builder()
                .rawOutput(logs)
                .output(OutputService.format(logs))
                .build();
        }
    }

    @Builder
    @Getter
    public static class Output implements io.flowkube.kubernetes.runners.Output {
        @Schema(
            title = "The logs, as text"
        )
        private final String rawOutput;

        @Schema(
            title = "The logs",
            description = "The parsed JSON value when the logs are valid JSON, the raw text otherwise."
        )
        private final Object output;
    }
}
