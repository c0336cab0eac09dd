package io.flowkube.kubernetes.kubectl;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.flowkube.kubernetes.models.ConditionOutcome;
import io.flowkube.kubernetes.models.ResourceKey;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.runners.RunnableOperation;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.ResourceWaitService;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Duration;
import java.util.Map;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
@Schema(
    title = "Wait for a Kubernetes resource to reach a condition.",
    description = "Conditions are read from `status.conditions`, except for:\n" +
        "* Pod `Succeeded` and `Failed`, read from the pod phase.\n" +
        "* StatefulSet, derived from its replica counters: `Ready` and `Available` when all replicas are ready, " +
        "`Complete` when all are current and updated, `Succeeded` when all are ready and updated.\n" +
        "Fails with a timeout error when the condition is not reached in time."
)
public class Wait extends AbstractResource implements RunnableOperation<Wait.Output> {
    public static final String STATUS_MET = "met";
    public static final String STATUS_ABORTED = "aborted";

    @Schema(
        title = "The name of the resource"
    )
    @NotBlank
    private String name;

    @Schema(
        title = "The condition to wait for (e.g. Ready, Available, Complete)"
    )
    @NotBlank
    private String condition;

    @Schema(
        title = "The maximum time to wait, in seconds",
        description = "300 seconds when not set."
    )
    private Integer timeout;

    @Override
    public Output run(RunContext runContext) throws Exception {
        this.validate();

        ResourceKey key = this.key(name);
        Duration duration = ResourceWaitService.timeout(this.timeout);

        try (ClusterSession session = this.session(runContext)) {
            ConditionOutcome<GenericKubernetesResource> outcome = ResourceWaitService.waitForCondition(
                session,
                runContext.logger(),
                key,
                condition,
                duration
            );

            GenericKubernetesResource resource = outcome.orElseThrow(namespace);

            return Output.builder()
                .resource(resource != null ? view(resource) : null)
                .condition(condition)
                .status(outcome.isAborted() ? STATUS_ABORTED : STATUS_MET)
                .build();
        }
    }

    @Builder
    @Getter
    public static class Output implements io.flowkube.kubernetes.runners.Output {
        @Schema(
            title = "The resource as it was when the condition was met"
        )
        private final Map<String, Object> resource;

        @Schema(
            title = "The awaited condition"
        )
        private final String condition;

        @Schema(
            title = "`met`, or `aborted` when the watch was closed before the condition was reached"
        )
        private final String status;
    }
}
