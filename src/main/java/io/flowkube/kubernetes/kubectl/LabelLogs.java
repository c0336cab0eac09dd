package io.flowkube.kubernetes.kubectl;

import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
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
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
@Schema(
    title = "Get the logs of every pod matching a label selector.",
    description = "Pods are read one after the other. A pod whose logs can't be read gets an entry with the error " +
        "instead of failing the whole operation."
)
public class LabelLogs extends AbstractLogs implements RunnableOperation<LabelLogs.Output> {
    public static final String NO_PODS = "No pods found matching the label selector";

    @Schema(
        title = "The label selector (e.g. `app=web`)"
    )
    @NotBlank
    private String labelSelector;

    @Override
    public Output run(RunContext runContext) throws Exception {
        this.validate();

        Logger logger = runContext.logger();

        try (ClusterSession session = this.session(runContext)) {
            List<Pod> pods;
            try {
                PodList list = session.pods(namespace).list(new ListOptionsBuilder().withLabelSelector(labelSelector).build());
                pods = list != null && list.getItems() != null ? list.getItems() : Collections.emptyList();
            } catch (KubernetesClientException e) {
                logger.error("Failed to list pods with label selector '{}' in namespace '{}'", labelSelector, namespace);
                throw new ClusterCallException("list", "Pod", null, namespace, e);
            }

            logger.info("Found {} pod(s) matching '{}' in namespace '{}'", pods.size(), labelSelector, namespace);

            if (pods.isEmpty()) {
                return Output.builder()
                    .podsFound(0)
                    .pods(Collections.emptyList())
                    .totalLogs(NO_PODS)
                    .labelSelector(labelSelector)
                    .namespace(namespace)
                    .build();
            }

            List<PodLogs> entries = new ArrayList<>();
            StringBuilder total = new StringBuilder();

            for (Pod pod : pods) {
                String podName = pod.getMetadata() != null ? pod.getMetadata().getName() : null;
                if (podName == null) {
                    logger.warn("Pod found without name, skipping");
                    continue;
                }

                String target = container != null ? container : PodLogService.firstContainer(pod);
                if (target == null) {
                    logger.warn("Pod '{}' has no containers, skipping", podName);
                    continue;
                }

                String phase = pod.getStatus() != null && pod.getStatus().getPhase() != null ? pod.getStatus().getPhase() : "Unknown";

                try {
                    String logs = PodLogService.collect(session, logger, namespace, podName, target, this.logOptions());

                    entries.add(PodLogs.builder()
                        .podName(podName)
                        .container(target)
                        .phase(phase)
                        .logs(OutputService.format(logs))
                        .build()
                    );

                    total.append("\n=== Pod: ").append(podName).append(" (").append(target).append(") ===\n")
                        .append(logs)
                        .append("\n=== End of ").append(podName).append(" logs ===\n");
                } catch (ClusterCallException e) {
                    logger.warn("Failed to get logs for pod '{}': {}", podName, e.getMessage());

                    entries.add(PodLogs.builder()
                        .podName(podName)
                        .container(target)
                        .phase(phase)
                        .logs("Error getting logs: " + e.getMessage())
                        .error(e.getMessage())
                        .build()
                    );

                    total.append("\n=== Pod: ").append(podName).append(" (Error) ===\n")
                        .append("Error getting logs: ").append(e.getMessage()).append("\n")
                        .append("=== End of ").append(podName).append(" logs ===\n");
                }
            }

            return Output.builder()
                .podsFound(pods.size())
                .pods(entries)
                .totalLogs(total.toString().trim())
                .labelSelector(labelSelector)
                .namespace(namespace)
                .build();
        }
    }

    @Builder
    @Getter
    public static class PodLogs {
        private final String podName;
        private final String container;
        private final String phase;

        @Schema(
            title = "The logs of the pod, parsed when they are valid JSON"
        )
        private final Object logs;

        @Schema(
            title = "Why the logs could not be read"
        )
        private final String error;
    }

    @Builder
    @Getter
    public static class Output implements io.flowkube.kubernetes.runners.Output {
        @Schema(
            title = "The number of pods matching the selector"
        )
        private final Integer podsFound;

        @Schema(
            title = "The logs of each pod"
        )
        private final List<PodLogs> pods;

        @Schema(
            title = "The logs of all pods concatenated, each one framed by its pod name"
        )
        private final String totalLogs;

        private final String labelSelector;

        private final String namespace;
    }
}
