package io.flowkube.kubernetes.services;

import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.models.ConditionOutcome;
import io.flowkube.kubernetes.models.TerminalStatus;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;

abstract public class PodService {
    public static final String MAIN_CONTAINER = "main-container";
    public static final String NAME_PREFIX = "flowkube-pod-";

    private static final List<String> COMPLETED_PHASES = List.of("Succeeded", "Failed"); // see https://kubernetes.io/docs/concepts/workloads/pods/pod-lifecycle/#pod-phase

    public static String generatedName() {
        return NAME_PREFIX + System.currentTimeMillis();
    }

    /**
     * A single container pod that runs once: {@code restartPolicy: Never}, marked as managed.
     */
    public static Pod runOnce(String name, String namespace, String image, List<String> args) {
        return new PodBuilder()
            .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .withLabels(Map.of(InstanceService.MANAGED_LABEL, InstanceService.MANAGED_VALUE))
            .endMetadata()
            .withNewSpec()
                .withRestartPolicy("Never")
                .withContainers(new ContainerBuilder()
                    .withName(MAIN_CONTAINER)
                    .withImage(image)
                    .withArgs(args)
                    .build()
                )
            .endSpec()
            .build();
    }

    public static Pod create(ClusterSession session, Logger logger, Pod pod) {
        String namespace = pod.getMetadata().getNamespace();
        String name = pod.getMetadata().getName();

        try {
            Pod created = session.pods(namespace).resource(pod).create();
            logger.info("Pod '{}' created in namespace '{}'", name, namespace);

            return created;
        } catch (KubernetesClientException e) {
            throw new ClusterCallException("create", "Pod", name, namespace, e);
        }
    }

    /**
     * Waits until the pod phase is Succeeded or Failed.
     */
    public static ConditionOutcome<Pod> waitForCompletion(ClusterSession session, Logger logger, String namespace, String name, Duration timeout) throws InterruptedException {
        return ResourceWaitService.waitFor(
            logger,
            watcher -> session.pods(namespace).watch(watcher),
            "Pod",
            name,
            "Completed",
            PodService::isCompleted,
            timeout
        );
    }

    public static boolean isCompleted(Pod pod) {
        return pod != null &&
            pod.getStatus() != null &&
            COMPLETED_PHASES.contains(pod.getStatus().getPhase());
    }

    public static TerminalStatus terminalStatus(Pod pod) {
        if (pod == null || pod.getStatus() == null) {
            return TerminalStatus.UNKNOWN;
        }

        switch (String.valueOf(pod.getStatus().getPhase())) {
            case "Succeeded":
                return TerminalStatus.SUCCEEDED;
            case "Failed":
                return TerminalStatus.FAILED;
            default:
                return TerminalStatus.UNKNOWN;
        }
    }

    /**
     * Deletes the pod, logging failures instead of raising them.
     *
     * @return true when the delete call succeeded
     */
    public static boolean delete(ClusterSession session, Logger logger, String namespace, String name) {
        try {
            session.pods(namespace).withName(name).delete();
            logger.info("Pod '{}' deleted from namespace '{}'", name, namespace);

            return true;
        } catch (KubernetesClientException e) {
            logger.warn("Failed to delete pod '{}' in namespace '{}': {}", name, namespace, e.getMessage(), e);

            return false;
        }
    }
}
