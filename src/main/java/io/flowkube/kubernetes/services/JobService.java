package io.flowkube.kubernetes.services;

import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.flowkube.kubernetes.models.ConditionOutcome;
import io.flowkube.kubernetes.models.LogOptions;
import io.flowkube.kubernetes.models.RestartPolicy;
import io.flowkube.kubernetes.models.TerminalStatus;
import org.slf4j.Logger;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

abstract public class JobService {
    public static final String JOB_NAME_LABEL = "job-name";
    public static final String BATCH_JOB_NAME_LABEL = "batch.kubernetes.io/job-name";

    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 6;
    private static final Random RANDOM = new SecureRandom();

    /**
     * {@code <base>-<6 random [a-z0-9]>}, checked against the DNS-1123 label rules before and after suffixing.
     */
    public static String uniqueName(String base) {
        if (base == null || base.isBlank()) {
            throw new ValidationException("Job name is required and cannot be empty");
        }

        ValidationService.validateName(base);

        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(SUFFIX_ALPHABET.charAt(RANDOM.nextInt(SUFFIX_ALPHABET.length())));
        }

        String name = base + "-" + suffix;
        ValidationService.validateName(name);

        return name;
    }

    /**
     * {@code <base>-<unix seconds>}, used for jobs created from a CronJob.
     */
    public static String timestampedName(String base, Instant now) {
        String name = base + "-" + now.getEpochSecond();
        ValidationService.validateName(name);

        return name;
    }

    public static Job runOnce(String name, String namespace, String image, List<String> args, RestartPolicy restartPolicy) {
        Map<String, String> managed = Map.of(InstanceService.MANAGED_LABEL, InstanceService.MANAGED_VALUE);

        return new JobBuilder()
            .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .withLabels(managed)
            .endMetadata()
            .withNewSpec()
                .withNewTemplate()
                    .withNewMetadata()
                        .withLabels(managed)
                    .endMetadata()
                    .withNewSpec()
                        .withRestartPolicy(restartPolicy.getValue())
                        .withContainers(new ContainerBuilder()
                            .withName(PodService.MAIN_CONTAINER)
                            .withImage(image)
                            .withArgs(args)
                            .build()
                        )
                    .endSpec()
                .endTemplate()
            .endSpec()
            .build();
    }

    public static Job create(ClusterSession session, Logger logger, Job job) {
        String namespace = job.getMetadata().getNamespace();
        String name = job.getMetadata().getName();

        try {
            Job created = session.jobs(namespace).resource(job).create();
            logger.info("Job '{}' created in namespace '{}'", name, namespace);

            return created;
        } catch (KubernetesClientException e) {
            throw new ClusterCallException("create", "Job", name, namespace, e);
        }
    }

    /**
     * Waits until at least one pod of the job succeeded or failed.
     */
    public static ConditionOutcome<Job> waitForCompletion(ClusterSession session, Logger logger, String namespace, String name, Duration timeout) throws InterruptedException {
        return ResourceWaitService.waitFor(
            logger,
            watcher -> session.jobs(namespace).watch(watcher),
            "Job",
            name,
            "Completed",
            JobService::isCompleted,
            timeout
        );
    }

    public static boolean isCompleted(Job job) {
        if (job == null || job.getStatus() == null) {
            return false;
        }

        return count(job.getStatus().getSucceeded()) > 0 || count(job.getStatus().getFailed()) > 0;
    }

    public static TerminalStatus terminalStatus(Job job) {
        if (!isCompleted(job)) {
            return TerminalStatus.UNKNOWN;
        }

        return count(job.getStatus().getSucceeded()) > 0 ? TerminalStatus.SUCCEEDED : TerminalStatus.FAILED;
    }

    /**
     * The sentence used as output when the logs of a finished job can't be read.
     */
    public static String statusSentence(Job job) {
        JobStatus status = job.getStatus();

        if (terminalStatus(job) == TerminalStatus.SUCCEEDED) {
            return "Job completed successfully. " + count(status.getSucceeded()) + " pod(s) succeeded.";
        }

        return "Job failed. " + count(status == null ? null : status.getFailed()) + " pod(s) failed.";
    }

    /**
     * Pods created by the job, looked up by {@code job-name}, then by {@code batch.kubernetes.io/job-name}
     * when the first selector finds nothing or fails.
     */
    public static List<Pod> findPods(ClusterSession session, Logger logger, String namespace, String job) {
        try {
            List<Pod> pods = listPods(session, namespace, JOB_NAME_LABEL, job);

            if (!pods.isEmpty()) {
                return pods;
            }
        } catch (KubernetesClientException e) {
            logger.debug("Listing pods with label {}={} failed, trying {}", JOB_NAME_LABEL, job, BATCH_JOB_NAME_LABEL, e);
        }

        try {
            return listPods(session, namespace, BATCH_JOB_NAME_LABEL, job);
        } catch (KubernetesClientException e) {
            throw new ClusterCallException("list pods of", "Job", job, namespace, e);
        }
    }

    /**
     * Logs of the first pod of the job.
     *
     * @param container the container to read, the first container of the pod when null
     */
    public static String logs(ClusterSession session, Logger logger, String namespace, String job, String container) throws InterruptedException {
        List<Pod> pods = findPods(session, logger, namespace, job);
        logger.debug("Found {} pod(s) for job '{}'", pods.size(), job);

        if (pods.isEmpty()) {
            return "No pods found for job " + job;
        }

        Pod pod = pods.get(0);
        String podName = pod.getMetadata() != null ? pod.getMetadata().getName() : null;

        if (podName == null) {
            return "No pod name found for job " + job;
        }

        String target = container != null ? container : PodLogService.firstContainer(pod);

        return PodLogService.collect(session, logger, namespace, podName, target, LogOptions.builder().build());
    }

    /**
     * Deletes the job and, in the background, its pods. Failures are logged, never raised.
     *
     * @return true when the delete call succeeded
     */
    public static boolean delete(ClusterSession session, Logger logger, String namespace, String name) {
        try {
            session.jobs(namespace)
                .withName(name)
                .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                .delete();
            logger.info("Job '{}' deleted from namespace '{}'", name, namespace);

            return true;
        } catch (KubernetesClientException e) {
            logger.warn("Failed to delete job '{}' in namespace '{}': {}", name, namespace, e.getMessage(), e);

            return false;
        }
    }

    private static List<Pod> listPods(ClusterSession session, String namespace, String label, String job) {
        PodList list = session.pods(namespace).withLabel(label, job).list();

        if (list == null || list.getItems() == null) {
            return Collections.emptyList();
        }

        return list.getItems();
    }

    private static int count(Integer value) {
        return value == null ? 0 : value;
    }
}
