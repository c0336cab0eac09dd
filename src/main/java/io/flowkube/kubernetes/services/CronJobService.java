package io.flowkube.kubernetes.services;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobTemplateSpec;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.models.JobOverrides;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual runs of a CronJob: a Job built from a copy of its job template, with optional overrides
 * and labels and annotations recording where it came from.
 */
abstract public class CronJobService {
    public static final String CRONJOB_LABEL = "cronjob";
    public static final String MANUAL_TRIGGER_LABEL = "manual-trigger";
    public static final String CREATED_FROM_ANNOTATION = "cronjob.kubernetes.io/created-from";
    public static final String TRIGGERED_AT_ANNOTATION = "flowkube.io/triggered-at";
    public static final String OVERRIDES_APPLIED_ANNOTATION = "flowkube.io/overrides-applied";

    public static CronJob read(ClusterSession session, String namespace, String name) {
        CronJob cronJob;
        try {
            cronJob = session.cronJobs(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new ClusterCallException("get", "CronJob", name, namespace, e);
        }

        if (cronJob == null) {
            throw new ClusterCallException("get", "CronJob", name, namespace, "not found");
        }

        if (cronJob.getSpec() == null || cronJob.getSpec().getJobTemplate() == null || cronJob.getSpec().getJobTemplate().getSpec() == null) {
            throw new ClusterCallException("get", "CronJob", name, namespace, "the CronJob does not have a valid jobTemplate");
        }

        return cronJob;
    }

    /**
     * Builds the Job to create. The CronJob itself is never modified.
     *
     * @param overrides the overrides to apply, null when there are none
     */
    public static Job jobFrom(CronJob cronJob, String jobName, String namespace, JobOverrides overrides, Instant now, Logger logger) {
        String cronJobName = cronJob.getMetadata().getName();
        JobTemplateSpec template = InstanceService.clone(cronJob.getSpec().getJobTemplate(), JobTemplateSpec.class);

        if (overrides != null) {
            applyOverrides(template, overrides, logger);
        }

        ObjectMeta templateMeta = template.getMetadata() != null ? template.getMetadata() : new ObjectMeta();

        Map<String, String> labels = new HashMap<>();
        if (templateMeta.getLabels() != null) {
            labels.putAll(templateMeta.getLabels());
        }
        labels.put(CRONJOB_LABEL, cronJobName);
        labels.put(MANUAL_TRIGGER_LABEL, "true");
        labels.put(InstanceService.MANAGED_LABEL, InstanceService.MANAGED_VALUE);

        Map<String, String> annotations = new HashMap<>();
        if (templateMeta.getAnnotations() != null) {
            annotations.putAll(templateMeta.getAnnotations());
        }
        annotations.put(CREATED_FROM_ANNOTATION, cronJobName);
        annotations.put(TRIGGERED_AT_ANNOTATION, now.toString());
        if (overrides != null) {
            annotations.put(OVERRIDES_APPLIED_ANNOTATION, "true");
        }

        PodTemplateSpec podTemplate = template.getSpec().getTemplate();
        if (podTemplate != null) {
            if (podTemplate.getMetadata() == null) {
                podTemplate.setMetadata(new ObjectMeta());
            }
            InstanceService.managed(podTemplate.getMetadata());
        }

        return new JobBuilder()
            .withApiVersion("batch/v1")
            .withKind("Job")
            .withNewMetadata()
                .withName(jobName)
                .withNamespace(namespace)
                .withLabels(labels)
                .withAnnotations(annotations)
            .endMetadata()
            .withSpec(template.getSpec())
            .build();
    }

    /**
     * Applies the overrides to every container of the template: command and args are replaced
     * when given, env variables are merged by name.
     */
    public static void applyOverrides(JobTemplateSpec template, JobOverrides overrides, Logger logger) {
        if (template.getSpec() == null || template.getSpec().getTemplate() == null || template.getSpec().getTemplate().getSpec() == null) {
            return;
        }

        List<Container> containers = template.getSpec().getTemplate().getSpec().getContainers();
        if (containers == null) {
            return;
        }

        for (Container container : containers) {
            if (overrides.hasCommand()) {
                logger.debug("Overriding command of container '{}'", container.getName());
                container.setCommand(new ArrayList<>(overrides.getCommand()));
            }

            if (overrides.hasArgs()) {
                logger.debug("Overriding args of container '{}'", container.getName());
                container.setArgs(new ArrayList<>(overrides.getArgs()));
            }

            if (overrides.hasEnvs()) {
                logger.debug("Merging {} env variable(s) into container '{}'", overrides.getEnvs().size(), container.getName());
                container.setEnv(mergeEnvs(container.getEnv(), overrides.getEnvs()));
            }
        }
    }

    /**
     * Order preserving update-or-append: a variable replaces the existing one with the same name in place,
     * otherwise it is appended. Variables without a name are dropped.
     */
    public static List<EnvVar> mergeEnvs(List<EnvVar> existing, List<EnvVar> overrides) {
        List<EnvVar> merged = existing == null ? new ArrayList<>() : new ArrayList<>(existing);

        for (EnvVar env : overrides) {
            if (env == null || env.getName() == null || env.getName().isBlank()) {
                continue;
            }

            int index = indexOf(merged, env.getName());
            if (index >= 0) {
                merged.set(index, env);
            } else {
                merged.add(env);
            }
        }

        return merged;
    }

    private static int indexOf(List<EnvVar> envs, String name) {
        for (int i = 0; i < envs.size(); i++) {
            if (name.equals(envs.get(i).getName())) {
                return i;
            }
        }

        return -1;
    }
}
