package io.flowkube.kubernetes.services;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.CronJobList;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.V1BatchAPIGroupDSL;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.ScalableResource;
import io.flowkube.kubernetes.models.ResourceKey;

/**
 * A resolved cluster connection for the duration of one operation.
 * <p>
 * Typed clients are used for the objects the run pipelines create (pods, jobs, cron jobs);
 * every other group, apps and networking included, is reached through
 * {@link #resources(ResourceKey)} with the group, version and plural resolved by {@link ResourceKey}.
 */
public class ClusterSession implements AutoCloseable {
    private final KubernetesClient client;

    public ClusterSession(KubernetesClient client) {
        this.client = client;
    }

    public V1BatchAPIGroupDSL batch() {
        return client.batch().v1();
    }

    public NonNamespaceOperation<Pod, PodList, PodResource> pods(String namespace) {
        return client.pods().inNamespace(namespace);
    }

    public NonNamespaceOperation<Job, JobList, ScalableResource<Job>> jobs(String namespace) {
        return this.batch().jobs().inNamespace(namespace);
    }

    public NonNamespaceOperation<CronJob, CronJobList, Resource<CronJob>> cronJobs(String namespace) {
        return this.batch().cronjobs().inNamespace(namespace);
    }

    public MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> resources(ResourceKey key) {
        return client.genericKubernetesResources(key.definition());
    }

    /**
     * The collection addressed by the key: scoped to its namespace for namespaced kinds, cluster wide otherwise.
     */
    public NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> collection(ResourceKey key) {
        var resources = this.resources(key);

        if (key.isNamespaced()) {
            return resources.inNamespace(key.getNamespace());
        }

        return resources;
    }

    @Override
    public void close() {
        client.close();
    }
}
