package io.flowkube.kubernetes.kubectl;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in kinds addressable by the resource operations, with their REST plural.
 * Any apiVersion outside {@link #BUILT_IN_API_VERSIONS} is treated as a custom resource.
 */
@Getter
public enum KubernetesKind {

    // core
    POD("v1", "Pod", "pods", true),
    SERVICE("v1", "Service", "services", true),
    CONFIG_MAP("v1", "ConfigMap", "configmaps", true),
    SECRET("v1", "Secret", "secrets", true),
    PERSISTENT_VOLUME_CLAIM("v1", "PersistentVolumeClaim", "persistentvolumeclaims", true),
    NAMESPACE("v1", "Namespace", "namespaces", false),

    // apps
    DEPLOYMENT("apps/v1", "Deployment", "deployments", true),
    REPLICA_SET("apps/v1", "ReplicaSet", "replicasets", true),
    DAEMON_SET("apps/v1", "DaemonSet", "daemonsets", true),
    STATEFUL_SET("apps/v1", "StatefulSet", "statefulsets", true),

    // batch
    JOB("batch/v1", "Job", "jobs", true),
    CRON_JOB("batch/v1", "CronJob", "cronjobs", true),

    // networking
    INGRESS("networking.k8s.io/v1", "Ingress", "ingresses", true),
    NETWORK_POLICY("networking.k8s.io/v1", "NetworkPolicy", "networkpolicies", true);

    public static final Set<String> BUILT_IN_API_VERSIONS = Set.of("v1", "apps/v1", "batch/v1", "networking.k8s.io/v1");

    private final String apiVersion;
    private final String kind;
    private final String plural;
    private final boolean namespaced;

    KubernetesKind(String apiVersion, String kind, String plural, boolean namespaced) {
        this.apiVersion = apiVersion;
        this.kind = kind;
        this.plural = plural;
        this.namespaced = namespaced;
    }

    public static boolean isBuiltIn(String apiVersion) {
        return BUILT_IN_API_VERSIONS.contains(apiVersion);
    }

    public static Optional<KubernetesKind> from(String apiVersion, String kind) {
        if (kind == null) {
            return Optional.empty();
        }

        String lower = kind.toLowerCase(Locale.ROOT);

        return Arrays.stream(values())
            .filter(k -> k.apiVersion.equals(apiVersion))
            .filter(k -> k.kind.toLowerCase(Locale.ROOT).equals(lower))
            .findFirst();
    }
}
