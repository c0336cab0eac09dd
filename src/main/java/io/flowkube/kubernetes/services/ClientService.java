package io.flowkube.kubernetes.services;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.flowkube.kubernetes.models.Connection;
import lombok.extern.slf4j.Slf4j;

@Slf4j
abstract public class ClientService {
    /**
     * A client for the given connection, or for the auto-detected context when there is none:
     * system properties, environment variables, kube config file, then the in-cluster service account.
     */
    public static KubernetesClient of(Connection connection) {
        KubernetesClientBuilder builder = new KubernetesClientBuilder();

        if (connection == null) {
            log.debug("No connection given, auto-configuring the Kubernetes client");
            return builder.build();
        }

        log.debug("Configuring the Kubernetes client from {}", connection.getLoadFrom());
        return builder.withConfig(connection.toConfig()).build();
    }

    /**
     * A session on the cluster, closing the client when closed.
     */
    public static ClusterSession session(Connection connection) {
        return new ClusterSession(of(connection));
    }
}
