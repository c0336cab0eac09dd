package io.flowkube.kubernetes.kubectl;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.models.Metadata;
import io.flowkube.kubernetes.models.ResourceKey;
import io.flowkube.kubernetes.models.ResourceStatus;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.runners.RunnableOperation;
import io.flowkube.kubernetes.services.ClusterSession;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Map;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
@Schema(
    title = "Get a Kubernetes resource by name."
)
public class Get extends AbstractResource implements RunnableOperation<Get.Output> {
    @Schema(
        title = "The name of the resource"
    )
    @NotBlank
    private String name;

    @Override
    public Output run(RunContext runContext) throws Exception {
        this.validate();

        ResourceKey key = this.key(name);

        try (ClusterSession session = this.session(runContext)) {
            runContext.logger().debug("Getting {} '{}' from {}", key.canonicalKind(), name, key.collectionPath());

            GenericKubernetesResource resource;
            try {
                resource = session.collection(key).withName(name).get();
            } catch (KubernetesClientException e) {
                throw new ClusterCallException("get", key.canonicalKind(), name, namespace, e);
            }

            if (resource == null) {
                throw new ClusterCallException("get", key.canonicalKind(), name, namespace, "not found");
            }

            runContext.logger().info("Fetched {} '{}' in namespace '{}'", key.canonicalKind(), name, namespace);

            return Output.builder()
                .metadata(metadata(resource))
                .status(status(resource))
                .resource(view(resource))
                .build();
        }
    }

    @Builder
    @Getter
    public static class Output implements io.flowkube.kubernetes.runners.Output {
        @Schema(
            title = "The resource metadata"
        )
        private final Metadata metadata;

        @Schema(
            title = "The resource status"
        )
        private final ResourceStatus status;

        @Schema(
            title = "The full resource"
        )
        private final Map<String, Object> resource;
    }
}
