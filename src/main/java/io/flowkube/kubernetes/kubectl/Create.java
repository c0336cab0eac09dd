package io.flowkube.kubernetes.kubectl;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.flowkube.kubernetes.models.Metadata;
import io.flowkube.kubernetes.models.ResourceKey;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.runners.RunnableOperation;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.InstanceService;
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
    title = "Create a Kubernetes resource from a JSON manifest.",
    description = "Fields owned by the server (uid, resourceVersion, managedFields, status...) are removed first, so the " +
        "output of a get can be fed back as is. The resource and its pod template, when it has one, are labelled " +
        "`managed-by-automation=flowkube`."
)
public class Create extends AbstractResource implements RunnableOperation<Create.Output> {
    @Schema(
        title = "The name of the resource",
        description = "Used when the manifest has no `metadata.name`."
    )
    private String name;

    @Schema(
        title = "The resource manifest, as a JSON object"
    )
    @NotBlank
    private String resource;

    @Override
    public Output run(RunContext runContext) throws Exception {
        this.validate();

        ObjectNode manifest = InstanceService.parseObject(resource, "resource");
        GenericKubernetesResource cleaned = InstanceService.cleanForCreate(manifest);

        String resolvedName = cleaned.getMetadata().getName() != null ? cleaned.getMetadata().getName() : this.name;
        if (resolvedName == null || resolvedName.isBlank()) {
            throw new ValidationException("Resource name is required, set `name` or `metadata.name`");
        }

        ResourceKey key = this.key(resolvedName);

        cleaned.getMetadata().setName(resolvedName);
        if (cleaned.getApiVersion() == null) {
            cleaned.setApiVersion(key.getApiVersion());
        }
        if (cleaned.getKind() == null) {
            cleaned.setKind(key.canonicalKind());
        }
        if (key.isNamespaced()) {
            cleaned.getMetadata().setNamespace(namespace);
        }

        try (ClusterSession session = this.session(runContext)) {
            runContext.logger().info("Creating {} '{}' in namespace '{}'", key.canonicalKind(), resolvedName, namespace);

            GenericKubernetesResource created;
            try {
                created = session.collection(key).resource(cleaned).create();
            } catch (KubernetesClientException e) {
                throw new ClusterCallException("create", key.canonicalKind(), resolvedName, namespace, e);
            }

            runContext.logger().info("Created {} '{}'", key.canonicalKind(), resolvedName);

            return Output.builder()
                .metadata(metadata(created))
                .resource(view(created))
                .build();
        }
    }

    @Builder
    @Getter
    public static class Output implements io.flowkube.kubernetes.runners.Output {
        @Schema(
            title = "The created resource metadata"
        )
        private final Metadata metadata;

        @Schema(
            title = "The created resource, as returned by the cluster"
        )
        private final Map<String, Object> resource;
    }
}
