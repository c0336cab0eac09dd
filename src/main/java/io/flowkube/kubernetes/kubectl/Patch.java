package io.flowkube.kubernetes.kubectl;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.models.Metadata;
import io.flowkube.kubernetes.models.ResourceKey;
import io.flowkube.kubernetes.models.ResourceStatus;
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
    title = "Patch a Kubernetes resource with a JSON merge patch.",
    description = "Fields of the patch replace the ones of the resource, objects are merged and `null` removes a field (RFC 7386)."
)
public class Patch extends AbstractResource implements RunnableOperation<Patch.Output> {
    @Schema(
        title = "The name of the resource to patch"
    )
    @NotBlank
    private String name;

    @Schema(
        title = "The patch content",
        description = "A JSON object with the fields to update."
    )
    @NotBlank
    private String patch;

    @Override
    public Output run(RunContext runContext) throws Exception {
        this.validate();

        ResourceKey key = this.key(name);
        String body = InstanceService.parseObject(patch, "patch").toString();

        try (ClusterSession session = this.session(runContext)) {
            runContext.logger().info("Patching {} '{}' in namespace '{}'", key.canonicalKind(), name, namespace);
            runContext.logger().debug("Patch content: {}", body);

            GenericKubernetesResource patched;
            try {
                patched = session.collection(key)
                    .withName(name)
                    .patch(PatchContext.of(PatchType.JSON_MERGE), body);
            } catch (KubernetesClientException e) {
                throw new ClusterCallException("patch", key.canonicalKind(), name, namespace, e);
            }

            if (patched == null) {
                throw new ClusterCallException("patch", key.canonicalKind(), name, namespace, "resource not found");
            }

            runContext.logger().info("Successfully patched {} '{}'", key.canonicalKind(), name);

            return Output.builder()
                .metadata(metadata(patched))
                .status(status(patched))
                .resource(view(patched))
                .build();
        }
    }

    @Builder
    @Getter
    public static class Output implements io.flowkube.kubernetes.runners.Output {
        @Schema(
            title = "The patched resource metadata"
        )
        private final Metadata metadata;

        @Schema(
            title = "The patched resource status"
        )
        private final ResourceStatus status;

        @Schema(
            title = "The patched resource"
        )
        private final Map<String, Object> resource;
    }
}
