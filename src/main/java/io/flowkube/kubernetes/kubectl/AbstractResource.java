package io.flowkube.kubernetes.kubectl;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.flowkube.kubernetes.AbstractConnection;
import io.flowkube.kubernetes.models.Metadata;
import io.flowkube.kubernetes.models.ResourceKey;
import io.flowkube.kubernetes.models.ResourceStatus;
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
public abstract class AbstractResource extends AbstractConnection {
    @Schema(
        title = "The resource API version",
        description = "`v1`, `apps/v1`, `batch/v1` and `networking.k8s.io/v1` address the built-in kinds; " +
            "any other `<group>/<version>` addresses a custom resource."
    )
    @NotBlank
    @Builder.Default
    protected String apiVersion = "v1";

    @Schema(
        title = "The resource kind, case insensitive (e.g. Pod, deployment, CronJob)",
        description = "Custom resources are addressed by the naive plural `<kind in lower case>s`."
    )
    @NotBlank
    protected String kind;

    protected ResourceKey key(String name) {
        return ResourceKey.of(apiVersion, kind, namespace, name);
    }

    protected static Map<String, Object> view(GenericKubernetesResource resource) {
        return InstanceService.toMap(resource);
    }

    protected static Metadata metadata(GenericKubernetesResource resource) {
        return resource.getMetadata() != null ? Metadata.from(resource.getMetadata()) : null;
    }

    protected static ResourceStatus status(GenericKubernetesResource resource) {
        return ResourceStatus.from(resource);
    }
}
