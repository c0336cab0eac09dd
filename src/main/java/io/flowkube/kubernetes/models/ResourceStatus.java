package io.flowkube.kubernetes.models;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Builder
@Getter
public class ResourceStatus {
    @Schema(
        title = "The raw `status` of the resource",
        description = "Null when the resource carries no status, which is the case for ConfigMaps, Secrets and most freshly created objects."
    )
    private final Map<String, Object> status;

    @Schema(
        title = "The `status.phase`, for kinds that have one (Pod, PersistentVolumeClaim, Namespace)"
    )
    private final String phase;

    @Schema(
        title = "The `status.conditions`, as condition type to condition status (`True`, `False` or `Unknown`)"
    )
    private final Map<String, String> conditions;

    @SuppressWarnings("unchecked")
    public static ResourceStatus from(GenericKubernetesResource resource) {
        Object raw = resource.getAdditionalProperties() != null ? resource.getAdditionalProperties().get("status") : null;

        if (!(raw instanceof Map)) {
            return ResourceStatus.builder().build();
        }

        Map<String, Object> status = (Map<String, Object>) raw;
        Object phase = status.get("phase");

        return ResourceStatus.builder()
            .status(status)
            .phase(phase instanceof String ? (String) phase : null)
            .conditions(conditions(status.get("conditions")))
            .build();
    }

    private static Map<String, String> conditions(Object raw) {
        if (!(raw instanceof List)) {
            return null;
        }

        Map<String, String> conditions = new LinkedHashMap<>();
        for (Object item : (List<?>) raw) {
            if (item instanceof Map) {
                Object type = ((Map<?, ?>) item).get("type");
                Object value = ((Map<?, ?>) item).get("status");

                if (type != null) {
                    conditions.put(type.toString(), value != null ? value.toString() : null);
                }
            }
        }

        return conditions;
    }
}
