package io.flowkube.kubernetes.models;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.flowkube.kubernetes.services.InstanceService;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * The part of {@code metadata} returned by the resource operations.
 */
@Builder
@Getter
public class Metadata {
    private final String name;

    private final String namespace;

    @Schema(
        title = "Server assigned unique id"
    )
    private final String uid;

    private final Map<String, String> labels;

    private final Map<String, String> annotations;

    private final Instant creationTimestamp;

    @Schema(
        title = "Set once the object is being deleted"
    )
    private final Instant deletionTimestamp;

    private final Long generation;

    private final String resourceVersion;

    @Schema(
        title = "Whether the object carries the `managed-by-automation=flowkube` label"
    )
    private final boolean managed;

    public static Metadata from(ObjectMeta meta) {
        Map<String, String> labels = meta.getLabels();

        return Metadata.builder()
            .name(meta.getName())
            .namespace(meta.getNamespace())
            .uid(meta.getUid())
            .labels(labels)
            .annotations(meta.getAnnotations())
            .creationTimestamp(instant(meta.getCreationTimestamp()))
            .deletionTimestamp(instant(meta.getDeletionTimestamp()))
            .generation(meta.getGeneration())
            .resourceVersion(meta.getResourceVersion())
            .managed(labels != null && InstanceService.MANAGED_VALUE.equals(labels.get(InstanceService.MANAGED_LABEL)))
            .build();
    }

    private static Instant instant(String timestamp) {
        return timestamp != null ? Instant.parse(timestamp) : null;
    }
}
