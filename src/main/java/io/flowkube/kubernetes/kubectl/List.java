package io.flowkube.kubernetes.kubectl;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.models.Metadata;
import io.flowkube.kubernetes.models.ResourceKey;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.runners.RunnableOperation;
import io.flowkube.kubernetes.services.ClusterSession;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
@Schema(
    title = "List the Kubernetes resources of a kind.",
    description = "Lists the whole namespace, or the whole cluster for cluster scoped kinds such as Namespace."
)
public class List extends AbstractResource implements RunnableOperation<List.Output> {
    @Schema(
        title = "Only list the resources matching this label selector (e.g. `app=web,tier!=cache`)"
    )
    private String labelSelector;

    @Override
    public Output run(RunContext runContext) throws Exception {
        this.validate();

        ResourceKey key = this.key(null);

        try (ClusterSession session = this.session(runContext)) {
            GenericKubernetesResourceList list;
            try {
                list = labelSelector != null && !labelSelector.isBlank() ?
                    session.collection(key).list(new ListOptionsBuilder().withLabelSelector(labelSelector).build()) :
                    session.collection(key).list();
            } catch (KubernetesClientException e) {
                throw new ClusterCallException("list", key.canonicalKind(), null, namespace, e);
            }

            java.util.List<GenericKubernetesResource> items = list != null && list.getItems() != null ?
                list.getItems() :
                Collections.emptyList();

            runContext.logger().info("Found {} {} in {}", items.size(), key.plural(), key.collectionPath());

            return Output.builder()
                .items(items.stream().map(AbstractResource::view).collect(Collectors.toList()))
                .metadataItems(items.stream().map(AbstractResource::metadata).collect(Collectors.toList()))
                .size(items.size())
                .build();
        }
    }

    @Builder
    @Getter
    public static class Output implements io.flowkube.kubernetes.runners.Output {
        @Schema(
            title = "The listed resources"
        )
        private final java.util.List<Map<String, Object>> items;

        @Schema(
            title = "The metadata of the listed resources"
        )
        private final java.util.List<Metadata> metadataItems;

        @Schema(
            title = "The number of resources listed"
        )
        private final Integer size;
    }
}
