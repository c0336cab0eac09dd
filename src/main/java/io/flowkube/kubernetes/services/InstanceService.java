package io.flowkube.kubernetes.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.flowkube.kubernetes.exceptions.ValidationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between fabric8 objects, JSON and plain maps.
 */
abstract public class InstanceService {
    public static final String MANAGED_LABEL = "managed-by-automation";
    public static final String MANAGED_VALUE = "flowkube";

    private static final ObjectMapper mapper = new ObjectMapper();

    private static final List<String> RUNTIME_METADATA = List.of(
        "creationTimestamp",
        "deletionTimestamp",
        "resourceVersion",
        "uid",
        "generation",
        "managedFields",
        "ownerReferences",
        "finalizers",
        "selfLink"
    );

    private static final List<String> RUNTIME_ANNOTATIONS = List.of(
        "kubectl.kubernetes.io/last-applied-configuration",
        "deployment.kubernetes.io/revision"
    );

    /**
     * Deep copy through a JSON round trip, the source is never shared with the copy.
     */
    public static <T> T clone(T source, Class<T> cls) {
        if (source == null) {
            return null;
        }

        return mapper.convertValue(mapper.valueToTree(source), cls);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> toMap(Object source) {
        if (source == null) {
            return null;
        }

        return mapper.convertValue(source, Map.class);
    }

    /**
     * Parses a JSON object, used for patch bodies and manifests.
     *
     * @throws ValidationException when the text is not valid JSON or not an object
     */
    public static ObjectNode parseObject(String json, String what) {
        if (json == null || json.isBlank()) {
            throw new ValidationException(what + " is required");
        }

        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON in " + what + ": " + e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject()) {
            throw new ValidationException(what + " must be a JSON object");
        }

        return (ObjectNode) node;
    }

    /**
     * Adds the managed label to a label map, creating it when needed.
     */
    public static Map<String, String> withManagedLabel(Map<String, String> labels) {
        Map<String, String> result = labels == null ? new HashMap<>() : new HashMap<>(labels);
        result.put(MANAGED_LABEL, MANAGED_VALUE);

        return result;
    }

    /**
     * Removes the fields the server owns from a manifest about to be created, and marks it as managed,
     * on its pod template too when it has one.
     */
    public static GenericKubernetesResource cleanForCreate(ObjectNode manifest) {
        ObjectNode copy = manifest.deepCopy();
        copy.remove("status");

        ObjectNode metadata = copy.has("metadata") && copy.get("metadata").isObject()
            ? (ObjectNode) copy.get("metadata")
            : copy.putObject("metadata");

        metadata.remove(RUNTIME_METADATA);

        if (metadata.get("annotations") instanceof ObjectNode) {
            ObjectNode annotations = (ObjectNode) metadata.get("annotations");
            annotations.remove(RUNTIME_ANNOTATIONS);
        }

        managed(metadata);

        JsonNode template = copy.path("spec").path("template");
        if (template instanceof ObjectNode) {
            ObjectNode templateMetadata = template.get("metadata") instanceof ObjectNode
                ? (ObjectNode) template.get("metadata")
                : ((ObjectNode) template).putObject("metadata");

            managed(templateMetadata);
        }

        return mapper.convertValue(copy, GenericKubernetesResource.class);
    }

    public static void managed(ObjectMeta metadata) {
        metadata.setLabels(withManagedLabel(metadata.getLabels()));
    }

    private static void managed(ObjectNode metadata) {
        ObjectNode labels = metadata.get("labels") instanceof ObjectNode
            ? (ObjectNode) metadata.get("labels")
            : metadata.putObject("labels");

        labels.put(MANAGED_LABEL, MANAGED_VALUE);
    }
}
