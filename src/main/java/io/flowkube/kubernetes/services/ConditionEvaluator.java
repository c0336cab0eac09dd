package io.flowkube.kubernetes.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Decides whether an observed object satisfies a named condition.
 * <p>
 * The same condition name means the same thing across kinds:
 * <ul>
 *     <li>Pod: {@code Ready} reads the Ready condition, {@code Succeeded} and {@code Failed} read {@code status.phase}.</li>
 *     <li>Deployment: {@code Available} reads the Available condition.</li>
 *     <li>Job: {@code Complete} and {@code Failed} read the matching condition.</li>
 *     <li>StatefulSet: derived from {@code spec.replicas} and the replica counters, it has no conditions.</li>
 *     <li>Anything else: {@code status.conditions[type=condition].status == "True"}.</li>
 * </ul>
 * Never throws, unknown combinations and missing status evaluate to {@code false}.
 */
@Slf4j
public abstract class ConditionEvaluator {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static boolean evaluate(String kind, Object resource, String condition) {
        if (kind == null || resource == null || condition == null) {
            return false;
        }

        try {
            JsonNode node = resource instanceof JsonNode ? (JsonNode) resource : MAPPER.valueToTree(resource);

            return evaluate(kind.toLowerCase(Locale.ROOT), node, condition);
        } catch (RuntimeException e) {
            log.debug("Unable to evaluate condition '{}' on {}", condition, kind, e);
            return false;
        }
    }

    private static boolean evaluate(String kind, JsonNode resource, String condition) {
        if (condition.equals("Ready") && kind.equals("pod")) {
            return conditionTrue(resource, "Ready");
        } else if (condition.equals("Available") && kind.equals("deployment")) {
            return conditionTrue(resource, "Available");
        } else if (condition.equals("Complete") && kind.equals("job")) {
            return conditionTrue(resource, "Complete");
        } else if (condition.equals("Failed") && kind.equals("job")) {
            return conditionTrue(resource, "Failed");
        } else if (condition.equals("Succeeded") && kind.equals("pod")) {
            return "Succeeded".equals(resource.path("status").path("phase").asText(null));
        } else if (condition.equals("Failed") && kind.equals("pod")) {
            return "Failed".equals(resource.path("status").path("phase").asText(null));
        } else if (kind.equals("statefulset")) {
            return statefulSet(resource, condition);
        }

        return conditionTrue(resource, condition);
    }

    private static boolean statefulSet(JsonNode resource, String condition) {
        long replicas = resource.path("spec").path("replicas").asLong(0);
        JsonNode status = resource.path("status");
        long ready = status.path("readyReplicas").asLong(0);
        long current = status.path("currentReplicas").asLong(0);
        long updated = status.path("updatedReplicas").asLong(0);

        if (replicas <= 0) {
            return false;
        }

        switch (condition) {
            case "Complete":
                return current == replicas && updated == replicas;
            case "Succeeded":
                return ready == replicas && updated == replicas;
            default:
                // Ready, Available and anything else
                return ready == replicas;
        }
    }

    private static boolean conditionTrue(JsonNode resource, String type) {
        JsonNode conditions = resource.path("status").path("conditions");

        if (!conditions.isArray()) {
            return false;
        }

        for (JsonNode condition : conditions) {
            if (type.equals(condition.path("type").asText(null))) {
                return "True".equals(condition.path("status").asText(null));
            }
        }

        return false;
    }
}
