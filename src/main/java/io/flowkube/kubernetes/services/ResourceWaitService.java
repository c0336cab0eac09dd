package io.flowkube.kubernetes.services;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.flowkube.kubernetes.models.ConditionOutcome;
import io.flowkube.kubernetes.models.ResourceKey;
import io.flowkube.kubernetes.watchers.ConditionWatcher;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Service for waiting on Kubernetes resource conditions.
 */
public abstract class ResourceWaitService {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    /**
     * Watches a collection until the named object satisfies the predicate, the timeout elapses,
     * the stream fails or the watch is closed from elsewhere.
     *
     * @param logger the logger for diagnostic messages
     * @param opener opens the collection watch for the given watcher
     * @param kind the kind of the awaited object, for messages
     * @param name the name of the awaited object
     * @param condition the condition name, for messages
     * @param predicate the condition itself
     * @param timeout the maximum duration to wait
     * @return exactly one outcome, never null
     */
    public static <T extends HasMetadata> ConditionOutcome<T> waitFor(
        Logger logger,
        Function<Watcher<T>, Watch> opener,
        String kind,
        String name,
        String condition,
        Predicate<T> predicate,
        Duration timeout
    ) throws InterruptedException {
        try (ConditionWatcher<T> watcher = new ConditionWatcher<>(logger, kind, name, condition, predicate)) {
            watcher.start(opener, timeout);
            return watcher.await();
        }
    }

    /**
     * Waits for any resource addressed by the key to reach a condition, as judged by {@link ConditionEvaluator}.
     */
    public static ConditionOutcome<GenericKubernetesResource> waitForCondition(
        ClusterSession session,
        Logger logger,
        ResourceKey key,
        String condition,
        Duration timeout
    ) throws InterruptedException {
        if (key.getName() == null || key.getName().isBlank()) {
            throw new ValidationException("Resource name is required to wait for a condition");
        }

        if (condition == null || condition.isBlank()) {
            throw new ValidationException("Condition is required");
        }

        String kind = key.canonicalKind();
        var collection = session.collection(key);

        logger.info("Waiting up to {} for {} '{}' ({}) to reach condition '{}'",
            timeout, kind, key.getName(), key.collectionPath(), condition);

        return waitFor(
            logger,
            collection::watch,
            kind,
            key.getName(),
            condition,
            resource -> ConditionEvaluator.evaluate(kind, resource, condition),
            timeout
        );
    }

    /**
     * Converts a timeout given in seconds at the boundary, falling back to {@link #DEFAULT_TIMEOUT}.
     */
    public static Duration timeout(Integer seconds) {
        if (seconds == null) {
            return DEFAULT_TIMEOUT;
        }

        if (seconds <= 0) {
            throw new ValidationException("Timeout must be a positive number of seconds, got " + seconds);
        }

        return Duration.ofSeconds(seconds);
    }
}
