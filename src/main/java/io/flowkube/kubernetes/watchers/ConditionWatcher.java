package io.flowkube.kubernetes.watchers;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import io.flowkube.kubernetes.models.ConditionOutcome;
import io.flowkube.kubernetes.utils.OneShot;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Turns a collection watch into a single {@link ConditionOutcome}.
 * <p>
 * Events for other object names are ignored: most watch endpoints only watch collections. The first
 * of condition met, deadline reached, stream error or external abort resolves the outcome; everything
 * arriving afterwards (late events, the error echoed by our own close) is ignored.
 * <p>
 * After a match the stream is closed after {@link #CLOSE_GRACE} rather than from inside the event
 * callback, so that the close never interleaves with an event still being delivered.
 * <p>
 * Each instance owns its deadline thread and its watch handle; use it once, then {@link #close()} it.
 *
 * @param <T> the watched resource type
 */
public class ConditionWatcher<T extends HasMetadata> extends AbstractWatch<T> implements AutoCloseable {
    public static final Duration CLOSE_GRACE = Duration.ofMillis(100);

    private final String kind;
    private final String name;
    private final String condition;
    private final Predicate<T> predicate;

    private final OneShot<ConditionOutcome<T>> outcome = new OneShot<>();
    private final AtomicReference<Watch> watch = new AtomicReference<>();
    private final AtomicReference<ScheduledFuture<?>> deadline = new AtomicReference<>();
    private final ScheduledExecutorService scheduler;

    public ConditionWatcher(Logger logger, String kind, String name, String condition, Predicate<T> predicate) {
        super(logger);
        this.kind = kind;
        this.name = name;
        this.condition = condition;
        this.predicate = predicate;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "k8s-wait-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the deadline, then opens the watch.
     *
     * @param opener opens the collection watch with this watcher as callback
     * @param timeout time allowed for the condition to be met
     */
    public void start(Function<Watcher<T>, Watch> opener, Duration timeout) {
        deadline.set(scheduler.schedule(() -> this.onDeadline(timeout), timeout.toMillis(), TimeUnit.MILLISECONDS));

        logger.debug("Watching {} '{}' until condition '{}' (timeout {})", kind, name, condition, timeout);

        Watch opened;
        try {
            opened = opener.apply(this);
        } catch (KubernetesClientException e) {
            if (outcome.complete(ConditionOutcome.streamError(kind, name, condition, e))) {
                logger.error("Unable to watch {} '{}': {}", kind, name, e.getMessage());
                this.cancelDeadline();
            }
            return;
        }

        watch.set(opened);

        // resolved while the watch was still being opened
        if (outcome.isDone()) {
            this.closeWatchLater();
        }
    }

    /**
     * Blocks until the outcome is known.
     */
    public ConditionOutcome<T> await() throws InterruptedException {
        return outcome.get();
    }

    public boolean isResolved() {
        return outcome.isDone();
    }

    /**
     * Resolves as {@link ConditionOutcome.State#ABORTED} unless already resolved, and closes the stream.
     */
    public void cancel() {
        if (outcome.complete(ConditionOutcome.aborted(kind, name, condition))) {
            logger.debug("Wait on {} '{}' cancelled", kind, name);
            this.cancelDeadline();
            this.closeWatch();
        }
    }

    @Override
    public void eventReceived(Action action, T resource) {
        super.eventReceived(action, resource);

        if (outcome.isDone()) {
            return;
        }

        if (resource == null || resource.getMetadata() == null || !name.equals(resource.getMetadata().getName())) {
            return;
        }

        logger.debug("{} '{}' received {} event", kind, name, action);

        boolean met;
        try {
            met = predicate.test(resource);
        } catch (RuntimeException e) {
            logger.warn("Condition '{}' could not be evaluated on {} '{}': {}", condition, kind, name, e.getMessage());
            met = false;
        }

        if (met && outcome.complete(ConditionOutcome.met(kind, name, condition, resource))) {
            logger.info("{} '{}' reached condition '{}'", kind, name, condition);
            this.cancelDeadline();
            this.closeWatchLater();
        }
    }

    @Override
    public void onClose() {
        if (outcome.complete(ConditionOutcome.aborted(kind, name, condition))) {
            logger.warn("Watch on {} '{}' closed before condition '{}' was reached", kind, name, condition);
            this.cancelDeadline();
            return;
        }

        super.onClose();
    }

    @Override
    public void onClose(WatcherException cause) {
        if (outcome.isDone()) {
            // the echo of our own close after resolution
            logger.debug("Watch on {} '{}' closed after resolution (expected): {}", kind, name, cause != null ? cause.getMessage() : null);
            return;
        }

        if (outcome.complete(ConditionOutcome.streamError(kind, name, condition, cause))) {
            logger.error("Watch error on {} '{}': {}", kind, name, cause != null ? cause.getMessage() : null, cause);
            this.cancelDeadline();
            this.closeWatch();
        }
    }

    @Override
    public void close() {
        this.cancel();
        // already scheduled closes still run after shutdown
        scheduler.shutdown();
    }

    private void onDeadline(Duration timeout) {
        if (outcome.complete(ConditionOutcome.timedOut(kind, name, condition, timeout))) {
            logger.warn("Timeout reached for {} '{}' waiting for condition '{}', closing watch", kind, name, condition);
            this.closeWatch();
        }
    }

    private void cancelDeadline() {
        ScheduledFuture<?> future = deadline.getAndSet(null);

        if (future != null) {
            future.cancel(false);
        }
    }

    private void closeWatchLater() {
        try {
            scheduler.schedule(this::closeWatch, CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.trace("Scheduler already stopped, closing watch on {} '{}' now", kind, name);
            this.closeWatch();
        }
    }

    private void closeWatch() {
        Watch current = watch.getAndSet(null);

        if (current != null) {
            current.close();
        }
    }
}
