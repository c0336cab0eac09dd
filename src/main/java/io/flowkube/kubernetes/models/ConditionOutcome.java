package io.flowkube.kubernetes.models;

import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.exceptions.WatchTimeoutException;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * The single result of a condition wait: exactly one of {@link State} per wait.
 *
 * @param <T> the watched resource type
 */
@Getter
@ToString
public class ConditionOutcome<T> {
    public enum State {
        MET,
        TIMED_OUT,
        STREAM_ERROR,
        ABORTED
    }

    private final State state;
    private final String kind;
    private final String name;
    private final String condition;
    private final Duration timeout;
    private final T resource;
    private final Throwable cause;

    private ConditionOutcome(State state, String kind, String name, String condition, Duration timeout, T resource, Throwable cause) {
        this.state = state;
        this.kind = kind;
        this.name = name;
        this.condition = condition;
        this.timeout = timeout;
        this.resource = resource;
        this.cause = cause;
    }

    public static <T> ConditionOutcome<T> met(String kind, String name, String condition, T resource) {
        return new ConditionOutcome<>(State.MET, kind, name, condition, null, resource, null);
    }

    public static <T> ConditionOutcome<T> timedOut(String kind, String name, String condition, Duration timeout) {
        return new ConditionOutcome<>(State.TIMED_OUT, kind, name, condition, timeout, null, null);
    }

    public static <T> ConditionOutcome<T> streamError(String kind, String name, String condition, Throwable cause) {
        return new ConditionOutcome<>(State.STREAM_ERROR, kind, name, condition, null, null, cause);
    }

    public static <T> ConditionOutcome<T> aborted(String kind, String name, String condition) {
        return new ConditionOutcome<>(State.ABORTED, kind, name, condition, null, null, null);
    }

    public boolean isMet() {
        return state == State.MET;
    }

    public boolean isAborted() {
        return state == State.ABORTED;
    }

    /**
     * Turns failed outcomes into the matching exception.
     *
     * @param namespace namespace of the watched resource, for the error message
     * @return the matched resource when {@link State#MET}, null when {@link State#ABORTED}
     * @throws WatchTimeoutException on {@link State#TIMED_OUT}
     * @throws ClusterCallException on {@link State#STREAM_ERROR}
     */
    public T orElseThrow(String namespace) {
        switch (state) {
            case TIMED_OUT:
                throw new WatchTimeoutException(kind, name, condition, timeout);
            case STREAM_ERROR:
                throw new ClusterCallException("watch", kind, name, namespace, cause);
            default:
                return resource;
        }
    }
}
