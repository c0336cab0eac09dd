package io.flowkube.kubernetes.exceptions;

import lombok.Getter;

import java.time.Duration;

/**
 * The watched resource never reached the awaited condition before the deadline.
 * Distinct from {@link ClusterCallException}: the cluster accepted every call, the state just never happened.
 */
@Getter
public class WatchTimeoutException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String name;
    private final String condition;
    private final Duration timeout;

    public WatchTimeoutException(String kind, String name, String condition, Duration timeout) {
        super("Timeout waiting for " + kind + "/" + name + " condition: " + condition + " (waited " + timeout + ")");
        this.kind = kind;
        this.name = name;
        this.condition = condition;
        this.timeout = timeout;
    }
}
