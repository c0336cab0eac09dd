package io.flowkube.kubernetes.runners;

/**
 * Marker for the value returned by an operation to the workflow.
 */
public interface Output {
}
