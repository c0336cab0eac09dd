package io.flowkube.kubernetes.models;

public enum TerminalStatus {
    SUCCEEDED,
    FAILED,
    // only reported when the wait was aborted from outside, never on a timeout
    UNKNOWN
}
