package io.flowkube.kubernetes.models;

import lombok.Getter;

@Getter
public enum RestartPolicy {
    NEVER("Never"),
    ON_FAILURE("OnFailure");

    private final String value;

    RestartPolicy(String value) {
        this.value = value;
    }
}
