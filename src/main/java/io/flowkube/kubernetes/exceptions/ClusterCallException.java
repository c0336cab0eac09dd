package io.flowkube.kubernetes.exceptions;

import lombok.Getter;

/**
 * A call to the Kubernetes API failed (create, get, list, patch, delete, watch or log stream).
 * <p>
 * Carries the operation and the addressed resource so the caller can tell which object
 * was rejected and why.
 */
@Getter
public class ClusterCallException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final String operation;
    private final String kind;
    private final String name;
    private final String namespace;

    public ClusterCallException(String operation, String kind, String name, String namespace, Throwable cause) {
        super(message(operation, kind, name, namespace, cause != null ? cause.getMessage() : null), cause);
        this.operation = operation;
        this.kind = kind;
        this.name = name;
        this.namespace = namespace;
    }

    public ClusterCallException(String operation, String kind, String name, String namespace, String reason) {
        super(message(operation, kind, name, namespace, reason));
        this.operation = operation;
        this.kind = kind;
        this.name = name;
        this.namespace = namespace;
    }

    private static String message(String operation, String kind, String name, String namespace, String reason) {
        StringBuilder builder = new StringBuilder("Failed to ")
            .append(operation)
            .append(" ")
            .append(kind);

        if (name != null) {
            builder.append(" \"").append(name).append("\"");
        }

        if (namespace != null) {
            builder.append(" in namespace \"").append(namespace).append("\"");
        }

        if (reason != null) {
            builder.append(": ").append(reason);
        }

        return builder.toString();
    }
}
