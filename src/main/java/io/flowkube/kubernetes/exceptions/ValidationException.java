package io.flowkube.kubernetes.exceptions;

/**
 * Invalid input detected before any call reaches the cluster: bad names, missing properties,
 * malformed JSON or timestamps.
 */
public class ValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
