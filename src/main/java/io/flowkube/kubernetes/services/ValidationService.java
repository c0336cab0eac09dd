package io.flowkube.kubernetes.services;

import io.flowkube.kubernetes.exceptions.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks run before any cluster call.
 */
public abstract class ValidationService {
    public static final Pattern DNS_1123_LABEL = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?$");
    public static final int MAX_NAME_LENGTH = 63;

    private static final ValidatorFactory FACTORY = Validation.byDefaultProvider()
        .configure()
        .messageInterpolator(new ParameterMessageInterpolator())
        .buildValidatorFactory();

    /**
     * Validates the Jakarta Bean Validation constraints declared on an operation.
     */
    public static <T> void validate(T bean) {
        Validator validator = FACTORY.getValidator();
        Set<ConstraintViolation<T>> violations = validator.validate(bean);

        if (!violations.isEmpty()) {
            throw new ValidationException(
                "Invalid " + bean.getClass().getSimpleName() + ": " + violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "))
            );
        }
    }

    public static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Name is required and cannot be empty");
        }

        if (!DNS_1123_LABEL.matcher(name).matches()) {
            throw new ValidationException("Name \"" + name + "\" is invalid. Must match pattern: [a-z0-9]([-a-z0-9]*[a-z0-9])?");
        }

        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Name \"" + name + "\" is too long (" + name.length() + " > " + MAX_NAME_LENGTH + ")");
        }
    }

    /**
     * @throws ValidationException when the value is not an RFC 3339 timestamp
     */
    public static Instant validateTimestamp(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid time format: " + value + ". Please use RFC3339 format (e.g., 2024-01-01T00:00:00Z)", e);
        }
    }
}
