package io.elephant.core.repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects field failures of a model and throws them at once.
 *
 * <pre>
 * ModelValidator.builder()
 *     .checkNotEmpty("command", job.getCommand())
 *     .checkPositive("timeout", job.getTimeout())
 *     .validate("job");
 * </pre>
 */
public class ModelValidator
{
    public static ModelValidator builder()
    {
        return new ModelValidator();
    }

    private final List<ModelValidationException.Failure> failures = new ArrayList<>();

    private ModelValidator()
    { }

    public ModelValidator error(String fieldName, Object object, String errorMessage)
    {
        failures.add(ModelValidationException.Failure.of(fieldName, object, errorMessage));
        return this;
    }

    public ModelValidator check(String fieldName, Object object, boolean expression, String errorMessage)
    {
        if (!expression) {
            error(fieldName, object, errorMessage);
        }
        return this;
    }

    public ModelValidator checkNotEmpty(String fieldName, String value)
    {
        return check(fieldName, value, value != null && !value.trim().isEmpty(), "must not be blank");
    }

    public ModelValidator checkMaxLength(String fieldName, String value, int max)
    {
        return check(fieldName, value, value == null || value.length() <= max, "must not be longer than " + max + " characters");
    }

    // principal and database names
    public ModelValidator checkIdentifierName(String fieldName, String value)
    {
        checkNotEmpty(fieldName, value);
        checkMaxLength(fieldName, value, 255);
        return this;
    }

    public ModelValidator checkPositive(String fieldName, Duration value)
    {
        return check(fieldName, value, !value.isNegative() && !value.isZero(), "must be positive");
    }

    public void validate(String modelType)
    {
        if (!failures.isEmpty()) {
            throw new ModelValidationException(modelType, failures);
        }
    }
}
