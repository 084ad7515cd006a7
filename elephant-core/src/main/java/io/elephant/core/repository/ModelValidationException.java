package io.elephant.core.repository;

import java.util.List;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Thrown when a job definition has one or more invalid fields.
 *
 * The message lists every failure, one per line:
 * <pre>
 * Invalid job
 *   command must not be blank: ""
 *   timeout must be positive: PT0S
 * </pre>
 */
public class ModelValidationException
        extends IllegalArgumentException
{
    public static final class Failure
    {
        private final String fieldName;
        private final Object value;
        private final String message;

        private Failure(String fieldName, Object value, String message)
        {
            this.fieldName = fieldName;
            this.value = value;
            this.message = message;
        }

        public static Failure of(String fieldName, Object value, String message)
        {
            return new Failure(fieldName, value, message);
        }

        public String getFieldName()
        {
            return fieldName;
        }

        public Object getValue()
        {
            return value;
        }

        public String getMessage()
        {
            return message;
        }

        @Override
        public String toString()
        {
            String shown = (value instanceof String) ? "\"" + value + "\"" : String.valueOf(value);
            return fieldName + " " + message + ": " + shown;
        }
    }

    private final String modelType;
    private final List<Failure> failures;

    public ModelValidationException(String modelType, List<Failure> failures)
    {
        super("Invalid " + modelType + "\n  " + Joiner.on("\n  ").join(failures));
        this.modelType = modelType;
        this.failures = ImmutableList.copyOf(failures);
    }

    public String getModelType()
    {
        return modelType;
    }

    public List<Failure> getFailures()
    {
        return failures;
    }
}
