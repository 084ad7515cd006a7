package io.elephant.core.log;

import com.google.common.base.Optional;
import io.elephant.core.repository.ModelValidationException;
import io.elephant.core.repository.ResourceConflictException;
import io.elephant.core.repository.ResourceNotFoundException;
import io.elephant.core.schedule.InvalidScheduleException;
import io.elephant.spi.ErrorState;
import io.elephant.spi.ac.AccessControlException;

/**
 * Maps exceptions to the error states written to job and run logs.
 */
public final class ErrorStates
{
    public static final String INSUFFICIENT_PRIVILEGE = "42501";
    public static final String UNIQUE_VIOLATION = "23505";
    public static final String CHECK_VIOLATION = "23514";
    public static final String INVALID_PARAMETER_VALUE = "22023";
    public static final String NO_DATA_FOUND = "P0002";
    public static final String INTERNAL_ERROR = "XX000";
    public static final String FEATURE_NOT_SUPPORTED = "0A000";

    private ErrorStates()
    { }

    public static ErrorState fromException(Throwable ex)
    {
        if (ex instanceof AccessControlException) {
            return ErrorState.of(INSUFFICIENT_PRIVILEGE, "Insufficient privileges",
                    Optional.fromNullable(ex.getMessage()), Optional.absent());
        }
        else if (ex instanceof ResourceConflictException) {
            return ErrorState.of(UNIQUE_VIOLATION, "Duplicate job definition",
                    Optional.fromNullable(ex.getMessage()),
                    Optional.of("A job with the same database, principal, schedule and command already exists"));
        }
        else if (ex instanceof InvalidScheduleException) {
            InvalidScheduleException ise = (InvalidScheduleException) ex;
            return ErrorState.of(CHECK_VIOLATION, "Not a valid schedule",
                    Optional.of(ise.getMessage()), ise.getHint());
        }
        else if (ex instanceof ModelValidationException) {
            return ErrorState.of(INVALID_PARAMETER_VALUE, "Invalid job parameter",
                    Optional.fromNullable(ex.getMessage()), Optional.absent());
        }
        else if (ex instanceof ResourceNotFoundException) {
            return ErrorState.of(NO_DATA_FOUND, "Job not found",
                    Optional.fromNullable(ex.getMessage()), Optional.absent());
        }
        else {
            return internalError(ex);
        }
    }

    public static ErrorState internalError(Throwable ex)
    {
        return ErrorState.of(INTERNAL_ERROR, String.valueOf(ex),
                Optional.fromNullable(ex.getCause()).transform(String::valueOf), Optional.absent());
    }
}
