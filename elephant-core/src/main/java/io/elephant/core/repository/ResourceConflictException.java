package io.elephant.core.repository;

/**
 * An exception thrown when a job with the same database, principal, schedule
 * and command already exists.
 *
 * This exception is deterministic.
 */
public class ResourceConflictException extends Exception
{
    public ResourceConflictException(String message)
    {
        super(message);
    }

    public ResourceConflictException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
