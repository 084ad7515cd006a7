package io.elephant.core.repository;

/**
 * An exception thrown when a required resource (job, job log, etc.) does not exist.
 *
 * This exception is deterministic.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }
}
