package io.elephant.spi.ac;

/**
 * An exception thrown when the acting principal may not act on behalf of the owner of a job.
 *
 * This exception is deterministic.
 */
public class AccessControlException
        extends Exception
{
    public AccessControlException(String message)
    {
        super(message);
    }

    public AccessControlException(Throwable cause)
    {
        super(cause);
    }
}
