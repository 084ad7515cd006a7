package io.elephant.core.schedule;

/**
 * An exception thrown when one field of a crontab line can't be parsed.
 *
 * This exception is deterministic.
 */
public abstract class CronFieldException
        extends Exception
{
    private final String field;

    protected CronFieldException(String message, String field)
    {
        super(message);
        this.field = field;
    }

    public String getField()
    {
        return field;
    }

    public abstract String getHint();
}
