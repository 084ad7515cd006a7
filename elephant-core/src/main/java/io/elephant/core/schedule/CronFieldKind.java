package io.elephant.core.schedule;

/**
 * The five fields of a crontab line, in the order they are written.
 *
 * The code is the value stored in the schedule field index table.
 */
public enum CronFieldKind
{
    MINUTE(0, "minute", 0, 59),
    HOUR(1, "hour", 0, 23),
    DAY_OF_MONTH(2, "day of month", 1, 31),
    MONTH(3, "month", 1, 12),
    DAY_OF_WEEK(4, "day of week", 0, 7);

    private final int code;
    private final String displayName;
    private final int min;
    private final int max;

    private CronFieldKind(int code, String displayName, int min, int max)
    {
        this.code = code;
        this.displayName = displayName;
        this.min = min;
        this.max = max;
    }

    public int getCode()
    {
        return code;
    }

    public String getDisplayName()
    {
        return displayName;
    }

    // bound accepted by the parser. 7 is a valid day of week until it is folded to 0.
    public int getMin()
    {
        return min;
    }

    public int getMax()
    {
        return max;
    }

    // bound of the normalized values
    public int getNormalizedMax()
    {
        return this == DAY_OF_WEEK ? 6 : max;
    }
}
