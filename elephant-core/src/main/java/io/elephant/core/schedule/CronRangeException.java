package io.elephant.core.schedule;

import static java.util.Locale.ENGLISH;

public class CronRangeException
        extends CronFieldException
{
    private final int start;
    private final int end;
    private final int step;
    private final int min;
    private final int max;

    public CronRangeException(String field, int start, int end, int step, int min, int max)
    {
        super(String.format(ENGLISH,
                    "Invalid crontab range. Range start: %d (%d), End range: %d (%d), Step: %d for crontab field: %s",
                    start, min, end, max, step, field),
                field);
        this.start = start;
        this.end = end;
        this.step = step;
        this.min = min;
        this.max = max;
    }

    public int getStart()
    {
        return start;
    }

    public int getEnd()
    {
        return end;
    }

    public int getStep()
    {
        return step;
    }

    public int getMin()
    {
        return min;
    }

    public int getMax()
    {
        return max;
    }

    @Override
    public String getHint()
    {
        return "Ensure range is ascending, the step is positive and the range is within allowed bounds";
    }
}
