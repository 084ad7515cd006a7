package io.elephant.core.schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import com.google.common.base.Joiner;

/**
 * Renders a crontab schedule as a 5-field line that parses back to an equal schedule.
 */
public class ScheduleFormatter
{
    public String format(CrontabSchedule schedule)
    {
        String dom;
        String dow;
        if (schedule.getDaysOfMonth().isEmpty()) {
            // a restricted day of week clears day of month only when day of month is "*"
            dom = "*";
            dow = formatValues(schedule.getDaysOfWeek());
        }
        else if (schedule.getDaysOfWeek().isEmpty()) {
            dom = formatValues(schedule.getDaysOfMonth());
            dow = "*";
        }
        else if (isFull(schedule.getDaysOfMonth(), CronFieldKind.DAY_OF_MONTH)
                && isFull(schedule.getDaysOfWeek(), CronFieldKind.DAY_OF_WEEK)) {
            dom = "*";
            dow = "*";
        }
        else {
            // both restricted. "*" on either side would clear the other one.
            dom = formatValues(schedule.getDaysOfMonth());
            dow = formatValues(schedule.getDaysOfWeek());
        }

        return Joiner.on(' ').join(
                formatField(schedule.getMinutes(), CronFieldKind.MINUTE),
                formatField(schedule.getHours(), CronFieldKind.HOUR),
                dom,
                formatField(schedule.getMonths(), CronFieldKind.MONTH),
                dow);
    }

    private static String formatField(SortedSet<Integer> values, CronFieldKind kind)
    {
        if (isFull(values, kind)) {
            return "*";
        }
        return formatValues(values);
    }

    private static boolean isFull(SortedSet<Integer> values, CronFieldKind kind)
    {
        return values.size() == kind.getNormalizedMax() - kind.getMin() + 1;
    }

    // collapses runs of consecutive values into a-b
    private static String formatValues(SortedSet<Integer> values)
    {
        List<String> entries = new ArrayList<>();
        Integer runStart = null;
        Integer last = null;
        for (int v : values) {
            if (last != null && v == last + 1) {
                last = v;
                continue;
            }
            if (runStart != null) {
                entries.add(formatRun(runStart, last));
            }
            runStart = v;
            last = v;
        }
        if (runStart != null) {
            entries.add(formatRun(runStart, last));
        }
        return Joiner.on(',').join(entries);
    }

    private static String formatRun(int start, int end)
    {
        return start == end ? Integer.toString(start) : start + "-" + end;
    }
}
