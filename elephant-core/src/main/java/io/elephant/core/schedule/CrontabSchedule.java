package io.elephant.core.schedule;

import java.util.SortedSet;
import com.google.common.base.Preconditions;
import org.immutables.value.Value;

@Value.Immutable
public abstract class CrontabSchedule
        extends Schedule
{
    // source text doesn't take part in equality: "@yearly" equals "0 0 1 1 *"
    @Value.Auxiliary
    public abstract String getSource();

    @Value.NaturalOrder
    public abstract SortedSet<Integer> getMinutes();

    @Value.NaturalOrder
    public abstract SortedSet<Integer> getHours();

    // empty when only day of week restricts the schedule
    @Value.NaturalOrder
    public abstract SortedSet<Integer> getDaysOfMonth();

    @Value.NaturalOrder
    public abstract SortedSet<Integer> getMonths();

    // 0 is Sunday. Empty when only day of month restricts the schedule.
    @Value.NaturalOrder
    public abstract SortedSet<Integer> getDaysOfWeek();

    @Override
    public ScheduleType getType()
    {
        return ScheduleType.CRONTAB;
    }

    @Override
    public String getText()
    {
        return getSource();
    }

    public SortedSet<Integer> getField(CronFieldKind kind)
    {
        switch (kind) {
        case MINUTE:
            return getMinutes();
        case HOUR:
            return getHours();
        case DAY_OF_MONTH:
            return getDaysOfMonth();
        case MONTH:
            return getMonths();
        case DAY_OF_WEEK:
            return getDaysOfWeek();
        default:
            throw new AssertionError("Unknown cron field: " + kind);
        }
    }

    @Value.Check
    protected void check()
    {
        for (CronFieldKind kind : CronFieldKind.values()) {
            SortedSet<Integer> values = getField(kind);
            if (!values.isEmpty()) {
                Preconditions.checkState(values.first() >= kind.getMin() && values.last() <= kind.getNormalizedMax(),
                        "%s values must be within %s-%s: %s", kind.getDisplayName(), kind.getMin(), kind.getNormalizedMax(), values);
            }
        }
        Preconditions.checkState(!getMinutes().isEmpty(), "minute must not be empty");
        Preconditions.checkState(!getHours().isEmpty(), "hour must not be empty");
        Preconditions.checkState(!getMonths().isEmpty(), "month must not be empty");
        Preconditions.checkState(!getDaysOfMonth().isEmpty() || !getDaysOfWeek().isEmpty(),
                "day of month and day of week must not be both empty");
    }

    public static ImmutableCrontabSchedule.Builder builder()
    {
        return ImmutableCrontabSchedule.builder();
    }
}
