package io.elephant.core.schedule;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.SortedSet;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;

import static java.util.Locale.ENGLISH;
import static java.util.stream.Collectors.joining;

@Value.Immutable
public abstract class TimestampSchedule
        extends Schedule
{
    private static final DateTimeFormatter CANONICAL_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm'+00'", ENGLISH).withZone(ZoneOffset.UTC);

    // distinct UTC instants truncated to minutes
    @Value.NaturalOrder
    public abstract SortedSet<Instant> getTimestamps();

    @Override
    public ScheduleType getType()
    {
        return ScheduleType.TIMESTAMPS;
    }

    /**
     * Canonical strings such as "2042-12-05 13:37+00", in ascending order.
     */
    public List<String> getCanonicalTimestamps()
    {
        return getTimestamps().stream()
            .map(TimestampSchedule::formatTimestamp)
            .collect(ImmutableList.toImmutableList());
    }

    @Override
    public String getText()
    {
        return getTimestamps().stream()
            .map(t -> "\"" + formatTimestamp(t) + "\"")
            .collect(joining(",", "{", "}"));
    }

    public boolean isSingleton()
    {
        return getTimestamps().size() == 1;
    }

    @Value.Check
    protected void check()
    {
        Preconditions.checkState(!getTimestamps().isEmpty(), "timestamps must not be empty");
        for (Instant t : getTimestamps()) {
            Preconditions.checkState(t.equals(t.truncatedTo(ChronoUnit.MINUTES)), "timestamp must be truncated to minutes: %s", t);
        }
    }

    public static String formatTimestamp(Instant instant)
    {
        return CANONICAL_FORMATTER.format(instant.truncatedTo(ChronoUnit.MINUTES));
    }

    public static TimestampSchedule of(Instant... timestamps)
    {
        ImmutableTimestampSchedule.Builder builder = ImmutableTimestampSchedule.builder();
        for (Instant t : timestamps) {
            builder.addTimestamps(t.truncatedTo(ChronoUnit.MINUTES));
        }
        return builder.build();
    }

    public static ImmutableTimestampSchedule.Builder builder()
    {
        return ImmutableTimestampSchedule.builder();
    }
}
