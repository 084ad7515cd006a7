package io.elephant.core.schedule;

import java.util.SortedSet;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a 5-field crontab line or one of the named aliases (@daily, @hourly, ...).
 *
 * Day of week 7 is folded to 0 (Sunday). When exactly one of day of month and
 * day of week is "*", that field is cleared so that the other one alone decides
 * the day, following man 5 crontab. When both are restricted, either of them
 * matching is enough.
 */
public class CronScheduleParser
{
    private static final Logger logger = LoggerFactory.getLogger(CronScheduleParser.class);

    private static final ImmutableMap<String, String> ALIASES = ImmutableMap.<String, String>builder()
        .put("@yearly", "0 0 1 1 *")
        .put("@annually", "0 0 1 1 *")
        .put("@monthly", "0 0 1 * *")
        .put("@weekly", "0 0 * * 0")
        .put("@daily", "0 0 * * *")
        .put("@midnight", "0 0 * * *")
        .put("@hourly", "0 * * * *")
        .build();

    private final CronFieldParser fieldParser;

    public CronScheduleParser()
    {
        this(new CronFieldParser());
    }

    @Inject
    public CronScheduleParser(CronFieldParser fieldParser)
    {
        this.fieldParser = fieldParser;
    }

    /**
     * Returns absent if the text is not a crontab line. The caller is expected
     * to try the text as timestamps then.
     */
    public Optional<CrontabSchedule> tryParse(String text)
    {
        Optional<String[]> tokens = tokenize(text);
        if (!tokens.isPresent()) {
            return Optional.absent();
        }
        try {
            return Optional.of(build(text.trim(), tokens.get()));
        }
        catch (CronFieldException ex) {
            logger.debug("Not a crontab schedule '{}': {}", text, ex.getMessage());
            return Optional.absent();
        }
    }

    public CrontabSchedule parse(String text)
        throws InvalidScheduleException
    {
        Optional<String[]> tokens = tokenize(text);
        if (!tokens.isPresent()) {
            throw new InvalidScheduleException(text, "must have 5 fields or be one of " + ALIASES.keySet(),
                    Optional.absent(), null);
        }
        try {
            return build(text.trim(), tokens.get());
        }
        catch (CronFieldException ex) {
            throw new InvalidScheduleException(text, ex.getMessage(), Optional.of(ex.getHint()), ex);
        }
    }

    private static Optional<String[]> tokenize(String text)
    {
        String[] tokens = text.trim().split("\\s+");
        if (tokens.length == 5) {
            return Optional.of(tokens);
        }
        else if (tokens.length == 1 && ALIASES.containsKey(tokens[0])) {
            return Optional.of(ALIASES.get(tokens[0]).split(" "));
        }
        else {
            return Optional.absent();
        }
    }

    private CrontabSchedule build(String source, String[] tokens)
        throws CronFieldException
    {
        String domToken = tokens[2];
        String dowToken = tokens[4];

        SortedSet<Integer> minutes = fieldParser.parse(tokens[0], CronFieldKind.MINUTE);
        SortedSet<Integer> hours = fieldParser.parse(tokens[1], CronFieldKind.HOUR);
        SortedSet<Integer> daysOfMonth = fieldParser.parse(domToken, CronFieldKind.DAY_OF_MONTH);
        SortedSet<Integer> months = fieldParser.parse(tokens[3], CronFieldKind.MONTH);
        SortedSet<Integer> daysOfWeek = foldSunday(fieldParser.parse(dowToken, CronFieldKind.DAY_OF_WEEK));

        if (dowToken.equals("*") && !domToken.equals("*")) {
            daysOfWeek = ImmutableSortedSet.of();
        }
        if (domToken.equals("*") && !dowToken.equals("*")) {
            daysOfMonth = ImmutableSortedSet.of();
        }

        return CrontabSchedule.builder()
            .source(source)
            .minutes(minutes)
            .hours(hours)
            .daysOfMonth(daysOfMonth)
            .months(months)
            .daysOfWeek(daysOfWeek)
            .build();
    }

    private static SortedSet<Integer> foldSunday(SortedSet<Integer> daysOfWeek)
    {
        ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
        for (int day : daysOfWeek) {
            builder.add(day % 7);
        }
        return builder.build();
    }
}
