package io.elephant.core.schedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;

import static java.util.Locale.ENGLISH;

/**
 * Parses a timestamp literal or a list of them, for example
 * <code>{"2042-12-05 13:37 +00","2014-01-01 12:31 +00"}</code> or
 * <code>1982-08-06 09:30 +02</code>.
 *
 * A literal without offset is UTC. Any malformed element makes the whole
 * text "not timestamps", which is reported as absent rather than an exception.
 */
public class TimestampScheduleParser
{
    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2})[ Tt](\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d{1,9})?)?)\\s*(Z|UTC|[+-]\\d{2}(?::?\\d{2})?)?$",
            Pattern.CASE_INSENSITIVE);

    private static final Splitter ELEMENT_SPLITTER = Splitter.on(',').trimResults();

    public Optional<TimestampSchedule> parse(String text)
    {
        String body = text.trim();
        if (body.startsWith("{") && body.endsWith("}")) {
            body = body.substring(1, body.length() - 1).trim();
        }
        if (body.isEmpty()) {
            return Optional.absent();
        }

        List<String> elements = ELEMENT_SPLITTER.splitToList(body);
        ImmutableTimestampSchedule.Builder builder = TimestampSchedule.builder();
        for (String element : elements) {
            Optional<Instant> instant = parseTimestamp(unquote(element));
            if (!instant.isPresent()) {
                return Optional.absent();
            }
            builder.addTimestamps(instant.get());
        }
        return Optional.of(builder.build());
    }

    /**
     * Parses one literal into an instant truncated to minutes.
     */
    public Optional<Instant> parseTimestamp(String literal)
    {
        Matcher m = TIMESTAMP_PATTERN.matcher(literal);
        if (!m.matches()) {
            return Optional.absent();
        }
        try {
            LocalDate date = LocalDate.parse(m.group(1));
            LocalTime time = LocalTime.parse(m.group(2));
            ZoneOffset offset = parseOffset(m.group(3));
            Instant instant = date.atTime(time).toInstant(offset);
            return Optional.of(instant.truncatedTo(ChronoUnit.MINUTES));
        }
        catch (DateTimeException ex) {
            // such as 2020-02-30 or 25:00
            return Optional.absent();
        }
    }

    private static ZoneOffset parseOffset(String offset)
    {
        if (offset == null) {
            return ZoneOffset.UTC;
        }
        String upper = offset.toUpperCase(ENGLISH);
        if (upper.equals("Z") || upper.equals("UTC")) {
            return ZoneOffset.UTC;
        }
        return ZoneOffset.of(upper);
    }

    private static String unquote(String element)
    {
        if (element.length() >= 2 && element.startsWith("\"") && element.endsWith("\"")) {
            return element.substring(1, element.length() - 1).trim();
        }
        return element;
    }
}
