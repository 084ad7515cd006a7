package io.elephant.core.schedule;

import java.time.Instant;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ScheduleMatcherTest
{
    private final ScheduleParser parser = new ScheduleParser(new CronScheduleParser(), new TimestampScheduleParser());
    private final ScheduleMatcher matcher = new ScheduleMatcher();

    // 2030-03-01 is a Friday
    private static final Instant FRIDAY_1ST = Instant.parse("2030-03-01T10:15:00Z");
    private static final Instant SATURDAY_2ND = Instant.parse("2030-03-02T10:15:00Z");
    private static final Instant FRIDAY_8TH = Instant.parse("2030-03-08T10:15:00Z");

    @Test
    public void everyMinute()
    {
        assertTrue(matches("* * * * *", FRIDAY_1ST));
        assertTrue(matches("* * * * *", Instant.parse("2031-12-31T23:59:00Z")));
    }

    @Test
    public void minuteHourAndMonth()
    {
        assertTrue(matches("15 10 * * *", FRIDAY_1ST));
        assertFalse(matches("16 10 * * *", FRIDAY_1ST));
        assertFalse(matches("15 11 * * *", FRIDAY_1ST));
        assertTrue(matches("15 10 * 3 *", FRIDAY_1ST));
        assertFalse(matches("15 10 * 4 *", FRIDAY_1ST));
    }

    @Test
    public void secondsAreIgnored()
    {
        assertTrue(matches("15 10 * * *", Instant.parse("2030-03-01T10:15:42Z")));
    }

    @Test
    public void dayOfMonthOnly()
    {
        assertTrue(matches("15 10 1 * *", FRIDAY_1ST));
        assertFalse(matches("15 10 1 * *", FRIDAY_8TH));
    }

    @Test
    public void dayOfWeekOnly()
    {
        assertTrue(matches("15 10 * * 5", FRIDAY_1ST));
        assertTrue(matches("15 10 * * 5", FRIDAY_8TH));
        assertFalse(matches("15 10 * * 5", SATURDAY_2ND));
    }

    @Test
    public void dayOfMonthOrDayOfWeek()
    {
        // 2nd of the month, or any Friday
        assertTrue(matches("15 10 2 * 5", FRIDAY_1ST));
        assertTrue(matches("15 10 2 * 5", SATURDAY_2ND));
        assertTrue(matches("15 10 2 * 5", FRIDAY_8TH));
        assertFalse(matches("15 10 2 * 5", Instant.parse("2030-03-09T10:15:00Z")));
    }

    @Test
    public void sundayAsSeven()
    {
        Instant sunday = Instant.parse("2030-03-03T00:00:00Z");
        assertTrue(matches("0 0 * * 7", sunday));
        assertTrue(matches("0 0 * * 0", sunday));
        assertTrue(matches("@weekly", sunday));
    }

    @Test
    public void timestamps()
    {
        String text = "{\"2030-03-01 10:15 +00\",\"2030-03-02 12:15 +02\"}";
        assertTrue(matches(text, FRIDAY_1ST));
        assertTrue(matches(text, SATURDAY_2ND));
        assertTrue(matches(text, Instant.parse("2030-03-01T10:15:59Z")));
        assertFalse(matches(text, FRIDAY_1ST.plusSeconds(60)));
    }

    private boolean matches(String schedule, Instant instant)
    {
        return matcher.matches(parser.parse(schedule), instant);
    }
}
