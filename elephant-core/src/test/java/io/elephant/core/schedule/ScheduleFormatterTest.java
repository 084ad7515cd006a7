package io.elephant.core.schedule;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ScheduleFormatterTest
{
    private final CronScheduleParser parser = new CronScheduleParser();
    private final ScheduleFormatter formatter = new ScheduleFormatter();

    @Test
    public void collapsesRuns()
    {
        assertThat(format("0-4,5-9/3,8 * * * *"), is("0-5,8 * * * *"));
        assertThat(format("*/15 9-17 * * 1-5"), is("0,15,30,45 9-17 * * 1-5"));
    }

    @Test
    public void aliases()
    {
        assertThat(format("@yearly"), is("0 0 1 1 *"));
        assertThat(format("@weekly"), is("0 0 * * 0"));
        assertThat(format("@hourly"), is("0 * * * *"));
    }

    @Test
    public void sundayIsZero()
    {
        assertThat(format("0 0 * * 5-7"), is("0 0 * * 0,5-6"));
    }

    @Test
    public void keepsDisjunction()
    {
        assertThat(format("0 0 13 * 5"), is("0 0 13 * 5"));
        // a full day of month written as a range still restricts together with day of week
        assertThat(format("0 0 1-31 * 5"), is("0 0 1-31 * 5"));
        assertThat(format("0 0 */1 * *"), is("0 0 1-31 * *"));
    }

    @Test
    public void formattedTextParsesToEqualSchedule()
    {
        String[] schedules = {
            "* * * * *",
            "5,35 */6 * 1-3 *",
            "0 0 13 * 5",
            "0 0 1-31 * 0-7",
            "0 0 * * 0-7",
            "59 23 31 12 *",
            "@monthly",
        };
        for (String text : schedules) {
            CrontabSchedule s = parser.parse(text);
            assertThat(text, parser.parse(formatter.format(s)), is(s));
        }
    }

    private String format(String text)
    {
        return formatter.format(parser.parse(text));
    }
}
