package io.elephant.core.schedule;

import java.util.SortedSet;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class CronFieldParserTest
{
    private final CronFieldParser parser = new CronFieldParser();

    @Test
    public void parseListsRangesAndSteps()
            throws Exception
    {
        assertThat(parser.parse("0-4,5-9/3,8", 0, 59), contains(0, 1, 2, 3, 4, 5, 8));
        assertThat(parser.parse("11-12", 1, 12), contains(11, 12));
        assertThat(parser.parse("7", 0, 59), contains(7));
    }

    @Test
    public void starExpandsToBounds()
            throws Exception
    {
        SortedSet<Integer> hours = parser.parse("*", CronFieldKind.HOUR);
        assertThat(hours, hasSize(24));
        assertThat(hours.first(), is(0));
        assertThat(hours.last(), is(23));

        assertThat(parser.parse("*/20", CronFieldKind.MINUTE), contains(0, 20, 40));
    }

    @Test
    public void singleValueWithStepRunsToMax()
            throws Exception
    {
        assertThat(parser.parse("10/15", CronFieldKind.MINUTE), contains(10, 25, 40, 55));
        assertThat(parser.parse("5/10", 1, 31), contains(5, 15, 25));
    }

    @Test
    public void duplicatesAreMerged()
            throws Exception
    {
        assertThat(parser.parse("1,1,2,1-2", 0, 59), contains(1, 2));
    }

    @Test
    public void rejectsReversedRange()
            throws Exception
    {
        CronRangeException ex = assertRangeError("5-3", 0, 59);
        assertThat(ex.getStart(), is(5));
        assertThat(ex.getEnd(), is(3));
        assertThat(ex.getStep(), is(1));
    }

    @Test
    public void rejectsOutOfBounds()
            throws Exception
    {
        CronRangeException ex = assertRangeError("60", 0, 59);
        assertThat(ex.getStart(), is(60));
        assertThat(ex.getEnd(), is(60));
        assertThat(ex.getMin(), is(0));
        assertThat(ex.getMax(), is(59));

        assertRangeError("0", 1, 31);
        ex = assertRangeError("20-25", 0, 23);
        assertThat(ex.getEnd(), is(25));
        assertThat(ex.getMax(), is(23));
    }

    @Test
    public void rejectsZeroStep()
            throws Exception
    {
        CronRangeException ex = assertRangeError("*/0", 0, 59);
        assertThat(ex.getStart(), is(0));
        assertThat(ex.getEnd(), is(59));
        assertThat(ex.getStep(), is(0));
    }

    @Test
    public void rejectsGrammar()
            throws Exception
    {
        assertThat(assertGrammarError("a", 0, 59).getEntry(), is("a"));
        assertThat(assertGrammarError("1-", 0, 59).getEntry(), is("1-"));
        assertThat(assertGrammarError("100", 0, 59).getEntry(), is("100"));
        assertThat(assertGrammarError("1,,2", 0, 59).getEntry(), is(""));
        assertThat(assertGrammarError("", 0, 59).getEntry(), is(""));
        assertThat(assertGrammarError("5,-1", 0, 59).getEntry(), is("-1"));
    }

    private CronRangeException assertRangeError(String field, int min, int max)
    {
        try {
            parser.parse(field, min, max);
            throw new AssertionError("range error expected: " + field);
        }
        catch (CronRangeException ex) {
            assertThat(ex.getField(), is(field));
            return ex;
        }
        catch (CronFieldException ex) {
            throw new AssertionError("range error expected but got " + ex, ex);
        }
    }

    private CronGrammarException assertGrammarError(String field, int min, int max)
    {
        try {
            parser.parse(field, min, max);
            throw new AssertionError("grammar error expected: " + field);
        }
        catch (CronGrammarException ex) {
            assertThat(ex.getField(), is(field));
            return ex;
        }
        catch (CronFieldException ex) {
            throw new AssertionError("grammar error expected but got " + ex, ex);
        }
    }
}
