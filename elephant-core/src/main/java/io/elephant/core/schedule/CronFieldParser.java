package io.elephant.core.schedule;

import java.util.SortedSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Parses one crontab field such as "0-4,5-9/3,8" or "11-12" into a sorted set of values.
 */
public class CronFieldParser
{
    private static final Pattern ENTRY_PATTERN = Pattern.compile("^(\\*|(\\d{1,2})(-(\\d{1,2}))?)(/(\\d{1,2}))?$");

    private static final Splitter ENTRY_SPLITTER = Splitter.on(',');

    public SortedSet<Integer> parse(String field, CronFieldKind kind)
        throws CronFieldException
    {
        return parse(field, kind.getMin(), kind.getMax());
    }

    public SortedSet<Integer> parse(String field, int min, int max)
        throws CronFieldException
    {
        ImmutableSortedSet.Builder<Integer> values = ImmutableSortedSet.naturalOrder();
        for (String entry : ENTRY_SPLITTER.split(field)) {
            Matcher m = ENTRY_PATTERN.matcher(entry);
            if (!m.matches()) {
                throw new CronGrammarException(field, entry);
            }

            int step = m.group(6) == null ? 1 : Integer.parseInt(m.group(6));
            int start;
            int end;
            if (m.group(1).equals("*")) {
                start = min;
                end = max;
            }
            else {
                start = Integer.parseInt(m.group(2));
                if (m.group(4) != null) {
                    end = Integer.parseInt(m.group(4));
                }
                else if (m.group(6) != null) {
                    // N/S continues up to the field's own maximum
                    end = max;
                }
                else {
                    end = start;
                }
            }

            if (end < start || start < min || end > max || step <= 0) {
                throw new CronRangeException(field, start, end, step, min, max);
            }

            for (int v = start; v <= end; v += step) {
                values.add(v);
            }
        }

        SortedSet<Integer> result = values.build();
        if (result.isEmpty()) {
            throw new CronGrammarException(field, field);
        }
        return result;
    }
}
