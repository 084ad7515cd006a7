package io.elephant.core.schedule;

public class CronGrammarException
        extends CronFieldException
{
    private final String entry;

    public CronGrammarException(String field, String entry)
    {
        super("Invalid crontab entry '" + entry + "' in field: " + field, field);
        this.entry = entry;
    }

    public String getEntry()
    {
        return entry;
    }

    @Override
    public String getHint()
    {
        return "Each entry must be *, N or N-N, optionally followed by /STEP";
    }
}
