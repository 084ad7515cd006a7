package io.elephant.core.schedule;

public enum ScheduleType
{
    CRONTAB,
    TIMESTAMPS;
}
