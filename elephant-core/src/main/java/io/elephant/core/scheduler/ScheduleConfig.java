package io.elephant.core.scheduler;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Preconditions;
import io.elephant.core.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleConfig.class)
@JsonDeserialize(as = ImmutableScheduleConfig.class)
public interface ScheduleConfig
{
    boolean getEnabled();

    int getPollInterval();  // seconds

    int getMaxWorkers();

    // missed minutes evaluated after a pause of the scheduler. Older minutes are skipped.
    int getMaxCatchUpMinutes();

    @Value.Check
    default void check()
    {
        Preconditions.checkState(getPollInterval() > 0, "schedule.poll_interval must be positive");
        Preconditions.checkState(getMaxWorkers() > 0, "schedule.max_workers must be positive");
        Preconditions.checkState(getMaxCatchUpMinutes() >= 0, "schedule.max_catch_up_minutes must not be negative");
    }

    static ImmutableScheduleConfig.Builder defaultBuilder()
    {
        return ImmutableScheduleConfig.builder()
            .enabled(true)
            .pollInterval(10)
            .maxWorkers(4)
            .maxCatchUpMinutes(5);
    }

    static ScheduleConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .enabled(config.get("schedule.enabled", boolean.class, true))
            .pollInterval(config.get("schedule.poll_interval", int.class, 10))
            .maxWorkers(config.get("schedule.max_workers", int.class, 4))
            .maxCatchUpMinutes(config.get("schedule.max_catch_up_minutes", int.class, 5))
            .build();
    }
}
