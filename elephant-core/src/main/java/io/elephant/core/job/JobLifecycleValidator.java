package io.elephant.core.job;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.elephant.core.repository.ModelValidator;
import io.elephant.core.schedule.InvalidScheduleException;
import io.elephant.core.schedule.Schedule;
import io.elephant.core.schedule.ScheduleParser;
import io.elephant.core.schedule.ScheduleType;
import io.elephant.core.schedule.TimestampSchedule;
import io.elephant.spi.ac.AccessControlException;
import io.elephant.spi.ac.PrincipalDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link JobRequest} into a {@link Job} that may be stored.
 *
 * Every insert and update goes through {@link #validate(String, JobRequest)}.
 * It fills in the owning principal, checks that the caller may act as that
 * principal, and normalizes the schedule.
 */
public class JobLifecycleValidator
{
    private static final Logger logger = LoggerFactory.getLogger(JobLifecycleValidator.class);

    private final ScheduleParser scheduleParser;
    private final PrincipalDirectory principals;
    private final Clock clock;

    @Inject
    public JobLifecycleValidator(ScheduleParser scheduleParser, PrincipalDirectory principals, Clock clock)
    {
        this.scheduleParser = scheduleParser;
        this.principals = principals;
        this.clock = clock;
    }

    public Job validate(String caller, JobRequest request)
        throws AccessControlException, InvalidScheduleException
    {
        String principalName = request.getPrincipalName().or(caller);

        if (!principalName.equals(caller) && !principals.exists(principalName)) {
            ModelValidator.builder()
                .error("principal", principalName, "does not exist")
                .validate("job");
        }
        if (!principals.isMember(caller, principalName)) {
            throw new AccessControlException(String.format(
                        "%s is not a member of %s", caller, principalName));
        }

        Optional<Schedule> schedule = Optional.absent();
        if (request.getSchedule().isPresent()) {
            schedule = Optional.of(bumpIfNow(scheduleParser.parse(request.getSchedule().get())));
        }

        Job job = Job.builder()
            .databaseName(request.getDatabaseName())
            .principalName(principalName)
            .schedule(schedule)
            .enabled(request.getEnabled())
            .parallel(request.getParallel())
            .command(request.getCommand())
            .description(request.getDescription())
            .timeout(request.getTimeout())
            .build();

        ModelValidator.builder()
            .checkIdentifierName("database", job.getDatabaseName())
            .checkIdentifierName("principal", job.getPrincipalName())
            .checkNotEmpty("command", job.getCommand())
            .checkPositive("timeout", job.getTimeout())
            .validate("job");

        return job;
    }

    // A job scheduled exactly for the current minute would be missed if the
    // scheduler already evaluated that minute. Move it to the next minute.
    private Schedule bumpIfNow(Schedule schedule)
    {
        if (schedule.getType() != ScheduleType.TIMESTAMPS) {
            return schedule;
        }
        TimestampSchedule timestamps = (TimestampSchedule) schedule;
        Instant currentMinute = clock.instant().truncatedTo(ChronoUnit.MINUTES);
        if (timestamps.isSingleton() && timestamps.getTimestamps().first().equals(currentMinute)) {
            Instant next = currentMinute.plus(1, ChronoUnit.MINUTES);
            logger.debug("Schedule {} is the current minute. Using {} instead", timestamps.getText(), next);
            return TimestampSchedule.of(next);
        }
        return schedule;
    }
}
