package io.elephant.core.job;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.elephant.core.ThrowablesUtil;
import io.elephant.core.database.TransactionManager;
import io.elephant.core.database.TransactionManager.SupplierInTransaction;
import io.elephant.core.log.ErrorStates;
import io.elephant.core.log.ImmutableRunLog;
import io.elephant.core.log.JobLogStore;
import io.elephant.core.log.RunLog;
import io.elephant.core.log.RunLogStore;
import io.elephant.core.log.StoredJobLog;
import io.elephant.core.repository.ResourceConflictException;
import io.elephant.core.repository.ResourceNotFoundException;
import io.elephant.spi.ErrorState;
import io.elephant.spi.ac.AccessControlException;
import io.elephant.spi.ac.PrincipalDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Job-management operations on behalf of an acting principal.
 *
 * Each operation runs in its own transaction. After the transaction ends, one
 * {@link RunLog} row is appended whether the operation succeeded or not.
 *
 * Jobs owned by a principal that the actor is not a member of are invisible:
 * they are reported as not found.
 */
public class JobManager
{
    private static final Logger logger = LoggerFactory.getLogger(JobManager.class);

    private final TransactionManager tm;
    private final JobStore jobStore;
    private final JobLogStore jobLogStore;
    private final RunLogStore runLogStore;
    private final JobLifecycleValidator validator;
    private final PrincipalDirectory principals;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public JobManager(
            TransactionManager tm,
            JobStore jobStore,
            JobLogStore jobLogStore,
            RunLogStore runLogStore,
            JobLifecycleValidator validator,
            PrincipalDirectory principals,
            ObjectMapper objectMapper,
            Clock clock)
    {
        this.tm = tm;
        this.jobStore = jobStore;
        this.jobLogStore = jobLogStore;
        this.runLogStore = runLogStore;
        this.validator = validator;
        this.principals = principals;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public StoredJob insertJob(String actor, JobRequest request)
        throws AccessControlException, ResourceConflictException
    {
        return this.<StoredJob, AccessControlException, ResourceConflictException, RuntimeException>audited(
                actor, "insertJob(JobRequest)", ImmutableList.of(request), Optional.absent(),
                () -> tm.<StoredJob, AccessControlException, ResourceConflictException>begin(() -> {
                    Job job = validator.validate(actor, request);
                    StoredJob stored = jobStore.insertJob(job, clock.instant());
                    logger.info("Added job id={} owned by {} with schedule {}",
                            stored.getId(), stored.getPrincipalName(), stored.getSchedule().or("(none)"));
                    return stored;
                }, AccessControlException.class, ResourceConflictException.class),
                AccessControlException.class, ResourceConflictException.class, RuntimeException.class);
    }

    public StoredJob updateJob(String actor, int jobId, JobUpdate update)
        throws ResourceNotFoundException, ResourceConflictException, AccessControlException
    {
        return this.<StoredJob, ResourceNotFoundException, ResourceConflictException, AccessControlException>audited(
                actor, "updateJob(int,JobUpdate)", ImmutableList.of(jobId, update), Optional.of(jobId),
                () -> tm.<StoredJob, ResourceNotFoundException, ResourceConflictException, AccessControlException>begin(() -> {
                    StoredJob current = visible(actor, jobStore.lockJobById(jobId));
                    Job job = validator.validate(actor, update.mergeInto(current));
                    StoredJob stored = jobStore.updateJob(jobId, job, clock.instant());
                    logger.info("Updated job id={}", jobId);
                    return stored;
                }, ResourceNotFoundException.class, ResourceConflictException.class, AccessControlException.class),
                ResourceNotFoundException.class, ResourceConflictException.class, AccessControlException.class);
    }

    public StoredJob deleteJob(String actor, int jobId)
        throws ResourceNotFoundException
    {
        return this.<StoredJob, ResourceNotFoundException, RuntimeException, RuntimeException>audited(
                actor, "deleteJob(int)", ImmutableList.of(jobId), Optional.of(jobId),
                () -> tm.begin(() -> {
                    visible(actor, jobStore.lockJobById(jobId));
                    StoredJob deleted = jobStore.deleteJob(jobId);
                    logger.info("Deleted job id={}", jobId);
                    return deleted;
                }, ResourceNotFoundException.class),
                ResourceNotFoundException.class, RuntimeException.class, RuntimeException.class);
    }

    public StoredJob getJob(String actor, int jobId)
        throws ResourceNotFoundException
    {
        return this.<StoredJob, ResourceNotFoundException, RuntimeException, RuntimeException>audited(
                actor, "getJob(int)", ImmutableList.of(jobId), Optional.of(jobId),
                () -> tm.begin(() -> visible(actor, jobStore.getJobById(jobId)),
                    ResourceNotFoundException.class),
                ResourceNotFoundException.class, RuntimeException.class, RuntimeException.class);
    }

    public List<StoredJob> listJobs(String actor)
    {
        return audited(actor, "listJobs()", ImmutableList.of(), Optional.absent(),
                () -> tm.begin(() -> jobStore.getJobs().stream()
                    .filter(job -> principals.isMember(actor, job.getPrincipalName()))
                    .collect(toImmutableList())));
    }

    public List<StoredJob> getJobsScheduledAt(String actor, Instant instant)
    {
        return audited(actor, "getJobsScheduledAt(Instant)", ImmutableList.of(instant), Optional.absent(),
                () -> tm.begin(() -> jobStore.getJobsScheduledAt(instant).stream()
                    .filter(job -> principals.isMember(actor, job.getPrincipalName()))
                    .collect(toImmutableList())));
    }

    public List<StoredJobLog> getJobLogs(String actor, int jobId)
    {
        return audited(actor, "getJobLogs(int)", ImmutableList.of(jobId), Optional.of(jobId),
                () -> tm.begin(() -> jobLogStore.getJobLogsByJobId(jobId).stream()
                    .filter(log -> principals.isMember(actor, log.getPrincipalName()))
                    .collect(toImmutableList())));
    }

    private StoredJob visible(String actor, StoredJob job)
        throws ResourceNotFoundException
    {
        if (!principals.isMember(actor, job.getPrincipalName())) {
            throw new ResourceNotFoundException("Resource does not exist: job id=" + job.getId());
        }
        return job;
    }

    private <T> T audited(
            String actor, String functionSignature, List<Object> arguments, Optional<Integer> jobId,
            SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func)
    {
        return audited(actor, functionSignature, arguments, jobId, func,
                RuntimeException.class, RuntimeException.class, RuntimeException.class);
    }

    private <T, E1 extends Exception, E2 extends Exception, E3 extends Exception> T audited(
            String actor, String functionSignature, List<Object> arguments, Optional<Integer> jobId,
            SupplierInTransaction<T, E1, E2, E3> func,
            Class<E1> e1, Class<E2> e2, Class<E3> e3)
        throws E1, E2, E3
    {
        Instant startedAt = clock.instant();
        T result;
        try {
            result = func.get();
        }
        catch (Exception ex) {
            try {
                addRunLog(actor, functionSignature, arguments, jobId, startedAt,
                        Optional.absent(), Optional.of(ErrorStates.fromException(ex)));
            }
            catch (RuntimeException logError) {
                ex.addSuppressed(logError);
            }
            ThrowablesUtil.propagateIfInstanceOf(ex, e1);
            ThrowablesUtil.propagateIfInstanceOf(ex, e2);
            ThrowablesUtil.propagateIfInstanceOf(ex, e3);
            throw ThrowablesUtil.propagate(ex);
        }

        Optional<Integer> resultJobId = jobId;
        if (!resultJobId.isPresent() && result instanceof StoredJob) {
            resultJobId = Optional.of(((StoredJob) result).getId());
        }
        addRunLog(actor, functionSignature, arguments, resultJobId, startedAt,
                Optional.of(rowsReturned(result)), Optional.absent());
        return result;
    }

    private void addRunLog(String actor, String functionSignature, List<Object> arguments,
            Optional<Integer> jobId, Instant startedAt,
            Optional<Long> rowsReturned, Optional<ErrorState> error)
    {
        RunLog log = ImmutableRunLog.builder()
            .jobId(jobId)
            .actorName(actor)
            .functionSignature(functionSignature)
            .arguments(arguments.stream().map(this::formatArgument).collect(toImmutableList()))
            .startedAt(startedAt)
            .finishedAt(clock.instant())
            .rowsReturned(rowsReturned)
            .error(error)
            .build();
        tm.autoCommit(() -> runLogStore.addRunLog(log));
    }

    private String formatArgument(Object argument)
    {
        if (argument instanceof String) {
            return (String) argument;
        }
        try {
            return objectMapper.writeValueAsString(argument);
        }
        catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Failed to serialize an argument: " + argument, ex);
        }
    }

    private static long rowsReturned(Object result)
    {
        if (result == null) {
            return 0L;
        }
        else if (result instanceof Collection) {
            return ((Collection<?>) result).size();
        }
        else {
            return 1L;
        }
    }
}
