package io.elephant.core.log;

import java.util.List;
import com.google.common.base.Optional;

/**
 * Append-only store of job run outcomes.
 */
public interface JobLogStore
{
    StoredJobLog addJobLog(JobLog log);

    List<StoredJobLog> getJobLogsByJobId(int jobId);

    List<StoredJobLog> getJobLogs(int pageSize, Optional<Long> lastId);
}
