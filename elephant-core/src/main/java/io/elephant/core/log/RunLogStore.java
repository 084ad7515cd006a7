package io.elephant.core.log;

import java.util.List;
import com.google.common.base.Optional;

/**
 * Append-only store of job-management audit records.
 */
public interface RunLogStore
{
    StoredRunLog addRunLog(RunLog log);

    List<StoredRunLog> getRunLogsByJobId(int jobId);

    List<StoredRunLog> getRunLogs(int pageSize, Optional<Long> lastId);
}
