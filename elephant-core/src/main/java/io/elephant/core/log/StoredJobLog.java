package io.elephant.core.log;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredJobLog.class)
@JsonDeserialize(as = ImmutableStoredJobLog.class)
public abstract class StoredJobLog
        extends JobLog
{
    public abstract long getId();
}
