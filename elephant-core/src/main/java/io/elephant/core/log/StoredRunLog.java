package io.elephant.core.log;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredRunLog.class)
@JsonDeserialize(as = ImmutableStoredRunLog.class)
public abstract class StoredRunLog
        extends RunLog
{
    public abstract long getId();
}
