package io.elephant.spi;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJobRunResult.class)
@JsonDeserialize(as = ImmutableJobRunResult.class)
public interface JobRunResult
{
    Optional<ErrorState> getError();

    @JsonIgnore
    default boolean isSuccess()
    {
        return !getError().isPresent();
    }

    static JobRunResult success()
    {
        return ImmutableJobRunResult.builder().build();
    }

    static JobRunResult failure(ErrorState error)
    {
        return ImmutableJobRunResult.builder()
            .error(error)
            .build();
    }
}
