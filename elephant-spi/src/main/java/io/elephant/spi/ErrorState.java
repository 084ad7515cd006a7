package io.elephant.spi;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Failure outcome of a job run or of a job-management call.
 *
 * The code is a five character SQLSTATE-style class code, for example
 * "42501" for insufficient privileges or "23505" for a duplicated job.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableErrorState.class)
@JsonDeserialize(as = ImmutableErrorState.class)
public interface ErrorState
{
    String getCode();

    String getMessage();

    Optional<String> getDetail();

    Optional<String> getHint();

    @Value.Check
    default void check()
    {
        if (getCode().length() != 5) {
            throw new IllegalStateException("Error code must be 5 characters: " + getCode());
        }
    }

    static ErrorState of(String code, String message)
    {
        return ImmutableErrorState.builder()
            .code(code)
            .message(message)
            .build();
    }

    static ErrorState of(String code, String message, Optional<String> detail, Optional<String> hint)
    {
        return ImmutableErrorState.builder()
            .code(code)
            .message(message)
            .detail(detail)
            .hint(hint)
            .build();
    }
}
