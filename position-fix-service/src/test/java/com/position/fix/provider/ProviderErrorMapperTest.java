// com/position/fix/provider/ProviderErrorMapperTest.java
package com.position.fix.provider;

import com.position.fix.exception.FixTimedOutException;
import com.position.fix.exception.LocationRestrictedException;
import com.position.fix.exception.PositioningException;
import com.position.fix.exception.ProviderFailureException;
import com.position.fix.exception.RequestCancelledException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ProviderErrorMapper classification.
 */
class ProviderErrorMapperTest {

    private final ProviderErrorMapper mapper = new ProviderErrorMapper();

    static Stream<Arguments> classifications() {
        return Stream.of(
            Arguments.of(new SecurityException("denied"), PositioningException.ErrorType.RESTRICTED),
            Arguments.of(new CancellationException("stopped"), PositioningException.ErrorType.CANCELLED),
            Arguments.of(new InterruptedException("interrupted"), PositioningException.ErrorType.CANCELLED),
            Arguments.of(new IOException("receiver offline"), PositioningException.ErrorType.PROVIDER_FAILURE),
            Arguments.of(new IllegalStateException("bad state"), PositioningException.ErrorType.PROVIDER_FAILURE)
        );
    }

    @ParameterizedTest
    @MethodSource("classifications")
    void shouldClassifyRawErrors(Throwable error, PositioningException.ErrorType expected) {
        // When
        PositioningException mapped = mapper.map(error);

        // Then
        assertThat(mapped.getErrorType()).isEqualTo(expected);
        assertThat(mapped.getCause()).isSameAs(error);
    }

    @Test
    void shouldPassPositioningExceptionsThrough() {
        // Given
        FixTimedOutException timeout = new FixTimedOutException("too slow");

        // When / Then
        assertThat(mapper.map(timeout)).isSameAs(timeout);
    }

    @Test
    void shouldWrapMissingErrorAsProviderFailure() {
        assertThat(mapper.map(null)).isInstanceOf(ProviderFailureException.class);
    }

    @Test
    void shouldUseConcreteExceptionTypes() {
        assertThat(mapper.map(new SecurityException("x"))).isInstanceOf(LocationRestrictedException.class);
        assertThat(mapper.map(new CancellationException("x"))).isInstanceOf(RequestCancelledException.class);
        assertThat(mapper.map(new RuntimeException("x")))
            .isInstanceOf(ProviderFailureException.class)
            .hasMessageContaining("x");
    }
}
