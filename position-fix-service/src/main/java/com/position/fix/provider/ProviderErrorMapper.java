// com/position/fix/provider/ProviderErrorMapper.java
package com.position.fix.provider;

import com.position.fix.exception.LocationRestrictedException;
import com.position.fix.exception.PositioningException;
import com.position.fix.exception.ProviderFailureException;
import com.position.fix.exception.RequestCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;

/**
 * Maps raw provider errors onto the failure kinds reported to fix requests.
 *
 * <p>Classification:
 * <ul>
 *   <li>{@link PositioningException}: passed through unchanged</li>
 *   <li>{@link SecurityException}: the platform refused access, reported as restricted</li>
 *   <li>{@link CancellationException}, {@link InterruptedException}: reported as cancelled</li>
 *   <li>anything else, including null: wrapped as a provider failure</li>
 * </ul>
 */
@Slf4j
@Component
public class ProviderErrorMapper {

    public PositioningException map(Throwable error) {
        if (error == null) {
            return new ProviderFailureException("Location provider failed without an error");
        }
        if (error instanceof PositioningException) {
            return (PositioningException) error;
        }
        if (error instanceof SecurityException) {
            log.debug("Classified provider error as RESTRICTED: {}", error.getMessage());
            return new LocationRestrictedException("Location provider denied access: " + error.getMessage(), error);
        }
        if (error instanceof CancellationException || error instanceof InterruptedException) {
            log.debug("Classified provider error as CANCELLED: {}", error.getMessage());
            return new RequestCancelledException("Location provider cancelled updates", error);
        }
        log.debug("Classified provider error as PROVIDER_FAILURE: {}", error.getMessage());
        return new ProviderFailureException("Location provider failed: " + error.getMessage(), error);
    }
}
