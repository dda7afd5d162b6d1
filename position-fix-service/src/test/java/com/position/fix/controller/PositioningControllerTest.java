// com/position/fix/controller/PositioningControllerTest.java
package com.position.fix.controller;

import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.dto.ProviderState;
import com.position.fix.dto.Sample;
import com.position.fix.dto.SchedulerStatusResponse;
import com.position.fix.exception.FixTimedOutException;
import com.position.fix.exception.LocationRestrictedException;
import com.position.fix.exception.PositioningException;
import com.position.fix.exception.ProviderFailureException;
import com.position.fix.exception.RequestCancelledException;
import com.position.fix.service.PositioningService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for PositioningController.
 */
@ExtendWith(MockitoExtension.class)
class PositioningControllerTest {

    private static final Instant TIMESTAMP = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private PositioningService positioningService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PositioningController(positioningService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private MvcResult postFix(String body) throws Exception {
        return mockMvc.perform(post("/api/positioning/fix")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(request().asyncStarted())
            .andReturn();
    }

    @Test
    void shouldReturnFixOnSuccess() throws Exception {
        // Given
        Sample sample = Sample.of(37.7749, -122.4194, 12.5, TIMESTAMP);
        when(positioningService.requestOneFix(50.0, Duration.ofMillis(5000)))
            .thenReturn(CompletableFuture.completedFuture(sample));

        // When
        MvcResult result = postFix("{\"desiredAccuracy\": 50.0, \"timeoutMs\": 5000}");

        // Then
        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result").value("SUCCESS"))
            .andExpect(jsonPath("$.latitude").value(37.7749))
            .andExpect(jsonPath("$.longitude").value(-122.4194))
            .andExpect(jsonPath("$.horizontalAccuracy").value(12.5))
            .andExpect(jsonPath("$.errorType").doesNotExist());
    }

    @Test
    void shouldUseDefaultTimeoutWhenAbsent() throws Exception {
        // Given
        when(positioningService.requestOneFix(50.0))
            .thenReturn(CompletableFuture.completedFuture(Sample.of(0, 0, 5.0, TIMESTAMP)));

        // When
        MvcResult result = postFix("{\"desiredAccuracy\": 50.0}");

        // Then
        mockMvc.perform(asyncDispatch(result)).andExpect(status().isOk());
        verify(positioningService).requestOneFix(50.0);
    }

    @Test
    void shouldMapTimeoutToGatewayTimeout() throws Exception {
        // Given
        CompletableFuture<Sample> failed = new CompletableFuture<>();
        failed.completeExceptionally(new CompletionException(FixTimedOutException.after(Duration.ofSeconds(2), 10.0)));
        when(positioningService.requestOneFix(10.0, Duration.ofMillis(2000))).thenReturn(failed);

        // When
        MvcResult result = postFix("{\"desiredAccuracy\": 10.0, \"timeoutMs\": 2000}");

        // Then
        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.result").value("ERROR"))
            .andExpect(jsonPath("$.errorType").value("TIMED_OUT"))
            .andExpect(jsonPath("$.message").value("No fix better than 10.0 m within 2000 ms"));
    }

    @Test
    void shouldMapRestrictionToForbidden() throws Exception {
        // Given
        when(positioningService.requestOneFix(50.0))
            .thenReturn(CompletableFuture.failedFuture(LocationRestrictedException.forStatus(AuthorizationStatus.DENIED)));

        // When
        MvcResult result = postFix("{\"desiredAccuracy\": 50.0}");

        // Then
        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.errorType").value("RESTRICTED"));
    }

    @Test
    void shouldMapUnexpectedFailureToInternalError() throws Exception {
        // Given
        when(positioningService.requestOneFix(50.0))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("unexpected")));

        // When
        MvcResult result = postFix("{\"desiredAccuracy\": 50.0}");

        // Then
        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.errorType").value("INTERNAL_ERROR"));
    }

    @Test
    void shouldRejectNonPositiveAccuracy() throws Exception {
        mockMvc.perform(post("/api/positioning/fix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"desiredAccuracy\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fieldErrors.desiredAccuracy").value("Desired accuracy must be positive"));

        verify(positioningService, never()).requestOneFix(anyDouble());
    }

    @Test
    void shouldRejectMissingAccuracy() throws Exception {
        mockMvc.perform(post("/api/positioning/fix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"timeoutMs\": 1000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fieldErrors.desiredAccuracy").value("Desired accuracy is required"));
    }

    @Test
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/positioning/fix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void shouldReportCancelledCount() throws Exception {
        // Given
        when(positioningService.cancelAllPending()).thenReturn(3);

        // When / Then
        mockMvc.perform(delete("/api/positioning/fix"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(3));
    }

    @Test
    void shouldReturnSchedulerStatus() throws Exception {
        // Given
        when(positioningService.getStatus()).thenReturn(SchedulerStatusResponse.builder()
            .providerState(ProviderState.ACTIVE)
            .pendingRequests(2)
            .authorization(AuthorizationStatus.ALLOWED_ALWAYS)
            .continuousDemand(false)
            .build());

        // When / Then
        mockMvc.perform(get("/api/positioning/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.providerState").value("ACTIVE"))
            .andExpect(jsonPath("$.pendingRequests").value(2))
            .andExpect(jsonPath("$.authorization").value("ALLOWED_ALWAYS"))
            .andExpect(jsonPath("$.latestSample").doesNotExist());
    }

    @ParameterizedTest
    @EnumSource(PositioningException.ErrorType.class)
    void shouldMapEveryErrorTypeToClientVisibleStatus(PositioningException.ErrorType errorType) {
        HttpStatus status = PositioningController.determineHttpStatus(errorType);

        assertThat(status.isError()).isTrue();
        assertThat(status).isNotEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void shouldDistinguishCancellationFromProviderFailure() {
        assertThat(PositioningController.determineHttpStatus(new RequestCancelledException("x").getErrorType()))
            .isEqualTo(HttpStatus.CONFLICT);
        assertThat(PositioningController.determineHttpStatus(new ProviderFailureException("x").getErrorType()))
            .isEqualTo(HttpStatus.BAD_GATEWAY);
    }
}
