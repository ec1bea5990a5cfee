package org.nowstart.compass.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import feign.FeignException;
import feign.Request;
import feign.Response;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.exception.DataInsufficientException;
import org.nowstart.compass.data.exception.InvalidTransitionException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

class CompassExceptionHandlerTest {

    private final CompassExceptionHandler handler = new CompassExceptionHandler();

    @Test
    void handleCompassException_dataInsufficientCarriesBarCounts() {
        DataInsufficientException exception = new DataInsufficientException("us-equities", "2024-06-01T00:00:00Z", 63, 30, "short history");

        ProblemDetail detail = handler.handleCompassException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY.value());
        assertThat(detail.getDetail()).isEqualTo("short history");
        assertThat(detail.getProperties())
                .containsEntry("code", "data_insufficient")
                .containsEntry("entityId", "us-equities")
                .containsEntry("entityVersion", "2024-06-01T00:00:00Z")
                .containsEntry("retryable", true)
                .containsEntry("requiredBars", 63)
                .containsEntry("availableBars", 30);
    }

    @Test
    void handleCompassException_mapsConflictsAndNotFound() {
        ProblemDetail conflict = handler.handleCompassException(new ConcurrentRecordModificationException("s-1", "1", "stale"));
        ProblemDetail transition = handler.handleCompassException(new InvalidTransitionException("d-1", null, "already resolved"));
        ProblemDetail notFound = handler.handleCompassException(new RecordNotFoundException("Strategy", "s-1", "2"));

        assertThat(conflict.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
        assertThat(conflict.getProperties()).containsEntry("code", "concurrent_modification").containsEntry("retryable", true);
        assertThat(transition.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
        assertThat(transition.getProperties()).containsEntry("code", "invalid_transition").containsEntry("retryable", false);
        assertThat(notFound.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
        assertThat(notFound.getDetail()).isEqualTo("Strategy not found: s-1@2");
        assertThat(notFound.getProperties()).doesNotContainKey("requiredBars");
    }

    @Test
    void handleBadRequest_rendersValidationError() {
        ProblemDetail detail = handler.handleBadRequest(new IllegalArgumentException("modification is required to modify a decision"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties())
                .containsEntry("code", "validation_error")
                .containsEntry("details", List.of("modification is required to modify a decision"));
    }

    @Test
    void handleUnexpectedException_returnsInternalErrorProblemDetail() {
        ProblemDetail detail = handler.handleUnexpectedException(new IllegalStateException("boom"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getDetail()).isEqualTo("Unexpected server error");
        assertThat(detail.getProperties()).containsEntry("code", "internal_error");
    }

    @Test
    void handleFeignException_includesUpstreamBodyAndStatus() {
        Request request = Request.create(
                Request.HttpMethod.GET,
                "/v1/contexts/us-equities/latest",
                Map.of(),
                null,
                StandardCharsets.UTF_8,
                null
        );
        Response response = Response.builder()
                .status(404)
                .reason("Not Found")
                .request(request)
                .headers(Map.of())
                .body("{\"error\":\"unknown_context\"}", StandardCharsets.UTF_8)
                .build();
        FeignException exception = FeignException.errorStatus("MarketDataFeignClient#getLatestSnapshot", response);

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
        assertThat(detail.getDetail()).contains("unknown_context");
        assertThat(detail.getProperties()).containsEntry("code", "market_data_error");
        assertThat(detail.getProperties()).containsEntry("upstreamStatus", 404);
    }

    @Test
    void handleFeignException_fallsBackToBadGatewayWhenStatusUnknown() {
        FeignException exception = mock(FeignException.class);
        when(exception.status()).thenReturn(-1);
        when(exception.contentUTF8()).thenReturn("");
        when(exception.getMessage()).thenReturn(" ");

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY.value());
        assertThat(detail.getDetail()).isEqualTo("Market data request failed");
    }

    @Test
    void handleValidationException_returnsValidationDetails() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new ValidationTarget(), "target");
        bindingResult.addError(new FieldError("target", "goalId", "goalId is required"));
        MethodParameter methodParameter = new MethodParameter(
                CompassExceptionHandlerTest.class.getDeclaredMethod("dummyValidationMethod", ValidationTarget.class),
                0
        );

        ProblemDetail detail = handler.handleValidationException(new MethodArgumentNotValidException(methodParameter, bindingResult));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("details", List.of("goalId is required"));
    }

    @Test
    void handleConstraintViolationException_returnsValidationDetails() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = (ConstraintViolation<Object>) mock(ConstraintViolation.class);
        when(violation.getMessage()).thenReturn("rating must be between 1 and 5");

        ProblemDetail detail = handler.handleConstraintViolationException(new ConstraintViolationException(Set.of(violation)));

        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
        assertThat(detail.getProperties()).containsEntry("details", List.of("rating must be between 1 and 5"));
    }

    @SuppressWarnings("unused")
    private void dummyValidationMethod(ValidationTarget target) {
    }

    private static final class ValidationTarget {
        private String goalId;
    }
}
