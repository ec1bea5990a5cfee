package org.nowstart.compass.config;

import feign.FeignException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.exception.CompassException;
import org.nowstart.compass.data.exception.DataInsufficientException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class CompassExceptionHandler {

    @ExceptionHandler(CompassException.class)
    public ProblemDetail handleCompassException(CompassException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(exception.getStatus(), exception.getMessage());
        problemDetail.setProperty("code", exception.getCode());
        problemDetail.setProperty("entityId", exception.getEntityId());
        problemDetail.setProperty("entityVersion", exception.getEntityVersion());
        problemDetail.setProperty("retryable", exception.isRetryable());
        if (exception instanceof DataInsufficientException insufficient) {
            problemDetail.setProperty("requiredBars", insufficient.getRequiredBars());
            problemDetail.setProperty("availableBars", insufficient.getAvailableBars());
        }
        return problemDetail;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidationException(MethodArgumentNotValidException exception) {
        List<String> details = exception.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .toList();
        return validationProblem("Request validation failed", details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException exception) {
        List<String> details = exception.getConstraintViolations()
                .stream()
                .map(ConstraintViolation::getMessage)
                .toList();
        return validationProblem("Request validation failed", details);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class, MissingRequestHeaderException.class})
    public ProblemDetail handleBadRequest(Exception exception) {
        return validationProblem("Request validation failed", List.of(exception.getMessage() == null ? "invalid request" : exception.getMessage()));
    }

    @ExceptionHandler(FeignException.class)
    public ProblemDetail handleFeignException(FeignException exception) {
        HttpStatus status = HttpStatus.resolve(exception.status());
        if (status == null) {
            status = HttpStatus.BAD_GATEWAY;
        }

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, extractFeignDetail(exception));
        problemDetail.setProperty("code", "market_data_error");
        problemDetail.setProperty("upstreamStatus", exception.status());
        problemDetail.setProperty("retryable", true);
        return problemDetail;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpectedException(Exception exception) {
        log.error("event=unexpected_error type={}", exception.getClass().getName(), exception);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected server error"
        );
        problemDetail.setProperty("code", "internal_error");
        problemDetail.setProperty("retryable", false);
        return problemDetail;
    }

    private ProblemDetail validationProblem(String detail, List<String> details) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problemDetail.setProperty("code", "validation_error");
        problemDetail.setProperty("details", details);
        problemDetail.setProperty("retryable", false);
        return problemDetail;
    }

    private String extractFeignDetail(FeignException exception) {
        String body = exception.contentUTF8();
        if (body != null && !body.isBlank()) {
            return body;
        }

        String message = exception.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }

        return "Market data request failed";
    }
}
