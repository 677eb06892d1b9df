package com.di.bugsummary.exception;

import com.di.bugsummary.aspect.ErrorCategory;
import com.di.bugsummary.util.TransactionEventLogger;
import jakarta.servlet.http.HttpServletRequest;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps failures of the summary endpoints to HTTP responses with a uniform {@link ErrorResponse}
 * and logs each one as a structured event.
 *
 * <ul>
 *   <li>{@link InvariantViolationException}: 422</li>
 *   <li>{@link TransientConflictException}: 503 with {@code Retry-After}</li>
 *   <li>{@link SummaryCorruptionException} and {@link DataAccessException}: 500</li>
 *   <li>bad request parameters: 400</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final String RETRY_AFTER_SECONDS = "1";

    private final TransactionEventLogger eventLogger;

    public GlobalExceptionHandler(TransactionEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e, HttpServletRequest request) {
        return respond("INVARIANT_VIOLATION", e, HttpStatus.UNPROCESSABLE_ENTITY, request);
    }

    @ExceptionHandler(TransientConflictException.class)
    public ResponseEntity<ErrorResponse> handleTransientConflict(TransientConflictException e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("TRANSIENT_CONFLICT", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.SERVICE_UNAVAILABLE, request);
        body.addDetail("attempts", e.getAttempts());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(body);
    }

    @ExceptionHandler(SummaryCorruptionException.class)
    public ResponseEntity<ErrorResponse> handleCorruption(SummaryCorruptionException e, HttpServletRequest request) {
        return respond("SUMMARY_CORRUPTION", e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e, HttpServletRequest request) {
        return respond("DATA_ACCESS_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Exception e, HttpStatus status, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(eventType, category, e);
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status, request));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        String transactionId = MDC.get("transactionId");
        if (transactionId == null) {
            transactionId = "global-handler-" + UUID.randomUUID().toString().substring(0, 8);
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("errorMessage", messageOf(exception));
        context.put("errorType", exception.getClass().getName());
        context.put("errorCategory", category.name());
        context.put("handler", "GlobalExceptionHandler");
        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            context.put("rootCauseType", rootCause.getClass().getSimpleName());
            context.put("rootCauseMessage", rootCause.getMessage());
        }
        eventLogger.logEvent(eventType, context, transactionId, "global_exception_handler", exception);

        if (category == ErrorCategory.VALIDATION_ERROR || category == ErrorCategory.INVARIANT_VIOLATION) {
            log.warn("GlobalExceptionHandler rejected request: {} [{}]", messageOf(exception), category.getName());
        } else {
            log.error("GlobalExceptionHandler caught exception: {} [{}]",
                    exception.getClass().getSimpleName(), category.getName(), exception);
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status,
                                             HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(messageOf(exception));
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(request != null ? request.getRequestURI() : "/unknown");
        response.addDetail("exceptionType", exception.getClass().getName());
        return response;
    }

    private static String messageOf(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return rootCause(cause);
    }

    /**
     * Error body returned by all summary endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
