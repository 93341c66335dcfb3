package com.ledgerpilot.budget.controller;

import com.ledgerpilot.budget.controller.dto.ErrorResponseDto;
import com.ledgerpilot.budget.error.NoActiveBudgetException;
import com.ledgerpilot.budget.error.NotFoundException;
import com.ledgerpilot.budget.error.ReadOnlyModeException;
import com.ledgerpilot.budget.error.ValidationException;
import com.ledgerpilot.budget.remote.RemoteApiException;
import com.ledgerpilot.budget.security.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleRequestValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponseDto> handleValidation(ValidationException ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), ex.details());
    }

    @ExceptionHandler(NoActiveBudgetException.class)
    public ResponseEntity<ErrorResponseDto> handleNoActiveBudget(NoActiveBudgetException ex) {
        return build(HttpStatus.CONFLICT, "NO_ACTIVE_BUDGET", ex.getMessage(), Map.of(
                "availableBudgets", ex.alternatives(),
                "action", "Select a budget with PUT /budget-context/active"
        ));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(NotFoundException ex) {
        Map<String, Object> details = new HashMap<>();
        details.put("entityType", ex.entityType());
        if (ex.query() != null) {
            details.put("query", ex.query());
        }
        details.put("alternatives", ex.alternatives());
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), details);
    }

    @ExceptionHandler(ReadOnlyModeException.class)
    public ResponseEntity<ErrorResponseDto> handleReadOnly(ReadOnlyModeException ex) {
        return build(HttpStatus.FORBIDDEN, "READ_ONLY_MODE", ex.getMessage(), Map.of(
                "action", "Set ledgerpilot.tools.read-only=false to allow writes"
        ));
    }

    // --- Upstream (remote budget API) mapping ---
    @ExceptionHandler(RemoteApiException.class)
    public ResponseEntity<ErrorResponseDto> handleRemote(RemoteApiException ex) {
        HttpStatus status = ex.status() == RemoteApiException.NO_RESPONSE ? null : HttpStatus.resolve(ex.status());
        if (status == null) {
            status = HttpStatus.BAD_GATEWAY;
        }
        Map<String, Object> details = new HashMap<>();
        details.put("status", ex.status());
        details.put("detail", ex.detail());
        String hint = hintFor(ex.status());
        if (hint != null) {
            details.put("hint", hint);
        }
        return build(status, "REMOTE_API_ERROR", ex.getMessage(), details);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled exception", ex);
        Map<String, Object> details = new HashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    static String hintFor(int status) {
        return switch (status) {
            case RemoteApiException.NO_RESPONSE -> "The remote API could not be reached; check connectivity and ledgerpilot.remote.base-url";
            case 400 -> "Check the request fields; amounts are in milliunits (1000 = one currency unit)";
            case 401 -> "The access token is invalid or expired; update ledgerpilot.remote.access-token";
            case 403 -> "The access token is not allowed to perform this operation";
            case 404 -> "The budget, transaction or entity id does not exist; refresh the caches and retry";
            case 409 -> "The entity conflicts with an existing one; refresh and retry";
            case 429 -> "Rate limit reached; wait before retrying";
            default -> status >= 500 ? "The remote API is having problems; retry later" : null;
        };
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
