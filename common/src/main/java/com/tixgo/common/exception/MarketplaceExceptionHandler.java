package com.tixgo.common.exception;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.tixgo.common.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps {@link MarketplaceException} kinds and common Spring MVC failures to {@link ErrorResponse}
 * bodies. Each service exposes a {@code @RestControllerAdvice} subclass.
 */
@Slf4j
public abstract class MarketplaceExceptionHandler {

    private final String serviceName;

    protected MarketplaceExceptionHandler(String serviceName) {
        this.serviceName = serviceName;
    }

    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<ErrorResponse> handleMarketplaceException(MarketplaceException e, HttpServletRequest request) {
        HttpStatus status = statusFor(e.getKind());

        if (status.is5xxServerError()) {
            log.error("{} request failed: {} - {}", serviceName, e.getKind(), e.getMessage(), e);
        } else {
            log.warn("{} request rejected: {} - {}", serviceName, e.getKind(), e.getMessage());
        }

        return build(status, e.getKind(), e.getMessage(), request, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e,
                                                                   HttpServletRequest request) {
        Map<String, String> fieldErrors = new HashMap<>();

        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }

        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Invalid request parameters", request, fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e,
                                                              HttpServletRequest request) {
        if (e.getCause() instanceof UnrecognizedPropertyException) {
            UnrecognizedPropertyException unrecognized = (UnrecognizedPropertyException) e.getCause();
            Map<String, String> fieldErrors = new HashMap<>();
            fieldErrors.put(unrecognized.getPropertyName(), "Field is not allowed");
            return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Request contains fields that cannot be set",
                request, fieldErrors);
        }

        log.warn("Unreadable request body: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Malformed request body", request, null);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, e.getMessage(), request, null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e, HttpServletRequest request) {
        return build(HttpStatus.UNAUTHORIZED, ErrorKind.UNAUTHENTICATED, "Missing " + e.getHeaderName() + " header",
            request, null);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException e,
                                                              HttpServletRequest request) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, ErrorKind.CONCURRENT_UPDATE,
            "The resource was modified concurrently, please retry", request, null);
    }

    @ExceptionHandler({DataAccessResourceFailureException.class, TransientDataAccessException.class})
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(Exception e, HttpServletRequest request) {
        log.error("Storage unavailable", e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.UNAVAILABLE,
            "Storage is temporarily unavailable, please retry", request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error in {} service", serviceName, e);

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .error("Internal Server Error")
            .message("An unexpected error occurred. Please try again later.")
            .path(request.getRequestURI())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    public static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            case UNAUTHENTICATED:
                return HttpStatus.UNAUTHORIZED;
            case FORBIDDEN:
            case VENDOR_SUSPENDED:
                return HttpStatus.FORBIDDEN;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.CONFLICT; // State machine, stock, slot, verification and payment conflicts
        }
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, ErrorKind kind, String message,
                                                HttpServletRequest request, Map<String, String> validationErrors) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .errorKind(kind.name())
            .message(message)
            .path(request.getRequestURI())
            .validationErrors(validationErrors)
            .build();

        return ResponseEntity.status(status).body(errorResponse);
    }
}
