package com.fintech.anomaly.api;

import com.fintech.anomaly.service.AnomalyQueryService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Global exception handler for REST API controllers.
 * Provides consistent error responses across all endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AnomalyQueryService.ValidationException.class)
    public ResponseEntity<ErrorResponse> handleServiceValidation(
            AnomalyQueryService.ValidationException ex,
            WebRequest request) {

        String path = pathOf(request);
        log.warn("Service validation error on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "SERVICE_VALIDATION_ERROR",
            ex.getMessage(),
            path
        ));
    }

    /**
     * Store unavailable or circuit breaker open.
     */
    @ExceptionHandler(AnomalyQueryService.ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(
            AnomalyQueryService.ServiceException ex,
            WebRequest request) {

        String path = pathOf(request);
        log.error("Service exception on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE.value(),
            "SERVICE_ERROR",
            "The anomaly store is temporarily unavailable.",
            path
        ));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.ValidationError(
                getFieldName(violation),
                violation.getInvalidValue() != null ? violation.getInvalidValue().toString() : "null",
                violation.getMessage()
            ))
            .toList();

        String path = pathOf(request);
        log.warn("Validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            "Request validation failed",
            path,
            validationErrors
        ));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {

        String path = pathOf(request);
        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "MISSING_PARAMETER",
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            path,
            List.of(new ErrorResponse.ValidationError(ex.getParameterName(), null, "This parameter is required"))
        ));
    }

    /**
     * Type conversion errors (e.g., "abc" for limit).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        log.warn("Type mismatch on {}: {} expected {} but got {}", path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getName(),
                ex.getValue() != null ? ex.getValue().toString() : "null",
                String.format("Expected type: %s", expectedType)
            ))
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request) {

        String path = pathOf(request);
        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "INVALID_ARGUMENT",
            ex.getMessage(),
            path
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = pathOf(request);
        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "INTERNAL_ERROR",
            "An unexpected error occurred. Please contact support if this persists.",
            path
        ));
    }

    private String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private String getFieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
