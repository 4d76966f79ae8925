package com.dockeriot.ingestion.exception;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates request and store failures into {@link ErrorResponse} bodies.
 * Invalid input is answered with 422, store failures with a generic 500.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private static final HttpStatus UNPROCESSABLE = HttpStatus.UNPROCESSABLE_ENTITY;

    private final ObjectMapper objectMapper;

    /**
     * Handle bean validation errors on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        Object target = ex.getBindingResult().getTarget();
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> jsonName(target, error) + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());

        return validationFailed(request, "Request validation failed", details);
    }

    /**
     * Handle constraint violations on query parameters, e.g. an out-of-range limit.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        List<String> details = ex.getConstraintViolations().stream()
                .map(GlobalExceptionHandler::describe)
                .sorted()
                .collect(Collectors.toList());

        return validationFailed(request, "Request validation failed", details);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {

        List<String> details = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(error -> result.getMethodParameter().getParameterName() + ": "
                                + error.getDefaultMessage()))
                .collect(Collectors.toList());

        return validationFailed(request, "Request validation failed", details);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        String detail = ex.getName() + ": invalid value '" + ex.getValue() + "'";
        return validationFailed(request, "Request validation failed", List.of(detail));
    }

    /**
     * Handle malformed JSON and values of the wrong type (e.g. a non-numeric value).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        List<String> details = List.of();
        if (ex.getCause() instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            String field = mapping.getPath().stream()
                    .map(reference -> reference.getFieldName() != null
                            ? reference.getFieldName()
                            : "[" + reference.getIndex() + "]")
                    .collect(Collectors.joining("."));
            details = List.of(field + ": invalid type or format");
        }

        return validationFailed(request, "Invalid request body", details);
    }

    /**
     * Unknown paths, unsupported methods and content types keep the status Spring MVC assigned.
     */
    @ExceptionHandler({
            ErrorResponseException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class
    })
    public ResponseEntity<ErrorResponse> handleRequestRejected(Exception ex, HttpServletRequest request) {
        org.springframework.web.ErrorResponse rejection = (org.springframework.web.ErrorResponse) ex;
        HttpStatusCode status = rejection.getStatusCode();
        HttpStatus known = HttpStatus.resolve(status.value());

        log.warn("Request rejected for {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());

        ErrorResponse response = ErrorResponse.of(
                status.value(),
                known != null ? known.getReasonPhrase() : "Request Rejected",
                rejection.getBody().getDetail(),
                request.getRequestURI()
        );

        return ResponseEntity.status(status).headers(rejection.getHeaders()).body(response);
    }

    /**
     * Store failures are not retried; the caller gets a generic 500 without connection details.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(
            DataAccessException ex, HttpServletRequest request) {

        log.error("Store failure for {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "The data store could not complete the request",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private ResponseEntity<ErrorResponse> validationFailed(
            HttpServletRequest request, String message, List<String> details) {

        log.warn("Validation failed for {}: {}", request.getRequestURI(), details);

        ErrorResponse response = ErrorResponse.of(
                UNPROCESSABLE.value(),
                "Validation Failed",
                message,
                request.getRequestURI(),
                details
        );

        return ResponseEntity.status(UNPROCESSABLE).body(response);
    }

    /**
     * Reports a bound field under the name clients send, e.g. "device_id" rather than "deviceId".
     */
    private String jsonName(Object target, FieldError error) {
        if (target == null) {
            return error.getField();
        }
        BeanDescription description = objectMapper.getDeserializationConfig()
                .introspect(objectMapper.constructType(target.getClass()));
        return description.findProperties().stream()
                .filter(property -> property.getInternalName().equals(error.getField()))
                .map(BeanPropertyDefinition::getName)
                .findFirst()
                .orElse(error.getField());
    }

    private static String describe(ConstraintViolation<?> violation) {
        // Property path looks like "listMeasurements.limit"; keep the parameter name.
        String path = violation.getPropertyPath().toString();
        String field = path.substring(path.lastIndexOf('.') + 1);
        return field + ": " + violation.getMessage();
    }
}
