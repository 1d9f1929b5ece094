package com.campussecurity.dispatch.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps dispatch exceptions to HTTP responses with a consistent {@link ErrorResponse} body.
 *
 * Only invalid input surfaces here. Lost accept races, stale alerts and empty searches are
 * reported as outcome values in normal 200 responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({
        UnknownOrInactiveBeaconException.class,
        DeviceNotFoundException.class,
        IncidentNotFoundException.class,
        AlertNotFoundException.class,
        GuardNotFoundException.class,
        ProximityNotFoundException.class
    })
    public ResponseEntity<ErrorResponse> handleNotFound(DispatchException ex, HttpServletRequest request) {
        log.warn("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidGuardException.class)
    public ResponseEntity<ErrorResponse> handleInvalidGuard(InvalidGuardException ex, HttpServletRequest request) {
        log.warn("Invalid guard: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({InvalidActorException.class, InvalidProximityException.class})
    public ResponseEntity<ErrorResponse> handleInvalidInput(DispatchException ex, HttpServletRequest request) {
        log.warn("Invalid request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({InvalidStatusTransitionException.class, GuardUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleConflict(DispatchException ex, HttpServletRequest request) {
        log.warn("Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                             HttpServletRequest request) {
        log.error("Data integrity violation on {}: {}", request.getRequestURI(),
            ex.getMostSpecificCause().getMessage(), ex);
        return respond(HttpStatus.CONFLICT, "DATA_INTEGRITY_VIOLATION",
            "The request conflicts with stored data", request);
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ErrorResponse> handleDispatch(DispatchException ex, HttpServletRequest request) {
        log.error("Dispatch failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(error -> ErrorResponse.FieldError.builder()
                .field(error.getField())
                .rejectedValue(String.valueOf(error.getRejectedValue()))
                .message(error.getDefaultMessage())
                .build())
            .toList();

        log.warn("Validation failed on {}: {} field error(s)", request.getRequestURI(), fieldErrors.size());

        ErrorResponse error = ErrorResponse.builder()
            .errorCode("VALIDATION_ERROR")
            .message("Request validation failed")
            .status(HttpStatus.BAD_REQUEST.value())
            .path(request.getRequestURI())
            .fieldErrors(fieldErrors)
            .build();
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
            .errorCode(code)
            .message(message)
            .status(status.value())
            .path(request.getRequestURI())
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
