package com.al.radiologyfiller.exception;

import ca.uhn.fhir.parser.DataFormatException;
import com.al.radiologyfiller.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.LocalDateTime;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RadiologyException.class)
    public ResponseEntity<ErrorResponse> handleRadiologyError(RadiologyException e, HttpServletRequest request) {
        HttpStatus status = e.getKind().getHttpStatus();
        if (status.is5xxServerError() && !e.isRetryable()) {
            log.error("{}: {}", e.getKind().getCode(), e.getMessage(), e);
        } else {
            log.warn("{}: {}", e.getKind().getCode(), e.getMessage());
        }
        return buildResponse(status, e.getKind().getCode(), e.getMessage(), request);
    }

    @ExceptionHandler(DataFormatException.class)
    public ResponseEntity<ErrorResponse> handleFhirParseError(DataFormatException e, HttpServletRequest request) {
        log.warn("FHIR Parsing Error: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, ErrorKind.MAPPING_ERROR.getCode(), e.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid Input: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", e.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e,
            HttpServletRequest request) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", "Request body is missing or malformed", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException e,
            HttpServletRequest request) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation Error: {}", details);
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation Error", details, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL_ERROR.getCode(),
                "An unexpected error occurred", request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getRequestURI());
        return new ResponseEntity<>(response, status);
    }
}
