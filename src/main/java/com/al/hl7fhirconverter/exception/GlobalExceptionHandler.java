package com.al.hl7fhirconverter.exception;

import com.al.hl7fhirconverter.dto.ConversionError;
import com.al.hl7fhirconverter.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Hl7ConversionException.class)
    public ResponseEntity<ErrorResponse> handleConversionError(Hl7ConversionException e,
            HttpServletRequest request) {
        log.warn("HL7 Conversion Error ({}): {}", e.getReason(), e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Conversion failed: " + e.getReason(), e.getMessage(), null,
                request);
    }

    @ExceptionHandler(Hl7ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationError(Hl7ValidationException e,
            HttpServletRequest request) {
        log.warn("HL7 Validation Error: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation failed", e.getMessage(), e.getViolations(),
                request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid Input: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid Input", e.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            List<ConversionError> violations, HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getRequestURI(),
                violations);
        return new ResponseEntity<>(response, status);
    }
}
