package com.satyammall.inventoryservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A global exception handler to provide consistent, detailed error responses
 * for all controllers in the application.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles validation exceptions thrown by @Valid on request bodies.
     * It extracts all field errors and formats them into a structured JSON response.
     *
     * @param ex The MethodArgumentNotValidException that was thrown.
     * @return A ResponseEntity with a 400 Bad Request status and a map of field errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ResponseEntity<Map<String, String>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach((FieldError error) ->
                errors.put(error.getField(), error.getDefaultMessage()));
        return new ResponseEntity<>(errors, HttpStatus.BAD_REQUEST);
    }

    /**
     * Batch rejected before submission. The body names the failing check and item so the
     * client can point at the right row.
     */
    @ExceptionHandler(StockValidationException.class)
    public ResponseEntity<Map<String, String>> handleStockValidationException(StockValidationException ex) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("code", ex.getCode().name());
        body.put("message", ex.getMessage());
        if (ex.getItemName() != null) {
            body.put("itemName", ex.getItemName());
        }
        return new ResponseEntity<>(body, statusFor(ex.getCode()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ResponseEntity<String> handleResourceNotFoundException(ResourceNotFoundException ex) {
        return new ResponseEntity<>(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(InventoryStoreException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ResponseEntity<String> handleInventoryStoreException(InventoryStoreException ex) {
        return new ResponseEntity<>(ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Unknown filter values and other malformed request parameters.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ResponseEntity<String> handleIllegalArgumentException(IllegalArgumentException ex) {
        return new ResponseEntity<>(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    /**
     * Business rule violations, e.g. a second batch started while one is still running.
     */
    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ResponseEntity<String> handleIllegalStateException(IllegalStateException ex) {
        return new ResponseEntity<>(ex.getMessage(), HttpStatus.CONFLICT);
    }

    private HttpStatus statusFor(ValidationErrorCode code) {
        return switch (code) {
            case MISSING_FIELD, INVALID_QUANTITY -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_ITEM -> HttpStatus.NOT_FOUND;
            case INSUFFICIENT_STOCK -> HttpStatus.CONFLICT;
        };
    }
}
