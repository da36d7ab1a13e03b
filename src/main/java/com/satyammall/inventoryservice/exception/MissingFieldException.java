package com.satyammall.inventoryservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a line item is missing its name, quantity or unit.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class MissingFieldException extends StockValidationException {

    public MissingFieldException(String itemName) {
        super(ValidationErrorCode.MISSING_FIELD, itemName, "Please fill in all item fields.");
    }
}
