package com.satyammall.inventoryservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidQuantityException extends StockValidationException {

    public InvalidQuantityException(String itemName) {
        super(ValidationErrorCode.INVALID_QUANTITY, itemName,
                "Quantity for \"" + itemName + "\" must be a positive number.");
    }
}
