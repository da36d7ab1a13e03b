package com.satyammall.inventoryservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when an issue names an item that is not in the inventory.
 * Mapped to a 404 Not Found HTTP status.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownItemException extends StockValidationException {

    public UnknownItemException(String itemName) {
        super(ValidationErrorCode.UNKNOWN_ITEM, itemName, "\"" + itemName + "\" is not a valid item.");
    }
}
