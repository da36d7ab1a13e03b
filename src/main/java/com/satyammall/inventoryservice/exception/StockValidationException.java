package com.satyammall.inventoryservice.exception;

import lombok.Getter;

/**
 * Base type for every validation failure that aborts a whole batch.
 * <p>
 * By extending RuntimeException, it is an "unchecked" exception.
 */
@Getter
public abstract class StockValidationException extends RuntimeException {

    private final ValidationErrorCode code;
    private final String itemName;

    protected StockValidationException(ValidationErrorCode code, String itemName, String message) {
        super(message);
        this.code = code;
        this.itemName = itemName;
    }
}
