package com.satyammall.inventoryservice.exception;

import com.satyammall.inventoryservice.util.QuantityFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.math.BigDecimal;

/**
 * Custom exception thrown when an issue cannot be recorded because there is not
 * enough quantity of an item in stock.
 * <p>
 * This is a specific business rule violation. It maps to a 409 Conflict
 * HTTP status, indicating that the request is valid but cannot be processed
 * due to the current state of the resource (the inventory).
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InsufficientStockException extends StockValidationException {

    /**
     * @param itemName  the item that was requested.
     * @param available the quantity currently in stock.
     * @param unit      the inventory unit, used in the message.
     */
    public InsufficientStockException(String itemName, BigDecimal available, String unit) {
        super(ValidationErrorCode.INSUFFICIENT_STOCK, itemName,
                "Insufficient stock for \"" + itemName + "\"! Only "
                        + QuantityFormat.format(available) + " " + unit + " available.");
    }
}
