package com.satyammall.inventoryservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when the backing store cannot be read.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class InventoryStoreException extends RuntimeException {

    public InventoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
