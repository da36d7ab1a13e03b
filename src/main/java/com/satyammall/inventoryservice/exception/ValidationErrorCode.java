package com.satyammall.inventoryservice.exception;

/**
 * Reasons a batch is rejected before anything is submitted.
 */
public enum ValidationErrorCode {
    MISSING_FIELD,
    INVALID_QUANTITY,
    UNKNOWN_ITEM,
    INSUFFICIENT_STOCK
}
