package com.satyammall.inventoryservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What gets sent to the transaction sink for a single line item.
 */
@Value
@Builder
public class TransactionRequest {
    OperationKind type;
    String itemName;
    BigDecimal quantity;
    String unit;
    String location;
    String personName;
    String notes;
    String fileUrl;
}
