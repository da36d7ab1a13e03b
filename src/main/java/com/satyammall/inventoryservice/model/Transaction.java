package com.satyammall.inventoryservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A recorded stock movement as read back from the transaction log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {
    private String id;
    private Instant date;
    private OperationKind type;
    private String itemName;
    private BigDecimal quantity;
    private String unit;
    private String location;
    private String personName;
    private String notes;
    private String fileUrl;
}
