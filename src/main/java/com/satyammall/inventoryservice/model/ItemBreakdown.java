package com.satyammall.inventoryservice.model;

import lombok.Data;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-item totals within one location. The unit is fixed by the first transaction that
 * brought the item into the location.
 */
@Data
public class ItemBreakdown {
    private final String itemName;
    private final String unit;
    private BigDecimal issuedQty = BigDecimal.ZERO;
    private BigDecimal receivedQty = BigDecimal.ZERO;
    private final Set<String> persons = new LinkedHashSet<>();

    public ItemBreakdown(String itemName, String unit) {
        this.itemName = itemName;
        this.unit = unit;
    }
}
