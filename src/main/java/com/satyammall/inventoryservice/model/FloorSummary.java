package com.satyammall.inventoryservice.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of the filtered transactions at one location. Recomputed for every report.
 */
@Data
public class FloorSummary {
    private final String location;
    private int issuedCount;
    private int receivedCount;
    private BigDecimal issuedQty = BigDecimal.ZERO;
    private BigDecimal receivedQty = BigDecimal.ZERO;
    private Instant lastActivity;
    private final Map<String, ItemBreakdown> items = new LinkedHashMap<>();

    public FloorSummary(String location) {
        this.location = location;
    }

    public int getTotalCount() {
        return issuedCount + receivedCount;
    }

    public List<ItemBreakdown> itemList() {
        return new ArrayList<>(items.values());
    }
}
