package com.satyammall.inventoryservice.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One user-entered row of a batch. The quantity stays a string until validation so that
 * malformed input can be reported instead of silently coerced.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineItem {
    private int id;
    private String itemName;
    private String quantity;
    private String unit;

    public boolean isBlank() {
        return isEmpty(itemName) && isEmpty(quantity) && isEmpty(unit);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
