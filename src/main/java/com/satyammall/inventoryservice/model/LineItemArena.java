package com.satyammall.inventoryservice.model;

/**
 * Hands out line item keys for a single form. Keys only ever grow, so a reset form never
 * reuses the key of a row that was just submitted.
 */
public class LineItemArena {

    private int next = 1;

    public LineItem allocate() {
        return new LineItem(next++, "", "", "");
    }

    public LineItem allocate(String itemName, String quantity, String unit) {
        return new LineItem(next++, itemName, quantity, unit);
    }
}
