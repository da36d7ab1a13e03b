package com.satyammall.inventoryservice.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields are checked by the stock validator, not by bean validation, so that a batch with a
 * blank row gets the same message as the form shows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineItemRequest {
    private String itemName;
    private String quantity;
    private String unit;
}
