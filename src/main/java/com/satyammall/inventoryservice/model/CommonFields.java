package com.satyammall.inventoryservice.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields shared by every line of a batch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonFields {
    private String location = "";
    private String personName = "";
    private String notes = "";

    public static CommonFields blank() {
        return new CommonFields("", "", "");
    }
}
