package com.satyammall.inventoryservice.dto.response;

import lombok.Builder;
import lombok.Data;

/**
 * One location block of the full report: a summary line and the item breakdown.
 */
@Data
@Builder
public class LocationSection {
    private String location;
    private String summaryLine;
    private TableSection items;
}
