package com.satyammall.inventoryservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ReportStats {
    int totalRecords;
    int totalIssued;
    int totalReceived;
    BigDecimal issuedQty;
    BigDecimal receivedQty;
    int uniqueItems;
    int uniqueLocations;
}
