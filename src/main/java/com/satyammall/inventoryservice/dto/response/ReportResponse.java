package com.satyammall.inventoryservice.dto.response;

import com.satyammall.inventoryservice.model.FloorSummary;
import com.satyammall.inventoryservice.model.ReportFilter;
import com.satyammall.inventoryservice.model.ReportStats;
import com.satyammall.inventoryservice.model.Transaction;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Everything the reports screen shows for one filter: the matching transactions, newest
 * first, and the figures derived from them.
 */
@Data
@Builder
public class ReportResponse {
    private ReportFilter filter;
    private List<Transaction> transactions;
    private ReportStats stats;
    private List<FloorSummary> floorSummaries;
}
