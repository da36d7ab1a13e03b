package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.config.ReportSettings;
import com.satyammall.inventoryservice.dto.response.ReportResponse;
import com.satyammall.inventoryservice.model.FloorSummary;
import com.satyammall.inventoryservice.model.ItemBreakdown;
import com.satyammall.inventoryservice.model.OperationKind;
import com.satyammall.inventoryservice.model.ReportFilter;
import com.satyammall.inventoryservice.model.ReportStats;
import com.satyammall.inventoryservice.model.Transaction;
import com.satyammall.inventoryservice.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReportingService {

    private final TransactionRepository transactionRepository;
    private final TransactionFilter transactionFilter;
    private final ReportSettings settings;

    /**
     * Generates the report for one filter.
     * WARNING: This reads the whole transaction log on every call.
     */
    public ReportResponse generateReport(ReportFilter filter) {
        List<Transaction> all = transactionRepository.findAll();
        List<Transaction> filtered = transactionFilter.apply(all, filter);
        log.debug("Report filter {} matched {} of {} transactions", filter, filtered.size(), all.size());

        return ReportResponse.builder()
                .filter(filter)
                .transactions(filtered)
                .stats(computeStats(filtered))
                .floorSummaries(summarizeByLocation(filtered))
                .build();
    }

    public List<String> getLocations() {
        return transactionFilter.locations(transactionRepository.findAll());
    }

    public ReportStats computeStats(List<Transaction> transactions) {
        int issued = 0;
        int received = 0;
        BigDecimal issuedQty = BigDecimal.ZERO;
        BigDecimal receivedQty = BigDecimal.ZERO;
        for (Transaction t : transactions) {
            if (t.getType() == OperationKind.ISSUE) {
                issued++;
                issuedQty = issuedQty.add(quantityOf(t));
            } else {
                received++;
                receivedQty = receivedQty.add(quantityOf(t));
            }
        }
        return ReportStats.builder()
                .totalRecords(transactions.size())
                .totalIssued(issued)
                .totalReceived(received)
                .issuedQty(issuedQty)
                .receivedQty(receivedQty)
                .uniqueItems((int) transactions.stream().map(Transaction::getItemName).distinct().count())
                .uniqueLocations((int) transactions.stream().map(Transaction::getLocation).distinct().count())
                .build();
    }

    /**
     * Groups transactions by location. Locations are ordered by their total transaction count,
     * busiest first; equal counts keep the order in which the locations were first seen.
     * <p>
     * An item's unit is taken from the first transaction that introduces it at a location.
     * Later transactions with a different unit are still summed into the same totals.
     */
    public List<FloorSummary> summarizeByLocation(List<Transaction> transactions) {
        Map<String, FloorSummary> byLocation = new LinkedHashMap<>();

        for (Transaction t : transactions) {
            FloorSummary floor = byLocation.computeIfAbsent(t.getLocation(), FloorSummary::new);
            BigDecimal quantity = quantityOf(t);
            boolean issue = t.getType() == OperationKind.ISSUE;

            if (issue) {
                floor.setIssuedCount(floor.getIssuedCount() + 1);
                floor.setIssuedQty(floor.getIssuedQty().add(quantity));
            } else {
                floor.setReceivedCount(floor.getReceivedCount() + 1);
                floor.setReceivedQty(floor.getReceivedQty().add(quantity));
            }

            ItemBreakdown item = floor.getItems()
                    .computeIfAbsent(t.getItemName(), name -> new ItemBreakdown(name, unitOrDefault(t.getUnit())));
            if (issue) {
                item.setIssuedQty(item.getIssuedQty().add(quantity));
            } else {
                item.setReceivedQty(item.getReceivedQty().add(quantity));
            }
            item.getPersons().add(t.getPersonName());

            if (floor.getLastActivity() == null
                    || (t.getDate() != null && t.getDate().isAfter(floor.getLastActivity()))) {
                floor.setLastActivity(t.getDate());
            }
        }

        List<FloorSummary> summaries = new ArrayList<>(byLocation.values());
        // List.sort is stable
        summaries.sort(Comparator.comparingInt(FloorSummary::getTotalCount).reversed());
        return summaries;
    }

    private String unitOrDefault(String unit) {
        return unit == null || unit.isEmpty() ? settings.getDefaultUnit() : unit;
    }

    private static BigDecimal quantityOf(Transaction t) {
        return Objects.requireNonNullElse(t.getQuantity(), BigDecimal.ZERO);
    }
}
