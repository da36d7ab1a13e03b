package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.config.ReportSettings;
import com.satyammall.inventoryservice.dto.response.LocationReportDocument;
import com.satyammall.inventoryservice.dto.response.LocationSection;
import com.satyammall.inventoryservice.dto.response.ReportDocument;
import com.satyammall.inventoryservice.dto.response.ReportResponse;
import com.satyammall.inventoryservice.dto.response.TableSection;
import com.satyammall.inventoryservice.exception.ResourceNotFoundException;
import com.satyammall.inventoryservice.model.FloorSummary;
import com.satyammall.inventoryservice.model.ItemBreakdown;
import com.satyammall.inventoryservice.model.ReportFilter;
import com.satyammall.inventoryservice.model.ReportStats;
import com.satyammall.inventoryservice.model.Transaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.satyammall.inventoryservice.util.QuantityFormat.format;

/**
 * Shapes report data into CSV rows and PDF sections. Nothing here touches files or streams.
 */
@Service
@RequiredArgsConstructor
public class ExportProjectionService {

    public static final List<String> CSV_HEADERS = List.of(
            "Date", "Type", "Item Name", "Quantity", "Unit", "Location", "Person", "Notes", "File URL");

    private static final List<String> TRANSACTION_HEADERS = List.of(
            "Date", "Type", "Item", "Qty", "Unit", "Location", "Person", "Notes");
    private static final List<String> FLOOR_ITEM_HEADERS = List.of(
            "Item", "Issued", "Received", "Persons Involved");
    private static final List<String> LOCATION_ITEM_HEADERS = List.of(
            "Item Name", "Total Issued", "Total Received", "Unit", "Persons");
    private static final List<String> LOCATION_TRANSACTION_HEADERS = List.of(
            "Date", "Type", "Item", "Qty", "Person", "Notes");

    private final ReportSettings settings;
    private final Clock clock;

    // --- CSV ---

    public List<List<String>> csvRows(List<Transaction> transactions) {
        return transactions.stream()
                .map(t -> Arrays.asList(
                        formatDate(t.getDate()),
                        t.getType().getDisplayName(),
                        orEmpty(t.getItemName()),
                        format(t.getQuantity()),
                        orEmpty(t.getUnit()),
                        orEmpty(t.getLocation()),
                        orEmpty(t.getPersonName()),
                        orEmpty(t.getNotes()),
                        orEmpty(t.getFileUrl())))
                .collect(Collectors.toList());
    }

    public String csvFileName() {
        return "report_" + today() + ".csv";
    }

    // --- PDF, full report ---

    public ReportDocument fullReport(ReportResponse report, String generatedBy) {
        String user = userOrDefault(generatedBy);
        ReportStats stats = report.getStats();

        List<String> summary = List.of(
                "Total Records: " + report.getTransactions().size(),
                "Issued: " + stats.getTotalIssued() + " (" + format(stats.getIssuedQty()) + " units)",
                "Received: " + stats.getTotalReceived() + " (" + format(stats.getReceivedQty()) + " units)",
                "Items: " + stats.getUniqueItems() + "  |  Locations: " + stats.getUniqueLocations());

        List<List<String>> transactionRows = report.getTransactions().stream()
                .map(t -> List.of(
                        formatDate(t.getDate()),
                        t.getType().getDisplayName(),
                        orEmpty(t.getItemName()),
                        format(t.getQuantity()),
                        orEmpty(t.getUnit()),
                        orEmpty(t.getLocation()),
                        orEmpty(t.getPersonName()),
                        orEmpty(t.getNotes())))
                .collect(Collectors.toList());

        List<LocationSection> locations = report.getFloorSummaries().stream()
                .map(floor -> LocationSection.builder()
                        .location(floor.getLocation())
                        .summaryLine("Issued: " + floor.getIssuedCount() + " txn (" + format(floor.getIssuedQty()) + " units)"
                                + "  |  Received: " + floor.getReceivedCount() + " txn (" + format(floor.getReceivedQty()) + " units)"
                                + "  |  Last: " + formatDate(floor.getLastActivity()))
                        .items(new TableSection(null, FLOOR_ITEM_HEADERS, floor.itemList().stream()
                                .map(item -> List.of(
                                        orEmpty(item.getItemName()),
                                        quantityWithUnit(item.getIssuedQty(), item.getUnit()),
                                        quantityWithUnit(item.getReceivedQty(), item.getUnit()),
                                        persons(item)))
                                .collect(Collectors.toList())))
                        .build())
                .collect(Collectors.toList());

        return ReportDocument.builder()
                .fileName("satyam_mall_report_" + today() + ".pdf")
                .title(settings.getTitle())
                .subtitle("Inventory Management Report")
                .generatedLine(generatedLine(user))
                .filterText(filterText(report.getFilter()))
                .summaryLines(summary)
                .transactions(new TableSection("Transaction Details", TRANSACTION_HEADERS, transactionRows))
                .locationSectionTitle(locations.isEmpty() ? null : "Floor-wise / Location Summary")
                .locations(locations)
                .footerText(settings.getTitle() + " Inventory System  |  Report by: " + user)
                .build();
    }

    // --- PDF, single location ---

    public LocationReportDocument locationReport(ReportResponse report, String location, String generatedBy) {
        FloorSummary floor = report.getFloorSummaries().stream()
                .filter(f -> Objects.equals(f.getLocation(), location))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("No transactions for location '" + location + "' in this report."));
        String user = userOrDefault(generatedBy);

        List<List<String>> itemRows = floor.itemList().stream()
                .map(item -> List.of(
                        orEmpty(item.getItemName()),
                        quantityWithUnit(item.getIssuedQty(), item.getUnit()),
                        quantityWithUnit(item.getReceivedQty(), item.getUnit()),
                        item.getUnit(),
                        persons(item)))
                .collect(Collectors.toList());

        List<List<String>> transactionRows = report.getTransactions().stream()
                .filter(t -> Objects.equals(t.getLocation(), location))
                .map(t -> List.of(
                        formatDate(t.getDate()),
                        t.getType().getDisplayName(),
                        orEmpty(t.getItemName()),
                        (format(t.getQuantity()) + " " + orEmpty(t.getUnit())).trim(),
                        orEmpty(t.getPersonName()),
                        t.getNotes() == null || t.getNotes().isEmpty() ? "-" : t.getNotes()))
                .collect(Collectors.toList());

        return LocationReportDocument.builder()
                .fileName(locationFileName(location))
                .title(location)
                .subtitle("Detailed Location Report")
                .generatedLine(generatedLine(user))
                .statLines(List.of(
                        "Total Issued: " + floor.getIssuedCount() + " transactions (" + format(floor.getIssuedQty()) + " units)",
                        "Total Received: " + floor.getReceivedCount() + " transactions (" + format(floor.getReceivedQty()) + " units)"))
                .lastActivity("Last Activity: " + formatDate(floor.getLastActivity()))
                .items(new TableSection("Item-wise Breakdown", LOCATION_ITEM_HEADERS, itemRows))
                .transactions(new TableSection("All Transactions", LOCATION_TRANSACTION_HEADERS, transactionRows))
                .footerText(settings.getTitle() + "  |  " + location + " Report  |  By: " + user)
                .build();
    }

    public String locationFileName(String location) {
        return location.replaceAll("\\s+", "_") + "_report_" + today() + ".pdf";
    }

    /**
     * e.g. {@code Filter: Issue | Location: Floor 1 | From: 2024-01-01 | To: 2024-01-31}
     */
    public String filterText(ReportFilter filter) {
        StringBuilder text = new StringBuilder("Filter: ").append(filter.typeLabel());
        if (!filter.matchesAllLocations()) {
            text.append(" | Location: ").append(filter.getLocation());
        }
        if (filter.getStartDate() != null) {
            text.append(" | From: ").append(filter.getStartDate());
        }
        if (filter.getEndDate() != null) {
            text.append(" | To: ").append(filter.getEndDate());
        }
        return text.toString();
    }

    private String generatedLine(String user) {
        return "Generated: " + settings.getDateTimeFormatter().format(clock.instant().atZone(settings.getZoneId()))
                + "  |  By: " + user;
    }

    private String userOrDefault(String generatedBy) {
        return generatedBy == null || generatedBy.isBlank() ? settings.getDefaultGeneratedBy() : generatedBy;
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(settings.getZoneId()));
    }

    private String formatDate(Instant date) {
        if (date == null) {
            return "";
        }
        return settings.getDateFormatter().format(date.atZone(settings.getZoneId()));
    }

    private static String quantityWithUnit(BigDecimal quantity, String unit) {
        return quantity.signum() > 0 ? format(quantity) + " " + unit : "-";
    }

    private static String persons(ItemBreakdown item) {
        return item.getPersons().stream()
                .map(p -> p == null ? "" : p)
                .collect(Collectors.joining(", "));
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
