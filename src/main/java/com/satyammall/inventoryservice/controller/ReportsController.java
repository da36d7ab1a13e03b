package com.satyammall.inventoryservice.controller;

import com.satyammall.inventoryservice.dto.response.LocationReportDocument;
import com.satyammall.inventoryservice.dto.response.ReportDocument;
import com.satyammall.inventoryservice.dto.response.ReportResponse;
import com.satyammall.inventoryservice.model.ReportFilter;
import com.satyammall.inventoryservice.model.Transaction;
import com.satyammall.inventoryservice.service.CsvReportWriter;
import com.satyammall.inventoryservice.service.ExportProjectionService;
import com.satyammall.inventoryservice.service.ReportingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/inventory/reports")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Filtered transaction log, floor-wise summaries and exports")
public class ReportsController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ReportingService reportingService;
    private final ExportProjectionService exportProjectionService;
    private final CsvReportWriter csvReportWriter;

    @Operation(summary = "Filtered transaction log, newest first")
    @GetMapping("/transactions")
    public ResponseEntity<List<Transaction>> getTransactions(
            @RequestParam(defaultValue = ReportFilter.ALL) String type,
            @RequestParam(defaultValue = ReportFilter.ALL) String location,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        ReportFilter filter = ReportFilter.of(type, location, startDate, endDate);
        return ResponseEntity.ok(reportingService.generateReport(filter).getTransactions());
    }

    @Operation(summary = "Summary statistics and floor-wise breakdown for a filter")
    @GetMapping("/summary")
    public ResponseEntity<ReportResponse> getSummary(
            @RequestParam(defaultValue = ReportFilter.ALL) String type,
            @RequestParam(defaultValue = ReportFilter.ALL) String location,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        ReportFilter filter = ReportFilter.of(type, location, startDate, endDate);
        return ResponseEntity.ok(reportingService.generateReport(filter));
    }

    @Operation(summary = "Every location in the transaction log, for the location filter")
    @GetMapping("/locations")
    public ResponseEntity<List<String>> getLocations() {
        return ResponseEntity.ok(reportingService.getLocations());
    }

    @Operation(summary = "Filtered transaction log as a CSV download")
    @GetMapping("/export/csv")
    public ResponseEntity<String> exportCsv(
            @RequestParam(defaultValue = ReportFilter.ALL) String type,
            @RequestParam(defaultValue = ReportFilter.ALL) String location,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        ReportResponse report = reportingService.generateReport(ReportFilter.of(type, location, startDate, endDate));
        String csv = csvReportWriter.writeToString(exportProjectionService.csvRows(report.getTransactions()));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(exportProjectionService.csvFileName())
                        .build()
                        .toString())
                .contentType(TEXT_CSV)
                .body(csv);
    }

    @Operation(summary = "Sections of the full PDF report, for the PDF renderer")
    @GetMapping("/export/pdf")
    public ResponseEntity<ReportDocument> exportPdf(
            @RequestParam(defaultValue = ReportFilter.ALL) String type,
            @RequestParam(defaultValue = ReportFilter.ALL) String location,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String generatedBy) {
        ReportResponse report = reportingService.generateReport(ReportFilter.of(type, location, startDate, endDate));
        return ResponseEntity.ok(exportProjectionService.fullReport(report, generatedBy));
    }

    @Operation(summary = "Sections of the detailed PDF for one location")
    @GetMapping("/export/pdf/locations/{reportLocation}")
    public ResponseEntity<LocationReportDocument> exportLocationPdf(
            @PathVariable String reportLocation,
            @RequestParam(defaultValue = ReportFilter.ALL) String type,
            @RequestParam(defaultValue = ReportFilter.ALL) String location,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String generatedBy) {
        ReportResponse report = reportingService.generateReport(ReportFilter.of(type, location, startDate, endDate));
        return ResponseEntity.ok(exportProjectionService.locationReport(report, reportLocation, generatedBy));
    }
}
