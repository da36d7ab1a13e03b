package com.satyammall.inventoryservice.controller;

import com.satyammall.inventoryservice.TestData;
import com.satyammall.inventoryservice.exception.GlobalExceptionHandler;
import com.satyammall.inventoryservice.repository.TransactionRepository;
import com.satyammall.inventoryservice.service.CsvReportWriter;
import com.satyammall.inventoryservice.service.ExportProjectionService;
import com.satyammall.inventoryservice.service.ReportingService;
import com.satyammall.inventoryservice.service.TransactionFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static com.satyammall.inventoryservice.TestData.issue;
import static com.satyammall.inventoryservice.TestData.receive;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ReportsControllerTest {

    @Mock
    private TransactionRepository transactionRepository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ReportingService reporting = new ReportingService(transactionRepository,
                new TransactionFilter(TestData.settings()), TestData.settings());
        ExportProjectionService projection = new ExportProjectionService(TestData.settings(), TestData.CLOCK);
        mockMvc = MockMvcBuilders.standaloneSetup(new ReportsController(reporting, projection, new CsvReportWriter()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void summaryAppliesTheQueryFilter() throws Exception {
        when(transactionRepository.findAll()).thenReturn(List.of(
                issue("Soap", "2", "Floor 1", "2024-03-10T10:00"),
                receive("Soap", "10", "Floor 1", "2024-03-12T10:00"),
                issue("Towel", "3", "Floor 2", "2024-03-15T10:00")));

        mockMvc.perform(get("/api/inventory/reports/summary")
                        .param("type", "Issue")
                        .param("endDate", "2024-03-12"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactions", hasSize(1)))
                .andExpect(jsonPath("$.stats.totalIssued").value(1))
                .andExpect(jsonPath("$.floorSummaries[0].location").value("Floor 1"));
    }

    @Test
    void locationsAreListedForTheFilterChoices() throws Exception {
        when(transactionRepository.findAll()).thenReturn(List.of(
                issue("Soap", "2", "Parking", "2024-03-10T10:00"),
                issue("Soap", "2", "Floor 1", "2024-03-10T10:00")));

        mockMvc.perform(get("/api/inventory/reports/locations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("Floor 1"))
                .andExpect(jsonPath("$[1]").value("Parking"));
    }

    @Test
    void csvExportIsADownload() throws Exception {
        when(transactionRepository.findAll()).thenReturn(List.of(issue("Soap", "2", "Floor 1", "2024-03-10T10:00")));

        mockMvc.perform(get("/api/inventory/reports/export/csv"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("report_2024-05-01.csv")))
                .andExpect(content().string(containsString("10/3/2024,Issue,Soap,2,pcs,Floor 1,Ravi,,")));
    }

    @Test
    void pdfSectionsUseTheRequester() throws Exception {
        when(transactionRepository.findAll()).thenReturn(List.of(issue("Soap", "2", "Floor 1", "2024-03-10T10:00")));

        mockMvc.perform(get("/api/inventory/reports/export/pdf").param("generatedBy", "Asha"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fileName").value("satyam_mall_report_2024-05-01.pdf"))
                .andExpect(jsonPath("$.footerText").value("Satyam Mall Inventory System  |  Report by: Asha"));
    }

    @Test
    void locationPdfForAnAbsentLocationIsNotFound() throws Exception {
        when(transactionRepository.findAll()).thenReturn(List.of(issue("Soap", "2", "Floor 1", "2024-03-10T10:00")));

        mockMvc.perform(get("/api/inventory/reports/export/pdf/locations/{location}", "Roof"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unknownTypeIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/inventory/reports/summary").param("type", "Transfer"))
                .andExpect(status().isBadRequest());
    }
}
