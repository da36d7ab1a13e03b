package com.satyammall.inventoryservice.dto.response;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Content of the detailed PDF for a single location.
 */
@Data
@Builder
public class LocationReportDocument {
    private String fileName;
    private String title;
    private String subtitle;
    private String generatedLine;
    private List<String> statLines;
    private String lastActivity;
    private TableSection items;
    private TableSection transactions;
    private String footerText;
}
