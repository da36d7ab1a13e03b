package com.satyammall.inventoryservice.dto.response;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Content of the full PDF report, already shaped for a renderer.
 */
@Data
@Builder
public class ReportDocument {
    private String fileName;
    private String title;
    private String subtitle;
    private String generatedLine;
    private String filterText;
    private List<String> summaryLines;
    private TableSection transactions;
    private String locationSectionTitle;
    private List<LocationSection> locations;
    /** Renderer appends the page counter. */
    private String footerText;
}
