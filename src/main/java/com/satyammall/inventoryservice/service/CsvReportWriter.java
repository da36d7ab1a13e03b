package com.satyammall.inventoryservice.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

/**
 * Writes projected CSV rows. Cells holding a delimiter, quote or line break are quoted and
 * embedded quotes doubled, so every transaction reads back as exactly one record.
 */
@Component
public class CsvReportWriter {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(ExportProjectionService.CSV_HEADERS.toArray(new String[0]))
            .setQuoteMode(QuoteMode.MINIMAL)
            .setRecordSeparator("\n")
            .build();

    public void write(List<List<String>> rows, Writer out) throws IOException {
        try (CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }

    public String writeToString(List<List<String>> rows) {
        StringWriter out = new StringWriter();
        try {
            write(rows, out);
        } catch (IOException e) {
            throw new IllegalStateException("Could not write CSV", e);
        }
        return out.toString();
    }
}
