package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.TestData;
import com.satyammall.inventoryservice.model.OperationKind;
import com.satyammall.inventoryservice.model.Transaction;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.List;

import static com.satyammall.inventoryservice.TestData.txn;
import static org.assertj.core.api.Assertions.assertThat;

class CsvReportWriterTest {

    private final CsvReportWriter writer = new CsvReportWriter();
    private final ExportProjectionService projection = new ExportProjectionService(TestData.settings(), TestData.CLOCK);

    @Test
    void writesHeaderThenPlainRows() {
        String csv = writer.writeToString(List.of(
                List.of("10/3/2024", "Issue", "Soap", "2", "pcs", "Floor 1", "Ravi", "", ""),
                List.of("11/3/2024", "Receive", "Paint", "12.5", "L", "Floor 2", "Asha", "invoice 42", "https://files/x")));

        assertThat(csv.split("\n")).containsExactly(
                "Date,Type,Item Name,Quantity,Unit,Location,Person,Notes,File URL",
                "10/3/2024,Issue,Soap,2,pcs,Floor 1,Ravi,,",
                "11/3/2024,Receive,Paint,12.5,L,Floor 2,Asha,invoice 42,https://files/x");
    }

    @Test
    void quotesAndCommasInValuesReadBackAsOneRecordEach() throws IOException {
        Transaction pipe = txn(OperationKind.ISSUE, "12\" Pipe", "3", "pcs", "Floor 1, Wing A", "Ravi", "2024-03-10T10:00");
        Transaction tape = txn(OperationKind.RECEIVE, "Tape", "7.5", "m", "Floor 2", "Asha, Stores", "2024-03-11T10:00");
        tape.setNotes("said \"urgent\"\nsecond line");

        String csv = writer.writeToString(projection.csvRows(List.of(pipe, tape)));

        CSVFormat readBack = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (CSVParser parser = readBack.parse(new StringReader(csv))) {
            List<CSVRecord> records = parser.getRecords();

            assertThat(records).hasSize(2);
            assertThat(records.get(0).get("Item Name")).isEqualTo("12\" Pipe");
            assertThat(records.get(0).get("Location")).isEqualTo("Floor 1, Wing A");
            assertThat(new BigDecimal(records.get(0).get("Quantity"))).isEqualByComparingTo("3");
            assertThat(records.get(1).get("Person")).isEqualTo("Asha, Stores");
            assertThat(records.get(1).get("Notes")).isEqualTo("said \"urgent\"\nsecond line");
            assertThat(new BigDecimal(records.get(1).get("Quantity"))).isEqualByComparingTo("7.5");
        }
    }

    @Test
    void emptyExportIsJustTheHeader() {
        assertThat(writer.writeToString(List.of()))
                .isEqualTo("Date,Type,Item Name,Quantity,Unit,Location,Person,Notes,File URL\n");
    }
}
