package com.ledgerengine.io;

import com.ledgerengine.common.exception.LedgerIOException;
import com.ledgerengine.ledger.FailedRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes failed records as their original fields followed by the failure reason.
 *
 * Short rows are padded with empty values so the reason always lands in the
 * {@code reason} column; extra fields of long rows are kept before it.
 */
@Component
@Slf4j
public class FailedRecordCsvWriter {

    static final String[] HEADER = {"type", "client", "tx", "amount", "reason"};

    private static final int INPUT_COLUMNS = HEADER.length - 1;

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(HEADER)
        .setRecordSeparator('\n')
        .build();

    public void write(Path path, List<FailedRecord> failedRecords) {
        try (BufferedWriter writer = CsvFiles.newWriter(path)) {
            write(writer, failedRecords);
        } catch (IOException e) {
            throw new LedgerIOException("Failed to write failed records to " + path, e);
        }
        log.info("Wrote {} failed records to {}", failedRecords.size(), path);
    }

    public void write(Appendable out, List<FailedRecord> failedRecords) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        for (FailedRecord failedRecord : failedRecords) {
            List<String> row = new ArrayList<>(failedRecord.getFields());
            while (row.size() < INPUT_COLUMNS) {
                row.add("");
            }
            row.add(failedRecord.getReason());
            printer.printRecord(row);
        }
        printer.flush();
    }
}
