package com.ledgerengine.io;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.common.exception.LedgerIOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Writes final account states as {@code client,available,held,total,locked},
 * with the monetary columns at exactly four decimal digits.
 */
@Component
@Slf4j
public class AccountCsvWriter {

    static final String[] HEADER = {"client", "available", "held", "total", "locked"};

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(HEADER)
        .setRecordSeparator('\n')
        .build();

    public void write(Path path, Collection<Account> accounts) {
        try (BufferedWriter writer = CsvFiles.newWriter(path)) {
            write(writer, accounts);
        } catch (IOException e) {
            throw new LedgerIOException("Failed to write accounts to " + path, e);
        }
        log.info("Wrote {} accounts to {}", accounts.size(), path);
    }

    public void write(Appendable out, Collection<Account> accounts) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        for (Account account : accounts) {
            printer.printRecord(
                account.getClient(),
                account.getAvailable(),
                account.getHeld(),
                account.getTotal(),
                account.isLocked()
            );
        }
        printer.flush();
    }
}
