package com.ledgerengine.processor;

import com.ledgerengine.common.exception.LedgerIOException;
import com.ledgerengine.io.AccountCsvWriter;
import com.ledgerengine.io.FailedRecordCsvWriter;
import com.ledgerengine.io.TransactionCsvReader;
import com.ledgerengine.ledger.InputRecord;
import com.ledgerengine.ledger.Ledger;
import com.ledgerengine.ledger.LedgerEngine;
import com.ledgerengine.ledger.LedgerRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Runs the ledger over one transaction file and exports the results.
 *
 * Flow:
 * 1. Stream the input rows through the ledger engine in file order
 * 2. Write the final accounts, ordered by client id
 * 3. Write the failed records, in input order
 *
 * Per-record failures never stop the run; failing to read the input or to
 * write either output does, with a {@link LedgerIOException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerFileProcessor {

    private final TransactionCsvReader transactionReader;
    private final LedgerEngine ledgerEngine;
    private final AccountCsvWriter accountWriter;
    private final FailedRecordCsvWriter failedRecordWriter;

    public LedgerRunSummary process(Path input, Path accountsOutput, Path failedOutput) {
        log.info("Processing transactions from {}", input);

        Ledger ledger = runLedger(input);

        accountWriter.write(accountsOutput, ledger.getAccounts());
        failedRecordWriter.write(failedOutput, ledger.getFailedRecords());

        LedgerRunSummary summary = ledger.summarize();
        log.info("A total of {} accounts were found ({} locked)",
            summary.getAccountCount(), summary.getLockedAccountCount());
        log.info("A total of {} transactions have failed: {}",
            summary.getFailedRecordCount(), summary.getFailuresByKind());
        return summary;
    }

    private Ledger runLedger(Path input) {
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             Stream<InputRecord> records = transactionReader.read(reader)) {
            return ledgerEngine.run(records::iterator);
        } catch (IOException | UncheckedIOException e) {
            throw new LedgerIOException("Failed to read transactions from " + input, e);
        }
    }
}
