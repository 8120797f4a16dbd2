package com.ledgerengine.cli;

import com.ledgerengine.ledger.LedgerRunSummary;
import com.ledgerengine.processor.LedgerFileProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry: {@code ledger-engine <transactions.csv>}.
 *
 * The input name is resolved against the input directory; the accounts and
 * failed-record files are written to the output directory.
 */
@Component
@ConditionalOnProperty(name = "ledger-engine.runner.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LedgerEngineRunner implements ApplicationRunner {

    private final LedgerFileProcessor fileProcessor;
    private final Path inputDirectory;
    private final Path outputDirectory;
    private final String accountsFile;
    private final String failedFile;

    public LedgerEngineRunner(
            LedgerFileProcessor fileProcessor,
            @Value("${ledger-engine.input-directory:./csvFiles}") String inputDirectory,
            @Value("${ledger-engine.output-directory:./csvFiles}") String outputDirectory,
            @Value("${ledger-engine.output.accounts-file:accounts.csv}") String accountsFile,
            @Value("${ledger-engine.output.failed-file:failed.csv}") String failedFile) {
        this.fileProcessor = fileProcessor;
        this.inputDirectory = Paths.get(inputDirectory);
        this.outputDirectory = Paths.get(outputDirectory);
        this.accountsFile = accountsFile;
        this.failedFile = failedFile;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> arguments = args.getNonOptionArgs();
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("Usage: ledger-engine <transactions-file>");
        }

        Path input = inputDirectory.resolve(arguments.get(0));
        LedgerRunSummary summary = fileProcessor.process(
            input,
            outputDirectory.resolve(accountsFile),
            outputDirectory.resolve(failedFile)
        );

        log.info("Transaction processing complete: {} accounts, {} failed records",
            summary.getAccountCount(), summary.getFailedRecordCount());
    }
}
