package com.ledgerengine.ledger;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.common.exception.ErrorKind;
import com.ledgerengine.common.exception.LedgerEngineException;
import com.ledgerengine.common.exception.UnrecognizedTypeException;
import com.ledgerengine.rules.RuleResult;
import com.ledgerengine.rules.RulesEngine;
import com.ledgerengine.transactions.Transaction;
import com.ledgerengine.transactions.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Applies input records to per-client accounts in arrival order.
 *
 * Processing flow for each record:
 * 1. Malformed rows are recorded as failed with their parse error
 * 2. Pre-dispatch rules reject deposits and withdrawals with invalid amounts
 * 3. The client's account is looked up, or created on first sight, and the record applied to it
 * 4. Any failure is recorded against the record and the run continues
 *
 * A record of an unrecognized type never creates an account; for a known client
 * it still goes to the account, so a locked account reports the lock first.
 */
@Service
@Slf4j
public class LedgerEngine {

    private final RulesEngine rulesEngine;
    private final boolean repeatDisputesAllowed;

    public LedgerEngine(RulesEngine rulesEngine,
                        @Value("${ledger-engine.disputes.allow-repeat:false}") boolean repeatDisputesAllowed) {
        this.rulesEngine = rulesEngine;
        this.repeatDisputesAllowed = repeatDisputesAllowed;
    }

    public Ledger run(Iterable<InputRecord> records) {
        Ledger ledger = new Ledger(repeatDisputesAllowed);
        long processed = 0;

        for (InputRecord record : records) {
            apply(ledger, record);
            processed++;
        }

        log.info("Processed {} records: {} accounts, {} failed",
            processed, ledger.getAccounts().size(), ledger.getFailedRecords().size());
        return ledger;
    }

    public void apply(Ledger ledger, InputRecord record) {
        if (record.isMalformed()) {
            fail(ledger, record, ErrorKind.PARSE_ERROR, record.getParseError());
            return;
        }

        Transaction transaction = record.getTransaction();

        RuleResult ruleResult = rulesEngine.evaluateRules(transaction);
        if (!ruleResult.isApproved()) {
            fail(ledger, record, ruleResult.getErrorKind(), ruleResult.getReason());
            return;
        }

        if (transaction.getType() == TransactionType.UNKNOWN
                && ledger.findAccount(transaction.getClient()).isEmpty()) {
            UnrecognizedTypeException e = new UnrecognizedTypeException(transaction.getRawType());
            fail(ledger, record, e.getErrorKind(), e.getMessage());
            return;
        }

        Account account = ledger.getOrCreateAccount(transaction.getClient());

        try {
            account.processTransaction(transaction);
        } catch (LedgerEngineException e) {
            fail(ledger, record, e.getErrorKind(), e.getMessage());
            return;
        }

        log.debug("Applied {} tx {} to client {}: available={}, held={}, total={}, locked={}",
            transaction.getRawType(), transaction.getTx(), account.getClient(),
            account.getAvailable(), account.getHeld(), account.getTotal(), account.isLocked());
    }

    private void fail(Ledger ledger, InputRecord record, ErrorKind errorKind, String reason) {
        ledger.recordFailure(FailedRecord.of(record, errorKind, reason));
        log.debug("Rejected record {} ({}): {}", record.getRecordNumber(), errorKind, reason);
    }
}
