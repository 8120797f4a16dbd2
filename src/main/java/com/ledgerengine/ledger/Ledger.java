package com.ledgerengine.ledger;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.common.exception.ErrorKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * State of a single run: the accounts by client id and the records that failed,
 * in the order they were encountered. Owned by the run that created it.
 */
public class Ledger {

    private final NavigableMap<Integer, Account> accounts = new TreeMap<>();

    private final List<FailedRecord> failedRecords = new ArrayList<>();

    private final boolean repeatDisputesAllowed;

    public Ledger() {
        this(false);
    }

    /**
     * @param repeatDisputesAllowed passed on to every account this ledger creates
     */
    public Ledger(boolean repeatDisputesAllowed) {
        this.repeatDisputesAllowed = repeatDisputesAllowed;
    }

    public Optional<Account> findAccount(int client) {
        return Optional.ofNullable(accounts.get(client));
    }

    /**
     * New accounts start with zero balances, unlocked, with no history.
     */
    Account getOrCreateAccount(int client) {
        return accounts.computeIfAbsent(client, id -> new Account(id, repeatDisputesAllowed));
    }

    void recordFailure(FailedRecord failedRecord) {
        failedRecords.add(failedRecord);
    }

    /**
     * Accounts in ascending client id order.
     */
    public Collection<Account> getAccounts() {
        return Collections.unmodifiableCollection(accounts.values());
    }

    public List<FailedRecord> getFailedRecords() {
        return Collections.unmodifiableList(failedRecords);
    }

    public LedgerRunSummary summarize() {
        Map<ErrorKind, Long> failuresByKind = new EnumMap<>(ErrorKind.class);
        for (FailedRecord failedRecord : failedRecords) {
            failuresByKind.merge(failedRecord.getErrorKind(), 1L, Long::sum);
        }

        int locked = (int) accounts.values().stream().filter(Account::isLocked).count();

        return LedgerRunSummary.builder()
            .accountCount(accounts.size())
            .lockedAccountCount(locked)
            .failedRecordCount(failedRecords.size())
            .failuresByKind(Collections.unmodifiableMap(failuresByKind))
            .build();
    }
}
