package com.ledgerengine.accounts;

import com.ledgerengine.common.Money;
import com.ledgerengine.common.exception.AccountLockedException;
import com.ledgerengine.common.exception.AlreadyDisputedException;
import com.ledgerengine.common.exception.InsufficientFundsException;
import com.ledgerengine.common.exception.InvalidAmountException;
import com.ledgerengine.common.exception.NotDisputedException;
import com.ledgerengine.common.exception.UnknownTransactionException;
import com.ledgerengine.common.exception.UnrecognizedTypeException;
import com.ledgerengine.transactions.Transaction;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One client's balances and the monetary transactions applied to it.
 *
 * Funds move between two buckets:
 * - available: usable for withdrawal
 * - held: frozen while a transaction is under dispute
 *
 * {@code total} always equals {@code available + held}. Every operation either
 * succeeds completely or throws before touching any state. Once a chargeback
 * locks the account, every further transaction is rejected.
 */
@Getter
@ToString(exclude = "transactions")
public class Account {

    private final int client;

    private Money available = Money.zero();

    private Money held = Money.zero();

    private Money total = Money.zero();

    private boolean locked;

    /**
     * Deposits and withdrawals by transaction id, kept sorted.
     */
    @Getter(AccessLevel.NONE)
    private final NavigableMap<Long, StoredTransaction> transactions = new TreeMap<>();

    @Getter(AccessLevel.NONE)
    private final boolean repeatDisputesAllowed;

    public Account(int client) {
        this(client, false);
    }

    /**
     * @param repeatDisputesAllowed when true, disputing an already disputed
     *                              transaction moves its amount to held again
     *                              instead of failing
     */
    public Account(int client, boolean repeatDisputesAllowed) {
        this.client = client;
        this.repeatDisputesAllowed = repeatDisputesAllowed;
    }

    public void deposit(Money amount) {
        if (amount.isNegative()) {
            throw new InvalidAmountException("Deposit amount cannot be negative: " + amount);
        }
        available = available.add(amount);
        total = total.add(amount);
    }

    /**
     * Sufficiency is checked against the total balance, so held funds
     * still count towards a withdrawal.
     */
    public void withdraw(Money amount) {
        if (amount.isGreaterThan(total)) {
            throw new InsufficientFundsException(client, amount, total);
        }
        available = available.subtract(amount);
        total = total.subtract(amount);
    }

    public void dispute(long tx) {
        StoredTransaction original = findOrThrow(tx, "dispute");
        if (original.isDisputed() && !repeatDisputesAllowed) {
            throw new AlreadyDisputedException(client, tx);
        }
        available = available.subtract(original.getAmount());
        held = held.add(original.getAmount());
        original.markDisputed();
    }

    public void resolve(long tx) {
        StoredTransaction original = findDisputedOrThrow(tx, "resolve");
        available = available.add(original.getAmount());
        held = held.subtract(original.getAmount());
        original.clearDisputed();
    }

    public void chargeBack(long tx) {
        StoredTransaction original = findDisputedOrThrow(tx, "charge back");
        held = held.subtract(original.getAmount());
        total = total.subtract(original.getAmount());
        locked = true;
        original.clearDisputed();
    }

    /**
     * Apply one input record to this account.
     *
     * Deposits are stored even when they reuse an id (the later one wins);
     * withdrawals are stored only once the funds check passed.
     *
     * @throws AccountLockedException if a chargeback already locked the account
     * @throws UnrecognizedTypeException for records of an unknown type
     */
    public void processTransaction(Transaction transaction) {
        if (locked) {
            throw new AccountLockedException(client);
        }

        switch (transaction.getType()) {
            case DEPOSIT:
                deposit(requireAmount(transaction));
                store(transaction);
                break;
            case WITHDRAWAL:
                withdraw(requireAmount(transaction));
                store(transaction);
                break;
            case DISPUTE:
                dispute(transaction.getTx());
                break;
            case RESOLVE:
                resolve(transaction.getTx());
                break;
            case CHARGEBACK:
                chargeBack(transaction.getTx());
                break;
            default:
                throw new UnrecognizedTypeException(transaction.getRawType());
        }
    }

    public Optional<StoredTransaction> getStoredTransaction(long tx) {
        return Optional.ofNullable(transactions.get(tx));
    }

    public NavigableMap<Long, StoredTransaction> getTransactions() {
        return Collections.unmodifiableNavigableMap(transactions);
    }

    public boolean hasOpenDisputes() {
        return transactions.values().stream().anyMatch(StoredTransaction::isDisputed);
    }

    private Money requireAmount(Transaction transaction) {
        if (!transaction.hasAmount()) {
            throw new InvalidAmountException(
                "Transaction " + transaction.getTx() + " of type " + transaction.getRawType() + " has no amount");
        }
        return transaction.getAmount();
    }

    private void store(Transaction transaction) {
        transactions.put(transaction.getTx(), new StoredTransaction(transaction));
    }

    private StoredTransaction findOrThrow(long tx, String operation) {
        StoredTransaction original = transactions.get(tx);
        if (original == null) {
            throw new UnknownTransactionException(client, tx, operation);
        }
        return original;
    }

    private StoredTransaction findDisputedOrThrow(long tx, String operation) {
        StoredTransaction original = findOrThrow(tx, operation);
        if (!original.isDisputed()) {
            throw new NotDisputedException(client, tx, operation);
        }
        return original;
    }
}
