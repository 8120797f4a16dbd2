package com.ledgerengine.ledger;

import com.ledgerengine.transactions.Transaction;
import lombok.Value;

import java.util.List;

/**
 * One row of input as handed to the engine: the raw field values plus either
 * the parsed transaction or the reason the row could not be parsed.
 */
@Value
public class InputRecord {

    /**
     * 1-based position among the data rows of the source, or 0 when the record did not come from a file.
     */
    long recordNumber;

    List<String> fields;

    Transaction transaction;

    String parseError;

    public static InputRecord parsed(long recordNumber, List<String> fields, Transaction transaction) {
        return new InputRecord(recordNumber, List.copyOf(fields), transaction, null);
    }

    public static InputRecord malformed(long recordNumber, List<String> fields, String parseError) {
        return new InputRecord(recordNumber, List.copyOf(fields), null, parseError);
    }

    /**
     * Wrap an already typed transaction, rendering its fields the way they would appear in a file.
     */
    public static InputRecord of(Transaction transaction) {
        List<String> fields = List.of(
            transaction.getRawType() == null ? "" : transaction.getRawType(),
            String.valueOf(transaction.getClient()),
            String.valueOf(transaction.getTx()),
            transaction.hasAmount() ? transaction.getAmount().toString() : ""
        );
        return new InputRecord(0, fields, transaction, null);
    }

    public boolean isMalformed() {
        return transaction == null;
    }
}
