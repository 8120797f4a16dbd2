package com.ledgerengine.ledger;

import com.ledgerengine.common.exception.ErrorKind;
import lombok.Value;

import java.util.List;

/**
 * An input row that could not be applied, kept with its original fields
 * and the reason it failed. Failed records never change account state.
 */
@Value
public class FailedRecord {
    long recordNumber;
    List<String> fields;
    ErrorKind errorKind;
    String reason;

    public static FailedRecord of(InputRecord record, ErrorKind errorKind, String reason) {
        return new FailedRecord(record.getRecordNumber(), record.getFields(), errorKind, reason);
    }
}
