package com.ledgerengine.ledger;

import com.ledgerengine.common.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Counts reported at the end of a run.
 */
@Value
@Builder
public class LedgerRunSummary {
    int accountCount;
    int lockedAccountCount;
    int failedRecordCount;
    Map<ErrorKind, Long> failuresByKind;

    public long getFailureCount(ErrorKind errorKind) {
        return failuresByKind.getOrDefault(errorKind, 0L);
    }
}
