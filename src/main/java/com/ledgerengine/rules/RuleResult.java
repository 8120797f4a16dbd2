package com.ledgerengine.rules;

import com.ledgerengine.common.exception.ErrorKind;
import lombok.Value;

/**
 * Result of a rule evaluation.
 */
@Value
public class RuleResult {
    boolean approved;
    ErrorKind errorKind;
    String reason;

    public static RuleResult approve() {
        return new RuleResult(true, null, null);
    }

    public static RuleResult decline(ErrorKind errorKind, String reason) {
        return new RuleResult(false, errorKind, reason);
    }
}
