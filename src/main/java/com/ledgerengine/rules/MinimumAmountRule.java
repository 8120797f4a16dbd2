package com.ledgerengine.rules;

import com.ledgerengine.common.Money;
import com.ledgerengine.common.exception.ErrorKind;
import com.ledgerengine.transactions.Transaction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Rule that requires deposits and withdrawals to carry an amount strictly
 * above the configured minimum (zero by default).
 */
@Component
public class MinimumAmountRule implements Rule {

    private final Money minimumAmount;

    public MinimumAmountRule(@Value("${ledger-engine.rules.minimum-amount:0}") BigDecimal minimumAmount) {
        this.minimumAmount = Money.of(minimumAmount);
    }

    @Override
    public RuleResult evaluate(Transaction transaction) {
        if (!transaction.getType().isMonetary()) {
            return RuleResult.approve();
        }

        if (!transaction.hasAmount()) {
            return RuleResult.decline(ErrorKind.INVALID_AMOUNT,
                String.format("%s violated: %s %d has no amount",
                    getRuleName(), transaction.getRawType(), transaction.getTx()));
        }

        if (!transaction.getAmount().isGreaterThan(minimumAmount)) {
            return RuleResult.decline(ErrorKind.INVALID_AMOUNT,
                String.format("%s violated: amount %s must be greater than %s",
                    getRuleName(), transaction.getAmount(), minimumAmount));
        }

        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "MinimumAmount";
    }
}
