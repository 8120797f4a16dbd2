package com.ledgerengine.rules;

import com.ledgerengine.transactions.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Evaluates all configured rules against a transaction before dispatch.
 *
 * Rules are evaluated in order, and the first rule that declines the transaction
 * decides the failure reason.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RulesEngine {

    private final List<Rule> rules;

    /**
     * Evaluate all rules against a transaction.
     *
     * @param transaction the parsed transaction to evaluate
     * @return the first decline, or an approval when every rule approves
     */
    public RuleResult evaluateRules(Transaction transaction) {
        log.debug("Evaluating {} rules for tx {} of client {}",
            rules.size(), transaction.getTx(), transaction.getClient());

        for (Rule rule : rules) {
            RuleResult result = rule.evaluate(transaction);

            if (!result.isApproved()) {
                log.debug("Rule {} declined tx {} for client {}: {}",
                    rule.getRuleName(), transaction.getTx(), transaction.getClient(), result.getReason());
                return result;
            }

            log.debug("Rule {} approved", rule.getRuleName());
        }

        return RuleResult.approve();
    }
}
