package com.ledgerengine.rules;

import com.ledgerengine.transactions.Transaction;

/**
 * Interface for pre-dispatch validation rules.
 *
 * Each rule evaluates a parsed transaction before it reaches any account and
 * returns a result indicating whether the transaction may be applied.
 */
public interface Rule {

    /**
     * Evaluate the rule against a transaction.
     *
     * @param transaction the parsed transaction to evaluate
     * @return the result of the rule evaluation
     */
    RuleResult evaluate(Transaction transaction);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
