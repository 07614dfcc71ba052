package com.flagship.medici_ledger.ledger.exception;

import com.flagship.medici_ledger.ledger.Money;
import lombok.Getter;

/**
 * Thrown when a transaction's debits do not equal its credits,
 * or when either side has no entries at all.
 */
@Getter
public class UnbalancedTransactionException extends LedgerException {

    private final Money debitTotal;
    private final Money creditTotal;

    public UnbalancedTransactionException(String message, Money debitTotal, Money creditTotal) {
        super(message);
        this.debitTotal = debitTotal;
        this.creditTotal = creditTotal;
    }

    public UnbalancedTransactionException(Money debitTotal, Money creditTotal) {
        this(String.format("Transaction is not balanced: debits=%s, credits=%s", debitTotal, creditTotal),
            debitTotal, creditTotal);
    }
}
