package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.Money;
import lombok.Value;

/**
 * Size of the ledger and the debit/credit volume of its whole transaction log.
 */
@Value
public class LedgerSummary {
    String ledgerName;
    int accountCount;
    int transactionCount;
    Money totalDebits;
    Money totalCredits;

    public Money getDifference() {
        return totalDebits.minus(totalCredits);
    }

    public boolean isBalanced() {
        return getDifference().isZero();
    }
}
