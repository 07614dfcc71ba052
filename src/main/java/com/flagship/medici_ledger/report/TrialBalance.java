package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.Money;
import lombok.Value;

import java.util.List;

/**
 * Every non-zero account balance placed in a debit or credit column.
 * The books are balanced when both columns add up to the same amount.
 */
@Value
public class TrialBalance {
    List<Row> rows;
    Money totalDebits;
    Money totalCredits;

    public boolean isBalanced() {
        return totalDebits.equals(totalCredits);
    }

    /**
     * Exactly one of {@code debit} and {@code credit} is non-zero.
     */
    @Value
    public static class Row {
        String accountName;
        Money debit;
        Money credit;

        public boolean isDebit() {
            return !debit.isZero();
        }
    }
}
