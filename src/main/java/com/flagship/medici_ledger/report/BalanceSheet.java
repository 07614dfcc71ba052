package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.Money;
import lombok.Value;

import java.util.List;

/**
 * Assets, liabilities and equity at the current point in time.
 */
@Value
public class BalanceSheet {
    List<ReportLine> assets;
    List<ReportLine> liabilities;
    List<ReportLine> equity;
    Money totalAssets;
    Money totalLiabilities;
    Money totalEquity;

    public Money getTotalLiabilitiesAndEquity() {
        return totalLiabilities.plus(totalEquity);
    }

    /**
     * Assets == Liabilities + Equity. Revenue and expenses are not closed into equity,
     * so a ledger with non-zero net income reports false here.
     */
    public boolean isBalanced() {
        return totalAssets.equals(getTotalLiabilitiesAndEquity());
    }
}
