package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.Money;
import lombok.Value;

import java.util.List;

@Value
public class IncomeStatement {
    List<ReportLine> revenue;
    List<ReportLine> expenses;
    Money totalRevenue;
    Money totalExpenses;

    public Money getNetIncome() {
        return totalRevenue.minus(totalExpenses);
    }
}
