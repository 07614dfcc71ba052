package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.AccountType;
import com.flagship.medici_ledger.ledger.Money;
import lombok.Value;

/**
 * One account row of a report.
 */
@Value
public class ReportLine {
    String accountName;
    AccountType accountType;
    Money amount;
}
