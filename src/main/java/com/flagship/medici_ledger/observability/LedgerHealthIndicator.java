package com.flagship.medici_ledger.observability;

import com.flagship.medici_ledger.ledger.Ledger;
import com.flagship.medici_ledger.report.ReportService;
import com.flagship.medici_ledger.report.TrialBalance;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when the application ledger's trial balance does not balance.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final Ledger ledger;
    private final ReportService reportService;

    public LedgerHealthIndicator(Ledger ledger, ReportService reportService) {
        this.ledger = ledger;
        this.reportService = reportService;
    }

    @Override
    public Health health() {
        try {
            TrialBalance trialBalance = reportService.trialBalance(ledger);

            Health.Builder builder = trialBalance.isBalanced() ? Health.up() : Health.down();

            return builder
                    .withDetail("ledger", ledger.getName())
                    .withDetail("accounts", ledger.getAccounts().size())
                    .withDetail("transactions", ledger.getTransactions().size())
                    .withDetail("totalDebits", trialBalance.getTotalDebits().toPlainString())
                    .withDetail("totalCredits", trialBalance.getTotalCredits().toPlainString())
                    .build();

        } catch (RuntimeException e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
