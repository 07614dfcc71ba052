package com.flagship.medici_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a free-text account name to an account of the ledger, creating it when absent.
 *
 * Only the CSV import needs this: the flat CSV rows carry no account type, so the type of a
 * new account is guessed from keywords in its name. Categories are tried in declaration
 * order and the first hit wins; names matching nothing become ASSET accounts.
 */
@Component
@Slf4j
public class AccountResolver {

    private static final Map<AccountType, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(AccountType.ASSET,
            List.of("cash", "receivable", "inventory", "land", "building", "equipment", "asset"));
        KEYWORDS.put(AccountType.LIABILITY,
            List.of("payable", "loan", "debt", "liability"));
        KEYWORDS.put(AccountType.EQUITY,
            List.of("capital", "equity", "retained earnings", "owner"));
        KEYWORDS.put(AccountType.REVENUE,
            List.of("revenue", "income", "sales", "interest income", "fee"));
        KEYWORDS.put(AccountType.EXPENSE,
            List.of("expense", "wages", "rent", "supplies", "maintenance", "courier", "cost"));
    }

    public Account resolve(Ledger ledger, String accountName) {
        return ledger.findAccount(accountName).orElseGet(() -> {
            AccountType type = inferAccountType(accountName);
            log.debug("Inferred type {} for new account '{}'", type, accountName);
            return ledger.createAccount(accountName, type);
        });
    }

    public AccountType inferAccountType(String accountName) {
        String lower = accountName.toLowerCase(Locale.ROOT);
        for (Map.Entry<AccountType, List<String>> category : KEYWORDS.entrySet()) {
            for (String keyword : category.getValue()) {
                if (lower.contains(keyword)) {
                    return category.getKey();
                }
            }
        }
        return AccountType.ASSET;
    }
}
