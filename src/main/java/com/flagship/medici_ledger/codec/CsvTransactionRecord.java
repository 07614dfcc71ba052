package com.flagship.medici_ledger.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the flat CSV transaction format.
 *
 * All columns are kept as text so a bad value fails the row, not the whole file.
 * Columns produced by the historical-data generator that the ledger does not use
 * (branch, type, counterparty, currency) are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "date", "description", "debit_account", "debit_amount",
    "credit_account", "credit_amount", "credit_account_2", "credit_amount_2"})
public class CsvTransactionRecord {

    @JsonProperty("id")
    private String id;

    @JsonProperty("date")
    private String date;

    @JsonProperty("description")
    private String description;

    // comma-joined names sharing debit_amount
    @JsonProperty("debit_account")
    private String debitAccount;

    @JsonProperty("debit_amount")
    private String debitAmount;

    @JsonProperty("credit_account")
    private String creditAccount;

    @JsonProperty("credit_amount")
    private String creditAmount;

    @JsonProperty("credit_account_2")
    private String creditAccount2;

    @JsonProperty("credit_amount_2")
    private String creditAmount2;
}
