package com.flagship.medici_ledger.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A debit or credit line in the JSON format. The amount is written as a decimal string;
 * a JSON number is accepted on import as well.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonEntryRecord {

    @JsonProperty("account")
    private String account;

    @JsonProperty("account_type")
    private String accountType;

    @JsonProperty("amount")
    private String amount;
}
