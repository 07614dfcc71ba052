package com.flagship.medici_ledger.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One transaction in the JSON format, with every debit and credit spelled out.
 * This is the only format that round-trips a ledger without loss.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "date", "description", "debits", "credits"})
public class JsonTransactionRecord {

    @JsonProperty("id")
    private String id;

    @JsonProperty("date")
    private String date;

    @JsonProperty("description")
    private String description;

    @JsonProperty("debits")
    private List<JsonEntryRecord> debits;

    @JsonProperty("credits")
    private List<JsonEntryRecord> credits;
}
