package com.flagship.medici_ledger.codec;

import lombok.Value;

/**
 * Outcome of a best-effort import: how many records were posted and how many were skipped.
 */
@Value
public class ImportResult {
    String format;
    int posted;
    int skipped;

    public int getTotal() {
        return posted + skipped;
    }
}
