package com.flagship.medici_ledger.codec;

import com.flagship.medici_ledger.ledger.Money;
import com.flagship.medici_ledger.ledger.exception.MalformedRecordException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Field conversions shared by the CSV and JSON importers.
 * Every failure becomes a {@link MalformedRecordException} naming the record and field.
 */
final class RecordFields {

    private RecordFields() {
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String required(String recordId, String field, String value) {
        if (isBlank(value)) {
            throw new MalformedRecordException(recordId,
                String.format("Record %s: missing required field '%s'", recordId, field));
        }
        return value.trim();
    }

    static LocalDate date(String recordId, String value) {
        String text = required(recordId, "date", value);
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException(recordId,
                String.format("Record %s: invalid date '%s'", recordId, text), e);
        }
    }

    static Money signedAmount(String recordId, String field, String value) {
        String text = required(recordId, field, value);
        try {
            return Money.of(text);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedRecordException(recordId,
                String.format("Record %s: non-numeric %s '%s'", recordId, field, text), e);
        }
    }

    static Money amount(String recordId, String field, String value) {
        Money amount = signedAmount(recordId, field, value);
        if (amount.isNegative()) {
            throw new MalformedRecordException(recordId,
                String.format("Record %s: negative %s '%s'", recordId, field, value.trim()));
        }
        return amount;
    }
}
