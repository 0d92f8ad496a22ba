package com.flagship.accrual_ledger.event;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Converts one raw input row into a {@link PaymentEvent}.
 *
 * Pure function of its configuration and the row: no logging, no state. Failures are
 * reported as {@link MalformedRowException} or {@link UnknownCurrencyException} and the
 * caller decides what to do with the row.
 */
public class EventNormalizer {

    private static final DateTimeFormatter LOCAL_DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private final AmountFormat amountFormat;
    private final ZoneId zone;
    private final CurrencyCode ledgerCurrency;

    /**
     * @param amountFormat   how grossAmount values are written
     * @param zone           zone for timestamps without an offset
     * @param ledgerCurrency the single currency this ledger is kept in
     */
    public EventNormalizer(AmountFormat amountFormat, ZoneId zone, CurrencyCode ledgerCurrency) {
        this.amountFormat = amountFormat;
        this.zone = zone;
        this.ledgerCurrency = ledgerCurrency;
    }

    public PaymentEvent normalize(RawRow row) {
        long line = row.getLineNumber();
        String rawTimestamp = require(row, RawRow.TIMESTAMP);
        String rawType = require(row, RawRow.TYPE);
        String rawAmount = require(row, RawRow.GROSS_AMOUNT);
        String rawCurrency = require(row, RawRow.CURRENCY);

        CurrencyCode currency = CurrencyCode.parse(rawCurrency)
                .orElseThrow(() -> new UnknownCurrencyException(line, rawCurrency, "is not recognized"));
        if (currency != ledgerCurrency) {
            throw new UnknownCurrencyException(line, rawCurrency,
                    "is not the ledger currency " + ledgerCurrency);
        }

        return new PaymentEvent(
                row.field(RawRow.ID).orElse("row-" + line),
                line,
                parseTimestamp(line, rawTimestamp),
                parseAmount(line, rawAmount, currency),
                currency,
                rawType.toLowerCase(Locale.ROOT),
                row.field(RawRow.CORRELATION_ID).orElse(null),
                row.field(RawRow.DESCRIPTION).orElse("")
        );
    }

    private static String require(RawRow row, String field) {
        return row.field(field)
                .orElseThrow(() -> new MalformedRowException(row.getLineNumber(),
                        "required field '" + field + "' is missing"));
    }

    long parseAmount(long line, String raw, CurrencyCode currency) {
        String cleaned = raw.replace("\"", "").replace("'", "").replace(",", "").trim();
        try {
            BigDecimal value = new BigDecimal(cleaned);
            if (amountFormat == AmountFormat.MAJOR_UNITS) {
                value = value.movePointRight(currency.getMinorUnitDigits());
            }
            if (value.stripTrailingZeros().scale() > 0) {
                throw new MalformedRowException(line,
                        "amount '" + raw + "' has more precision than " + currency + " minor units");
            }
            return value.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedRowException(line, "amount '" + raw + "' is not numeric", e);
        }
    }

    Instant parseTimestamp(long line, String raw) {
        String cleaned = raw.replace("\"", "").trim();
        try {
            if (cleaned.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochSecond(Long.parseLong(cleaned));
            }
            if (cleaned.endsWith("Z") || cleaned.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(cleaned).toInstant();
            }
            if (cleaned.length() == 10) {
                return LocalDate.parse(cleaned).atStartOfDay(zone).toInstant();
            }
            return LocalDateTime.parse(cleaned.replace('T', ' '), LOCAL_DATE_TIME).atZone(zone).toInstant();
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new MalformedRowException(line, "timestamp '" + raw + "' cannot be parsed", e);
        } catch (DateTimeException e) {
            throw new MalformedRowException(line, "timestamp '" + raw + "' is out of range", e);
        }
    }
}
