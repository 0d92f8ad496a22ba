package com.flagship.accrual_ledger.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventNormalizerTest {

    private final EventNormalizer normalizer =
            new EventNormalizer(AmountFormat.MAJOR_UNITS, ZoneOffset.UTC, CurrencyCode.USD);

    private static Map<String, String> fields(String timestamp, String type, String amount, String currency) {
        Map<String, String> fields = new HashMap<>();
        fields.put(RawRow.ID, "txn_1");
        fields.put(RawRow.TIMESTAMP, timestamp);
        fields.put(RawRow.TYPE, type);
        fields.put(RawRow.GROSS_AMOUNT, amount);
        fields.put(RawRow.CURRENCY, currency);
        return fields;
    }

    @Test
    @DisplayName("Major-unit amounts are converted to integer minor units")
    void testMajorUnitAmount() {
        PaymentEvent event = normalizer.normalize(new RawRow(2,
                fields("2024-01-15T10:30:00Z", "Charge", "1,234.56", "usd")));

        assertEquals(123456L, event.getGrossAmount());
        assertEquals(CurrencyCode.USD, event.getCurrency());
        assertEquals("charge", event.getRawType());
        assertEquals("txn_1", event.getId());
        assertEquals(2L, event.getLineNumber());
        assertEquals("", event.getDescription());
        assertNull(event.getCorrelationId());
    }

    @Test
    @DisplayName("Negative amounts keep their sign")
    void testNegativeAmount() {
        PaymentEvent event = normalizer.normalize(new RawRow(2,
                fields("2024-01-15T10:30:00Z", "refund", "-100.00", "USD")));

        assertEquals(-10000L, event.getGrossAmount());
        assertTrue(event.isNegative());
    }

    @Test
    @DisplayName("Minor-unit input is taken as is")
    void testMinorUnitAmount() {
        EventNormalizer minor = new EventNormalizer(AmountFormat.MINOR_UNITS, ZoneOffset.UTC, CurrencyCode.USD);

        PaymentEvent event = minor.normalize(new RawRow(1,
                fields("2024-01-15T10:30:00Z", "charge", "12345", "USD")));

        assertEquals(12345L, event.getGrossAmount());
    }

    @Test
    @DisplayName("Currencies without minor units convert one to one")
    void testZeroDigitCurrency() {
        EventNormalizer yen = new EventNormalizer(AmountFormat.MAJOR_UNITS, ZoneOffset.UTC, CurrencyCode.JPY);

        PaymentEvent event = yen.normalize(new RawRow(1,
                fields("2024-01-15T10:30:00Z", "charge", "1500", "jpy")));

        assertEquals(1500L, event.getGrossAmount());
    }

    @Test
    @DisplayName("Amounts finer than the currency's minor unit are rejected")
    void testExcessPrecision() {
        MalformedRowException e = assertThrows(MalformedRowException.class,
                () -> normalizer.normalize(new RawRow(4, fields("2024-01-15T10:30:00Z", "charge", "1.234", "USD"))));

        assertEquals(4L, e.getLineNumber());
    }

    @Test
    @DisplayName("Non-numeric amounts are malformed")
    void testNonNumericAmount() {
        assertThrows(MalformedRowException.class,
                () -> normalizer.normalize(new RawRow(4, fields("2024-01-15T10:30:00Z", "charge", "ten", "USD"))));
    }

    @Test
    @DisplayName("A missing required field is malformed and reports its line")
    void testMissingField() {
        Map<String, String> fields = fields("2024-01-15T10:30:00Z", "charge", "10.00", "USD");
        fields.remove(RawRow.TIMESTAMP);

        MalformedRowException e = assertThrows(MalformedRowException.class,
                () -> normalizer.normalize(new RawRow(9, fields)));

        assertEquals(9L, e.getLineNumber());
        assertTrue(e.getMessage().contains("timestamp"));
    }

    @Test
    @DisplayName("Blank values count as missing")
    void testBlankField() {
        assertThrows(MalformedRowException.class,
                () -> normalizer.normalize(new RawRow(1, fields("2024-01-15T10:30:00Z", "  ", "10.00", "USD"))));
    }

    @Test
    @DisplayName("Unrecognized currency codes are rejected")
    void testUnknownCurrency() {
        assertThrows(UnknownCurrencyException.class,
                () -> normalizer.normalize(new RawRow(1, fields("2024-01-15T10:30:00Z", "charge", "10.00", "XYZ"))));
    }

    @Test
    @DisplayName("A known currency other than the ledger currency is rejected")
    void testForeignCurrency() {
        assertThrows(UnknownCurrencyException.class,
                () -> normalizer.normalize(new RawRow(1, fields("2024-01-15T10:30:00Z", "charge", "10.00", "EUR"))));
    }

    @Test
    @DisplayName("Epoch seconds, ISO instants, dates and local date-times are all accepted")
    void testTimestampFormats() {
        EventNormalizer newYork = new EventNormalizer(AmountFormat.MAJOR_UNITS,
                ZoneId.of("America/New_York"), CurrencyCode.USD);
        Instant expected = Instant.parse("2024-01-15T10:30:00Z");

        assertEquals(expected, normalizer.parseTimestamp(1, "1705314600"));
        assertEquals(expected, normalizer.parseTimestamp(1, "2024-01-15T10:30:00Z"));
        assertEquals(expected, normalizer.parseTimestamp(1, "2024-01-15T05:30:00-05:00"));
        assertEquals(expected, normalizer.parseTimestamp(1, "2024-01-15 10:30"));
        assertEquals(expected, normalizer.parseTimestamp(1, "2024-01-15 10:30:00"));
        assertEquals(Instant.parse("2024-01-15T05:00:00Z"), newYork.parseTimestamp(1, "2024-01-15"));
    }

    @Test
    @DisplayName("Unparseable timestamps are malformed")
    void testBadTimestamp() {
        assertThrows(MalformedRowException.class, () -> normalizer.parseTimestamp(3, "15/01/2024"));
    }

    @Test
    @DisplayName("Rows without an id get one derived from their line number")
    void testIdFallback() {
        Map<String, String> fields = fields("2024-01-15T10:30:00Z", "payout", "-10.00", "USD");
        fields.remove(RawRow.ID);
        fields.put(RawRow.CORRELATION_ID, "po_1");
        fields.put(RawRow.DESCRIPTION, "STRIPE PAYOUT");

        PaymentEvent event = normalizer.normalize(new RawRow(7, fields));

        assertEquals("row-7", event.getId());
        assertEquals("po_1", event.getCorrelationId());
        assertEquals("STRIPE PAYOUT", event.getDescription());
    }
}
