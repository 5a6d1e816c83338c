package com.flagship.wallet_ledger.currency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class CurrencyNormalizerTest {

    private final CurrencyNormalizer normalizer = new CurrencyNormalizer(new StaticRateTable(), "EGP");

    @ParameterizedTest(name = "{0} {1} -> {2} EGP")
    @CsvSource({
        "10,     USD, 490.00",
        "100,    EUR, 5300.00",
        "1,      GBP, 62.00",
        "7.5,    SAR, 97.50",
        "1,      AED, 13.30",
        "250.75, EGP, 250.75",
        "0.01,   USD, 0.49"
    })
    @DisplayName("Amounts are converted with the fixed rate table")
    void convertsWithFixedRates(String amount, String currency, String expected) {
        BigDecimal result = normalizer.normalize(new BigDecimal(amount), currency);

        assertEquals(new BigDecimal(expected), result);
        assertEquals(2, result.scale());
    }

    @ParameterizedTest(name = "{0} EGP rounds to {1}")
    @CsvSource({
        "0.005,  0.01",
        "1.005,  1.01",
        "1.0049, 1.00",
        "0.333,  0.33"
    })
    @DisplayName("Results are rounded half-up to two decimal places")
    void roundsHalfUp(String amount, String expected) {
        assertEquals(new BigDecimal(expected), normalizer.normalize(new BigDecimal(amount), "EGP"));
    }

    @Test
    @DisplayName("AED conversion keeps the fractional rate before rounding")
    void fractionalRateIsNotRoundedEarly() {
        // 0.15 * 13.3 = 1.995
        assertEquals(new BigDecimal("2.00"), normalizer.normalize(new BigDecimal("0.15"), "AED"));
    }

    @Test
    @DisplayName("Currency codes are case-insensitive")
    void currencyCodesAreCaseInsensitive() {
        assertEquals(new BigDecimal("490.00"), normalizer.normalize(BigDecimal.TEN, "usd"));
        assertEquals(new BigDecimal("490.00"), normalizer.normalize(BigDecimal.TEN, " Usd "));
    }

    @Test
    @DisplayName("A missing currency means the reference currency")
    void missingCurrencyDefaultsToReference() {
        assertEquals(new BigDecimal("10.00"), normalizer.normalize(BigDecimal.TEN, null));
        assertEquals(new BigDecimal("10.00"), normalizer.normalize(BigDecimal.TEN, ""));
        assertEquals("EGP", normalizer.resolveCurrency(null));
    }

    @Test
    @DisplayName("Unknown currencies are rejected with the offending code")
    void unknownCurrencyIsRejected() {
        UnsupportedCurrencyException e = assertThrows(UnsupportedCurrencyException.class,
            () -> normalizer.normalize(BigDecimal.TEN, "xyz"));

        assertEquals("XYZ", e.getCurrency());
        assertEquals("UNSUPPORTED_CURRENCY", e.getErrorCode());
    }

    @Test
    void nonPositiveAmountsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(BigDecimal.ZERO, "EGP"));
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(new BigDecimal("-1"), "EGP"));
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(null, "EGP"));
    }

    @Test
    @DisplayName("Conversion divides by the reference rate when the reference is not EGP")
    void otherReferenceCurrency() {
        CurrencyNormalizer usdReference = new CurrencyNormalizer(new StaticRateTable(), "usd");

        assertEquals("USD", usdReference.getReferenceCurrency());
        assertEquals(new BigDecimal("1.00"), usdReference.normalize(new BigDecimal("49"), "EGP"));
        assertEquals(new BigDecimal("1.08"), usdReference.normalize(BigDecimal.ONE, "EUR"));
    }
}
