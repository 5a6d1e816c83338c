package com.flagship.wallet_ledger.currency;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Converts caller-supplied amounts into the reference currency.
 *
 * Conversion is {@code amount * rate[source] / rate[reference]}, rounded half-up
 * to 2 decimal places exactly once. Callers must not round the result again.
 */
@Component
public class CurrencyNormalizer {

    public static final int REFERENCE_SCALE = 2;

    private final RateProvider rateProvider;
    private final String referenceCurrency;

    public CurrencyNormalizer(RateProvider rateProvider,
                              @Value("${ledger.currency.reference:EGP}") String referenceCurrency) {
        this.rateProvider = rateProvider;
        this.referenceCurrency = referenceCurrency.toUpperCase(Locale.ROOT);
    }

    /**
     * Converts an amount to the reference currency.
     *
     * @param amount positive amount in the source currency
     * @param sourceCurrency currency code, case-insensitive; null or blank means the reference currency
     * @return the reference-currency amount with scale 2
     * @throws UnsupportedCurrencyException if the source or reference code has no rate
     */
    public BigDecimal normalize(BigDecimal amount, String sourceCurrency) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        String source = resolveCurrency(sourceCurrency);

        BigDecimal sourceRate = rateProvider.rateOf(source)
            .orElseThrow(() -> new UnsupportedCurrencyException(source));
        BigDecimal referenceRate = rateProvider.rateOf(referenceCurrency)
            .orElseThrow(() -> new UnsupportedCurrencyException(referenceCurrency));

        return amount.multiply(sourceRate).divide(referenceRate, REFERENCE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Canonical form of a caller-supplied currency code. Does not check support.
     */
    public String resolveCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return referenceCurrency;
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }

    public String getReferenceCurrency() {
        return referenceCurrency;
    }
}
