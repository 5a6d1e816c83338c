package com.flagship.wallet_ledger.currency;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed exchange rates, expressed as EGP per unit.
 *
 * Rates never change for the lifetime of the process; there is no live refresh.
 */
@Component
public class StaticRateTable implements RateProvider {

    private static final Map<String, BigDecimal> RATES;

    static {
        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        rates.put("EGP", new BigDecimal("1.0"));
        rates.put("USD", new BigDecimal("49.0"));
        rates.put("EUR", new BigDecimal("53.0"));
        rates.put("GBP", new BigDecimal("62.0"));
        rates.put("SAR", new BigDecimal("13.0"));
        rates.put("AED", new BigDecimal("13.3"));
        RATES = Collections.unmodifiableMap(rates);
    }

    @Override
    public Optional<BigDecimal> rateOf(String currencyCode) {
        if (currencyCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(RATES.get(currencyCode));
    }

    @Override
    public Map<String, BigDecimal> supportedRates() {
        return RATES;
    }
}
