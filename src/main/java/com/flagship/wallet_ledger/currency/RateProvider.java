package com.flagship.wallet_ledger.currency;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Source of exchange rates relative to the reference currency unit.
 */
public interface RateProvider {

    /**
     * @param currencyCode upper-case ISO-4217 code
     * @return rate of one unit of the currency in reference units, empty if unsupported
     */
    Optional<BigDecimal> rateOf(String currencyCode);

    /**
     * All supported currencies and their rates, in a stable order.
     */
    Map<String, BigDecimal> supportedRates();
}
