package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.currency.CurrencyNormalizer;
import com.flagship.wallet_ledger.currency.RateProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lists the supported currencies and their fixed rates.
 */
@RestController
@RequestMapping("/api/currencies")
@RequiredArgsConstructor
public class CurrencyController {

    private final RateProvider rateProvider;
    private final CurrencyNormalizer currencyNormalizer;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listCurrencies() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("reference_currency", currencyNormalizer.getReferenceCurrency());
        response.put("rates", rateProvider.supportedRates());
        return ResponseEntity.ok(response);
    }
}
