package com.flagship.wallet_ledger.ledger;

import java.math.BigDecimal;

/**
 * Direction of a ledger entry relative to the wallet balance.
 */
public enum TransactionKind {
    DEPOSIT {
        @Override
        public BigDecimal signed(BigDecimal referenceAmount) {
            return referenceAmount;
        }
    },
    WITHDRAWAL {
        @Override
        public BigDecimal signed(BigDecimal referenceAmount) {
            return referenceAmount.negate();
        }
    };

    /**
     * Signed balance impact of an unsigned reference-currency amount.
     */
    public abstract BigDecimal signed(BigDecimal referenceAmount);
}
