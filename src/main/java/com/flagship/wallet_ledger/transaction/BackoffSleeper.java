package com.flagship.wallet_ledger.transaction;

import java.time.Duration;

/**
 * Waits between retry attempts. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration delay) throws InterruptedException;

    static BackoffSleeper threadSleep() {
        return delay -> Thread.sleep(delay.toMillis());
    }
}
