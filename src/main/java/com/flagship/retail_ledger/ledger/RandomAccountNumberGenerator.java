package com.flagship.retail_ledger.ledger;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Uniformly random 12-digit numbers without a leading zero.
 */
@Component
public class RandomAccountNumberGenerator implements AccountNumberGenerator {

    static final long LOWEST = 100_000_000_000L;
    static final long HIGHEST = 999_999_999_999L;

    private final SecureRandom random = new SecureRandom();

    @Override
    public String nextAccountNumber() {
        return Long.toString(LOWEST + random.nextLong(HIGHEST - LOWEST + 1));
    }
}
