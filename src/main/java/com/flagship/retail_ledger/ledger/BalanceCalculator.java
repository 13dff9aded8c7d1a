package com.flagship.retail_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Derives a balance from a transaction history: inflows minus outflows.
 */
public final class BalanceCalculator {

    private BalanceCalculator() {
    }

    public static BigDecimal balanceOf(Collection<LedgerTransaction> transactions) {
        return transactions.stream()
            .map(LedgerTransaction::signedAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(Amounts.MINOR_UNIT_SCALE, RoundingMode.UNNECESSARY);
    }
}
