package com.flagship.retail_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BalanceCalculatorTest {

    private static final UUID ACCOUNT = UUID.randomUUID();

    @Test
    @DisplayName("Empty history has a zero balance")
    void testEmptyHistory() {
        assertEquals(new BigDecimal("0.00"), BalanceCalculator.balanceOf(List.of()));
    }

    @Test
    @DisplayName("Deposits add, every other kind subtracts")
    void testDirectionByKind() {
        List<LedgerTransaction> history = List.of(
            row(TransactionKind.DEPOSIT, null, "1000.00"),
            row(TransactionKind.DEPOSIT, null, "500.00"),
            row(TransactionKind.WITHDRAWAL, null, "200.00"),
            row(TransactionKind.TRANSFER, null, "300.00"),
            row(TransactionKind.CATEGORY_FUNDING, "Betting Funding", "150.50"),
            row(TransactionKind.CATEGORY_FUNDING, "Data Purchase", "49.50")
        );

        assertEquals(new BigDecimal("800.00"), BalanceCalculator.balanceOf(history));
    }

    @Test
    @DisplayName("Balance equals deposits minus non-deposits for generated histories")
    void testGeneratedHistories() {
        Random random = new Random(20240917L);
        TransactionKind[] kinds = TransactionKind.values();

        for (int history = 0; history < 500; history++) {
            int size = random.nextInt(40);
            List<LedgerTransaction> rows = new ArrayList<>(size);
            long depositCents = 0;
            long otherCents = 0;

            for (int i = 0; i < size; i++) {
                TransactionKind kind = kinds[random.nextInt(kinds.length)];
                long cents = 1 + random.nextInt(1_000_000);
                if (kind == TransactionKind.DEPOSIT) {
                    depositCents += cents;
                } else {
                    otherCents += cents;
                }
                String category = kind == TransactionKind.CATEGORY_FUNDING ? "Airtime" : null;
                rows.add(row(kind, category, BigDecimal.valueOf(cents, 2).toPlainString()));
            }

            assertEquals(BigDecimal.valueOf(depositCents - otherCents, 2), BalanceCalculator.balanceOf(rows),
                "History #" + history + " of " + size + " rows");
        }
    }

    private static LedgerTransaction row(TransactionKind kind, String category, String amount) {
        return new LedgerTransaction(1L, ACCOUNT, kind, category, new BigDecimal(amount),
            null, null, Instant.now());
    }
}
