package com.flagship.retail_ledger.ledger;

import com.flagship.retail_ledger.ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Validation and normalization of monetary amounts.
 * Amounts are stored as NUMERIC(19, 2): positive, at most two decimal places.
 */
public final class Amounts {

    public static final int MINOR_UNIT_SCALE = 2;
    static final int MAX_INTEGER_DIGITS = 17;

    private Amounts() {
    }

    /**
     * Returns the amount at minor-unit scale, or throws if it cannot be booked.
     *
     * @throws InvalidAmountException if the amount is null, not positive,
     *                                finer than a minor unit, or too large for the store
     */
    public static BigDecimal requireValid(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException(null, "amount is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidAmountException(amount, "amount must be positive");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > MINOR_UNIT_SCALE) {
            throw new InvalidAmountException(amount,
                "amount must not have more than " + MINOR_UNIT_SCALE + " decimal places");
        }
        if (stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            throw new InvalidAmountException(amount, "amount is too large");
        }
        return amount.setScale(MINOR_UNIT_SCALE, RoundingMode.UNNECESSARY);
    }
}
