package com.ledgerd.shared.types.transaction;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fee paid by a wrapper transaction.
 */
public record Fee(BigInteger amount, String token) {

    public Fee {
        Objects.requireNonNull(amount, "Fee amount cannot be null");
        Objects.requireNonNull(token, "Fee token cannot be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Fee amount cannot be negative: " + amount);
        }
    }
}
