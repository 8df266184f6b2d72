package com.jay.mfses.model;

import java.time.LocalDateTime;

/**
 * One observation in a security's recent price history.
 * Volume is optional (0 = unknown) and only feeds the activity classifier.
 */
public record PricePoint(LocalDateTime timestamp, Double price, long volume) {

    public static PricePoint of(LocalDateTime timestamp, double price) {
        return new PricePoint(timestamp, price, 0L);
    }
}
