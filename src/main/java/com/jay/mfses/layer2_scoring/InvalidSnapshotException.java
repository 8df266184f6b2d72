package com.jay.mfses.layer2_scoring;

import lombok.Getter;

/**
 * A snapshot that cannot be scored: a required field is missing or non-numeric, or a
 * value breaks its domain constraint (e.g. negative market cap). Scoped to one ticker;
 * the batch carries on with the others.
 */
@Getter
public class InvalidSnapshotException extends RuntimeException {

    private final String ticker;

    public InvalidSnapshotException(String ticker, String message) {
        super(message);
        this.ticker = ticker;
    }
}
