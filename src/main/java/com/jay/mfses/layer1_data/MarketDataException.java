package com.jay.mfses.layer1_data;

/** A provider could not supply a snapshot (HTTP failure, unparsable body, unknown ticker). */
public class MarketDataException extends RuntimeException {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
