package com.jay.mfses.layer1_data;

import com.jay.mfses.model.SecuritySnapshot;

/**
 * Layer 1 — source of per-ticker snapshots.
 * Implementations fill every field they can; the engine validates what comes back.
 */
public interface MarketDataProvider {

    /** Short label recorded on the run, e.g. "polygon" or "sample". */
    String name();

    /** @throws MarketDataException when no usable snapshot can be built for the ticker */
    SecuritySnapshot fetch(String ticker);
}
