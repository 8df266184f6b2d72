package com.jay.mfses.model.enums;

public enum Horizon {
    SHORT,  // 0-6 months: price-sensitive, leans on sentiment and valuation
    MID,    // 1-3 years: even blend
    LONG    // 5+ years: durability, leans on moat and balance sheet
}
