package com.jay.mfses.model.enums;

public enum ActivityState {
    HOT,    // heavy volume and a large daily move
    WARM,
    COLD,
    FROZEN  // quiet session, or not enough history to tell
}
