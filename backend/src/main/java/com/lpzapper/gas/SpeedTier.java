package com.lpzapper.gas;

/**
 * Oracle price tier. INSTANT is FAST with a 20% premium.
 */
public enum SpeedTier {
    SAFE,
    STANDARD,
    FAST,
    INSTANT
}
