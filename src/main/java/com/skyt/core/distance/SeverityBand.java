package com.skyt.core.distance;

/** Banding of a per-property distance for reporting. */
public enum SeverityBand {
    NONE,
    MINOR,
    MODERATE,
    MAJOR;

    public static SeverityBand of(double distance) {
        if (distance <= 0.0) return NONE;
        if (distance < 0.3)  return MINOR;
        if (distance < 0.7)  return MODERATE;
        return MAJOR;
    }
}
