package com.example.shortie_backend.util;

/**
 * Overlap math shared by the selector and the refiner.
 */
public final class WindowOverlap {
    public static final double EDGE_TOLERANCE_SEC = 0.5;
    public static final double OVERLAP_RATIO = 0.85;

    private WindowOverlap() {}

    /**
     * Two windows are near-duplicates when both edges differ by less than half a second, or when their
     * overlap covers at least 85% of the shorter one.
     */
    public static boolean isNearDuplicate(double s1, double e1, double s2, double e2) {
        if (Math.abs(s1 - s2) < EDGE_TOLERANCE_SEC && Math.abs(e1 - e2) < EDGE_TOLERANCE_SEC) {
            return true;
        }
        double overlap = Math.max(0.0, Math.min(e1, e2) - Math.max(s1, s2));
        double shorter = Math.max(0.1, Math.min(e1 - s1, e2 - s2));
        return overlap / shorter >= OVERLAP_RATIO;
    }
}
