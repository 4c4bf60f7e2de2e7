package com.example.shortie_backend.refine;

import com.example.shortie_backend.config.ShortsProperties;

/**
 * Bounds applied by the {@link ClipBoundaryRefiner}.
 *
 * @param minLen    minimum clip duration in seconds.
 * @param maxLen    maximum clip duration in seconds.
 * @param pad       seconds added on each side before snapping.
 * @param mergeGap  windows starting within this distance of the previous end are merged; {@code 0} disables.
 * @param minShorts backfill target.
 * @param maxShorts final cap.
 */
public record RefinerConfig(double minLen, double maxLen, double pad, double mergeGap, int minShorts, int maxShorts) {

    public RefinerConfig {
        if (minLen <= 0 || maxLen < minLen) {
            throw new IllegalArgumentException("REFINER_BAD_LENGTH_BOUNDS min=" + minLen + " max=" + maxLen);
        }
    }

    public static RefinerConfig from(ShortsProperties props, int targetShorts) {
        return new RefinerConfig(props.getMinLen(), props.getMaxLen(), props.getPad(), props.getMergeGap(),
                props.getMinShorts(), props.effectiveMaxShorts(targetShorts));
    }
}
