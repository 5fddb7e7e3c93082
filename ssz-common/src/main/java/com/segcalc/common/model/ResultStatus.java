package com.segcalc.common.model;

/**
 * Health of a single {@link CalculationResult}.
 *
 * <ul>
 *   <li>{@link #OK}: every scalar is finite</li>
 *   <li>{@link #DEGENERATE_GEOMETRY}: radius at or inside r_s, GR redshift is NaN</li>
 *   <li>{@link #FAILED}: the row could not be computed; see the diagnostic</li>
 * </ul>
 */
public enum ResultStatus {
    OK,
    DEGENERATE_GEOMETRY,
    FAILED
}
