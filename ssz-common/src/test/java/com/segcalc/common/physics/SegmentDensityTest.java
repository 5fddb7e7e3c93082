package com.segcalc.common.physics;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.XiMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link SegmentDensity}.
 * Works in units where r_s = 1 unless a test says otherwise.
 */
class SegmentDensityTest {

    private static final double PHI = PhysicalConstants.GOLDEN_RATIO;
    private static final ModelParameters PARAMS = ModelParameters.CANONICAL;
    private static final RunConfig CONFIG = RunConfig.canonical();

    // ── weak ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("weak(): r_s / 2r")
    class WeakTests {

        @Test
        @DisplayName("matches r_s/(2r) at several radii")
        void matchesFormula() {
            for (double x : new double[] {10.0, 100.0, 1e4, 1e8}) {
                assertEquals(1.0 / (2.0 * x), SegmentDensity.weak(x, 1.0), 1e-15);
            }
        }

        @Test
        @DisplayName("scales with r_s: Earth surface value")
        void earthSurface() {
            double rs = 8.87e-3;
            double r = 6.371e6;
            assertEquals(rs / (2.0 * r), SegmentDensity.weak(r, rs), 1e-25);
        }

        @Test
        @DisplayName("non-increasing beyond 110 r_s")
        void nonIncreasing() {
            double previous = Double.MAX_VALUE;
            for (int i = 0; i < 200; i++) {
                double x = 110.0 * Math.pow(1.05, i);
                double xi = SegmentDensity.weak(x, 1.0);
                assertTrue(xi <= previous, "Ξ_weak rose at x=" + x);
                previous = xi;
            }
        }
    }

    // ── strong ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("strong(): ξ_max·(1 − e^(−φr/r_s))")
    class StrongTests {

        @Test
        @DisplayName("Ξ(r_s) = 1 − e^(−φ) ≈ 0.802")
        void valueAtHorizon() {
            assertEquals(0.8017118471377938, SegmentDensity.strong(1.0, 1.0, PHI, 1.0), 1e-12);
        }

        @Test
        @DisplayName("non-decreasing as r approaches r_s from below")
        void nonDecreasingTowardHorizon() {
            double previous = -1.0;
            for (int i = 1; i <= 100; i++) {
                double xi = SegmentDensity.strong(i / 100.0, 1.0, PHI, 1.0);
                assertTrue(xi >= previous);
                previous = xi;
            }
        }

        @Test
        @DisplayName("saturates toward ξ_max")
        void saturates() {
            assertEquals(1.0, SegmentDensity.strong(50.0, 1.0, PHI, 1.0), 1e-12);
        }

        @Test
        @DisplayName("derivative matches a central finite difference")
        void derivative() {
            double r = 1.3;
            double h = 1e-6;
            double numeric = (SegmentDensity.strong(r + h, 1.0, PHI, 1.0)
                            - SegmentDensity.strong(r - h, 1.0, PHI, 1.0)) / (2 * h);
            assertEquals(numeric, SegmentDensity.strongDerivative(r, 1.0, PHI, 1.0), 1e-8);
        }
    }

    // ── blended ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("blended(): quintic transition between 1.8 and 2.2 r_s")
    class BlendedTests {

        @Test
        @DisplayName("h(t) endpoints and midpoint")
        void blendWeight() {
            assertEquals(0.0, SegmentDensity.blendWeight(0.0));
            assertEquals(1.0, SegmentDensity.blendWeight(1.0));
            assertEquals(0.5, SegmentDensity.blendWeight(0.5), 1e-15);
            assertEquals(0.0, SegmentDensity.blendWeight(-3.0));
            assertEquals(1.0, SegmentDensity.blendWeight(7.0));
        }

        @Test
        @DisplayName("strong form below the zone, weak form above it")
        void outsideZone() {
            assertEquals(SegmentDensity.strong(1.5, 1.0, PHI, 1.0), SegmentDensity.blended(1.5, 1.0, PHI, PARAMS));
            assertEquals(SegmentDensity.weak(5.0, 1.0), SegmentDensity.blended(5.0, 1.0, PHI, PARAMS));
        }

        @Test
        @DisplayName("continuous in value at both edges")
        void continuousAtEdges() {
            double h = 1e-9;
            for (double edge : new double[] {PARAMS.blendLow(), PARAMS.blendHigh()}) {
                double below = SegmentDensity.blended(edge - h, 1.0, PHI, PARAMS);
                double above = SegmentDensity.blended(edge + h, 1.0, PHI, PARAMS);
                assertEquals(below, above, 1e-6, "jump at x=" + edge);
            }
        }

        @Test
        @DisplayName("approximately continuous first derivative at both edges")
        void firstDerivativeAtEdges() {
            for (double edge : new double[] {PARAMS.blendLow(), PARAMS.blendHigh()}) {
                double h = 1e-6 * edge;
                double left = (SegmentDensity.blended(edge, 1.0, PHI, PARAMS)
                             - SegmentDensity.blended(edge - h, 1.0, PHI, PARAMS)) / h;
                double right = (SegmentDensity.blended(edge + h, 1.0, PHI, PARAMS)
                              - SegmentDensity.blended(edge, 1.0, PHI, PARAMS)) / h;
                assertEquals(0.0, Math.abs(left - right) / Math.max(Math.abs(left), 1e-12), 1e-4,
                    "slope mismatch at x=" + edge);
            }
        }

        @Test
        @DisplayName("stays between the strong and weak envelopes inside the zone")
        void withinEnvelope() {
            for (int i = 0; i <= 40; i++) {
                double x = 1.8 + i * 0.01;
                double s = SegmentDensity.strong(x, 1.0, PHI, 1.0);
                double w = SegmentDensity.weak(x, 1.0);
                double f = SegmentDensity.blended(x, 1.0, PHI, PARAMS);
                assertTrue(f >= Math.min(s, w) - 1e-15 && f <= Math.max(s, w) + 1e-15, "x=" + x);
            }
        }
    }

    // ── dispatch & errors ─────────────────────────────────────────────────

    @Nested
    @DisplayName("forMode() and input checks")
    class DispatchTests {

        @Test
        @DisplayName("AUTO resolves to blended, WEAK/STRONG to the pure forms")
        void dispatch() {
            double r = 2.0;
            assertEquals(SegmentDensity.blended(r, 1.0, PHI, PARAMS), SegmentDensity.forMode(XiMode.AUTO, r, 1.0, CONFIG));
            assertEquals(SegmentDensity.weak(r, 1.0), SegmentDensity.forMode(XiMode.WEAK, r, 1.0, CONFIG));
            assertEquals(SegmentDensity.strong(r, 1.0, PHI, 1.0), SegmentDensity.forMode(XiMode.STRONG, r, 1.0, CONFIG));
        }

        @Test
        @DisplayName("r_s ≤ 0 is rejected")
        void nonPositiveSchwarzschildRadius() {
            assertThrows(IllegalArgumentException.class, () -> SegmentDensity.weak(1.0, 0.0));
            assertThrows(IllegalArgumentException.class, () -> SegmentDensity.strong(1.0, -1.0, PHI, 1.0));
            assertThrows(IllegalArgumentException.class, () -> SegmentDensity.blended(1.0, 0.0, PHI, PARAMS));
        }

        @Test
        @DisplayName("r ≤ 0 is rejected")
        void nonPositiveRadius() {
            assertThrows(IllegalArgumentException.class, () -> SegmentDensity.weak(0.0, 1.0));
        }
    }
}
