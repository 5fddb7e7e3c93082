package com.segcalc.engine.calculator;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CalculationResult;
import com.segcalc.common.model.CelestialObject;
import com.segcalc.common.model.RedshiftMode;
import com.segcalc.common.model.Regime;
import com.segcalc.common.model.ResultStatus;
import com.segcalc.common.model.Winner;
import com.segcalc.common.model.XiMode;
import com.segcalc.common.physics.Schwarzschild;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ObjectCalculatorTest {

    private static final RunConfig CONFIG = RunConfig.canonical();
    private static final double RS_10_KM =
        Schwarzschild.radiusForSolarMasses(10.0, CONFIG.constants()) / 1000.0;

    @Nested
    @DisplayName("weak-field contract")
    class WeakField {

        private final CalculationResult sun = ObjectCalculator.calculate(
            CelestialObject.of("Sun", 1.0, 696_340.0), CONFIG);

        @Test
        @DisplayName("Sun is weak with zero correction")
        void regimeAndCorrection() {
            assertEquals(Regime.WEAK, sun.regime());
            assertEquals(0.0, sun.correctionPercent());
            assertEquals(235_780.555, sun.normalizedRadius(), 1e-2);
        }

        @Test
        @DisplayName("SSZ gravitational redshift equals GR")
        void equalsGr() {
            assertEquals(0.0, Math.abs(sun.zSszGrav() - sun.zGr()) / sun.zGr(), 1e-10);
            assertEquals(2.1206226674674866e-06, sun.zGr(), 1e-15);
        }

        @Test
        @DisplayName("holds for every redshift mode")
        void everyMode() {
            for (RedshiftMode mode : RedshiftMode.values()) {
                CalculationResult r = ObjectCalculator.calculate(
                    CelestialObject.of("Sun", 1.0, 696_340.0), CONFIG.withRedshiftMode(mode));
                assertEquals(r.zGr(), r.zSszGrav(), 0.0, mode.label());
            }
        }
    }

    @Nested
    @DisplayName("compact objects")
    class CompactObjects {

        @Test
        @DisplayName("10 M☉ at 3 r_s, 1e4 km/s")
        void stellarBlackHole() {
            CalculationResult r = ObjectCalculator.calculate(
                new CelestialObject("BH10", 10.0, 3 * RS_10_KM, 1e4, null), CONFIG);
            assertEquals(0.22474487139158894, r.zGr(), 1e-9);
            assertEquals(0.2254267967274819, r.zGrSr(), 1e-9);
            assertEquals(0.22836030308014932, r.zSszTotal(), 1e-9);
            assertEquals(1.3045, r.correctionPercent(), 1e-4);
            assertEquals(ResultStatus.OK, r.status());
            assertNull(r.comparison());
        }

        @Test
        @DisplayName("1.4 M☉ / 12 km neutron star sits in the photon-sphere regime")
        void neutronStar() {
            CalculationResult r = ObjectCalculator.calculate(CelestialObject.of("NS", 1.4, 12.0), CONFIG);
            assertEquals(Regime.PHOTON_SPHERE, r.regime());
            assertEquals(2.902, r.normalizedRadius(), 1e-3);
            assertEquals(1.2522, r.correctionPercent(), 1e-4);
            assertTrue(r.zSszTotal() > r.zGrSr());
        }

        @Test
        @DisplayName("PSR J0740+6620 reference redshifts")
        void j0740() {
            CalculationResult r = ObjectCalculator.calculate(
                CelestialObject.observed("PSR J0740+6620", 2.08, 13.7, 0.0, 0.346), CONFIG);
            assertEquals(0.3464307400441755, r.zGrSr(), 1e-12);
            assertEquals(0.35080534850207123, r.zSszTotal(), 1e-12);
            assertEquals(Winner.GR, r.winner());
        }

        @Test
        @DisplayName("dilation diagnostics are filled in")
        void dilation() {
            CalculationResult r = ObjectCalculator.calculate(CelestialObject.of("NS", 1.4, 12.0), CONFIG);
            assertEquals(r.dilationSsz() - r.dilationGr(), r.dilationDifference(), 1e-15);
            assertEquals(1.0, r.dilationSsz() * (1.0 + r.xi()), 1e-12);
            assertEquals(0.528, r.dilationAtIntersection(), 1e-3);
            assertTrue(r.energyNormalized() > 1.0);
        }
    }

    @Nested
    @DisplayName("observation handling")
    class Observation {

        @Test
        @DisplayName("comparison present only with an observed redshift")
        void allOrNothing() {
            assertFalse(ObjectCalculator.calculate(CelestialObject.of("NS", 1.4, 12.0), CONFIG).hasObservation());
            CalculationResult r = ObjectCalculator.calculate(
                CelestialObject.observed("NS", 1.4, 12.0, 0.0, 0.2381), CONFIG);
            assertTrue(r.hasObservation());
            assertEquals(r.zSszTotal() - 0.2381, r.comparison().residualSsz(), 1e-15);
            assertEquals(r.zGrSr() - 0.2381, r.comparison().residualGr(), 1e-15);
            assertEquals(Winner.SSZ, r.winner());
        }

        @Test
        @DisplayName("winner is identical over five repeated calls")
        void deterministicWinner() {
            CelestialObject bh = CelestialObject.observed("BH10", 10.0, 3 * RS_10_KM, 1e4, 0.227);
            Winner first = ObjectCalculator.calculate(bh, CONFIG).winner();
            for (int i = 0; i < 5; i++) {
                assertSame(first, ObjectCalculator.calculate(bh, CONFIG).winner());
            }
        }
    }

    @Nested
    @DisplayName("degenerate geometry")
    class Degenerate {

        @Test
        @DisplayName("radius inside r_s is flagged, not thrown")
        void insideHorizon() {
            CalculationResult r = ObjectCalculator.calculate(
                CelestialObject.observed("inside", 10.0, 0.5 * RS_10_KM, 0.0, 0.5), CONFIG);
            assertEquals(ResultStatus.DEGENERATE_GEOMETRY, r.status());
            assertTrue(Double.isNaN(r.zGr()));
            assertEquals(0.0, r.dilationGr());
            assertTrue(r.dilationSsz() > 0.0);
            assertNotNull(r.diagnostic());
            assertEquals(Winner.TIE, r.winner());
        }

        @Test
        @DisplayName("geometric hint inside r_s: infinite SSZ prediction does not win")
        void geometricInsideHorizonWithObservation() {
            RunConfig geometric = CONFIG.withRedshiftMode(RedshiftMode.GEOMETRIC_HINT);
            CalculationResult r = ObjectCalculator.calculate(
                CelestialObject.observed("inside", 10.0, 0.5 * RS_10_KM, 0.0, 0.5), geometric);
            assertEquals(ResultStatus.DEGENERATE_GEOMETRY, r.status());
            assertEquals(Double.POSITIVE_INFINITY, r.zSszTotal());
            assertTrue(Double.isNaN(r.zGrSr()));
            assertEquals(Winner.TIE, r.winner());
        }

        @Test
        @DisplayName("non-positive geometric factor outside r_s is flagged")
        void geometricDivergence() {
            ModelParameters p = ModelParameters.CANONICAL;
            ModelParameters heavyCorrection = new ModelParameters(
                p.blendLow(), p.blendHigh(), p.photonSphereMax(), p.weakStart(), p.xiMax(),
                p.deltaA(), p.deltaAlpha(), 50.0, p.logMassMin(), p.logMassMax(),
                p.powerLawAlpha(), p.powerLawBeta(), p.intersectionROverRs());
            RunConfig geometric = RunConfig.of(CONFIG.constants(), heavyCorrection,
                XiMode.STRONG, RedshiftMode.GEOMETRIC_HINT);
            CalculationResult r = ObjectCalculator.calculate(
                CelestialObject.of("near", 10.0, 1.1 * RS_10_KM), geometric);
            assertEquals(ResultStatus.DEGENERATE_GEOMETRY, r.status());
            assertEquals(Double.POSITIVE_INFINITY, r.zSszGrav());
            assertTrue(Double.isFinite(r.zGr()));
            assertTrue(r.diagnostic().contains("geometric"));
        }

        @Test
        @DisplayName("divergent geometric hint against a finite GR prediction: GR wins")
        void geometricDivergenceWithObservation() {
            ModelParameters p = ModelParameters.CANONICAL;
            ModelParameters heavyCorrection = new ModelParameters(
                p.blendLow(), p.blendHigh(), p.photonSphereMax(), p.weakStart(), p.xiMax(),
                p.deltaA(), p.deltaAlpha(), 50.0, p.logMassMin(), p.logMassMax(),
                p.powerLawAlpha(), p.powerLawBeta(), p.intersectionROverRs());
            RunConfig geometric = RunConfig.of(CONFIG.constants(), heavyCorrection,
                XiMode.STRONG, RedshiftMode.GEOMETRIC_HINT);
            CalculationResult r = ObjectCalculator.calculate(
                CelestialObject.observed("near", 10.0, 1.1 * RS_10_KM, 0.0, 2.0), geometric);
            assertEquals(ResultStatus.DEGENERATE_GEOMETRY, r.status());
            assertEquals(Double.POSITIVE_INFINITY, r.zSszTotal());
            assertTrue(Double.isFinite(r.zGrSr()));
            assertEquals(Winner.GR, r.winner());
        }
    }
}
