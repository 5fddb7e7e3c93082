package com.segcalc.common.physics;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.Regime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schwarzschild radius, dual velocities, power law and radial sweeps.
 */
class PhysicsHelpersTest {

    private static final PhysicalConstants K = PhysicalConstants.CODATA_2018;
    private static final ModelParameters P = ModelParameters.CANONICAL;

    @Nested
    @DisplayName("Schwarzschild")
    class SchwarzschildTests {

        @Test
        @DisplayName("r_s(Sun) ≈ 2953.34 m")
        void sun() {
            assertEquals(2953.3393820668784, Schwarzschild.radiusForSolarMasses(1.0, K), 1e-6);
        }

        @Test
        @DisplayName("linear in mass")
        void linear() {
            assertEquals(10 * Schwarzschild.radiusForSolarMasses(1.0, K),
                Schwarzschild.radiusForSolarMasses(10.0, K), 1e-6);
        }

        @Test
        @DisplayName("massless source: r_s = 0, x = +∞")
        void massless() {
            assertEquals(0.0, Schwarzschild.radius(0.0, K));
            assertEquals(Double.POSITIVE_INFINITY, Schwarzschild.normalizedRadius(1.0, 0.0));
        }
    }

    @Nested
    @DisplayName("DualVelocity")
    class DualVelocityTests {

        @Test
        @DisplayName("v_esc · v_fall = c² at 2, 5, 10, 100 r_s")
        void productIsCSquared() {
            double c = K.speedOfLight();
            double rs = Schwarzschild.radiusForSolarMasses(1.0, K);
            for (double x : new double[] {2.0, 5.0, 10.0, 100.0}) {
                double product = DualVelocity.escape(x * rs, rs, c) * DualVelocity.fall(x * rs, rs, c);
                assertEquals(0.0, Math.abs(product - c * c) / (c * c), 1e-10, "x=" + x);
            }
        }

        @Test
        @DisplayName("escape speed equals c at r_s and fall speed exceeds c outside")
        void horizon() {
            double c = K.speedOfLight();
            assertEquals(c, DualVelocity.escape(1.0, 1.0, c), 1e-6);
            assertTrue(DualVelocity.fall(4.0, 1.0, c) > c);
        }
    }

    @Nested
    @DisplayName("PowerLaw")
    class PowerLawTests {

        @Test
        @DisplayName("Sun: E_norm barely above 1")
        void sun() {
            double rs = Schwarzschild.radiusForSolarMasses(1.0, K);
            double e = PowerLaw.energyNormalized(rs, 696_340e3, P);
            assertTrue(e > 1.0 && e < 1.00001, "E_norm=" + e);
        }

        @Test
        @DisplayName("neutron star: a few percent excess")
        void neutronStar() {
            double rs = Schwarzschild.radiusForSolarMasses(1.4, K);
            double excess = PowerLaw.energyExcessPercent(rs, 12e3, P);
            assertTrue(excess > 5.0 && excess < 20.0, "excess=" + excess);
        }

        @Test
        @DisplayName("increases with compactness")
        void monotone() {
            assertTrue(PowerLaw.energyNormalized(1.0, 3.0, P) > PowerLaw.energyNormalized(1.0, 30.0, P));
        }
    }

    @Nested
    @DisplayName("RadialSweep")
    class RadialSweepTests {

        private final RadialSweep sweep = RadialSweep.logSpaced(1.0, 0.1, 1e4, 400, RunConfig.canonical());

        @Test
        @DisplayName("endpoints and size")
        void shape() {
            double[] x = sweep.normalizedRadii();
            assertEquals(400, sweep.size());
            assertEquals(0.1, x[0], 1e-15);
            assertEquals(1e4, x[399]);
        }

        @Test
        @DisplayName("identity holds over the sweep")
        void identity() {
            assertTrue(sweep.maxIdentityError() < 1e-12);
        }

        @Test
        @DisplayName("regimes run from very_close to weak")
        void regimes() {
            Regime[] regimes = sweep.regimes();
            assertEquals(Regime.VERY_CLOSE, regimes[0]);
            assertEquals(Regime.WEAK, regimes[regimes.length - 1]);
        }

        @Test
        @DisplayName("accessors return copies")
        void accessorsReturnCopies() {
            sweep.segmentDensities()[0] = -1.0;
            assertTrue(sweep.segmentDensities()[0] >= 0.0);
        }

        @Test
        @DisplayName("rejects bad ranges")
        void badRange() {
            RunConfig config = RunConfig.canonical();
            assertThrows(IllegalArgumentException.class, () -> RadialSweep.logSpaced(1.0, 10.0, 1.0, 5, config));
            assertThrows(IllegalArgumentException.class, () -> RadialSweep.logSpaced(0.0, 1.0, 10.0, 5, config));
            assertThrows(IllegalArgumentException.class, () -> RadialSweep.logSpaced(1.0, 1.0, 10.0, 1, config));
        }
    }
}
