package com.segcalc.common.physics;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.model.Regime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MassCorrectionTest {

    private static final PhysicalConstants K = PhysicalConstants.CODATA_2018;
    private static final ModelParameters P = ModelParameters.CANONICAL;

    @Test
    @DisplayName("10 M☉ → Δ ≈ 1.3045 %")
    void stellarBlackHole() {
        double m = 10 * K.solarMass();
        double delta = MassCorrection.percent(Regime.STRONG, m, Schwarzschild.radius(m, K), P);
        assertEquals(1.304534291394825, delta, 1e-9);
    }

    @Test
    @DisplayName("1.4 M☉ neutron star → Δ ≈ 1.2522 %")
    void neutronStar() {
        double m = 1.4 * K.solarMass();
        double delta = MassCorrection.percent(Regime.PHOTON_SPHERE, m, Schwarzschild.radius(m, K), P);
        assertEquals(1.252234633580117, delta, 1e-9);
    }

    @Test
    @DisplayName("forced to zero in the weak regime")
    void weakGate() {
        double m = K.solarMass();
        assertEquals(0.0, MassCorrection.percent(Regime.WEAK, m, Schwarzschild.radius(m, K), P));
        assertTrue(MassCorrection.ungated(m, Schwarzschild.radius(m, K), P) > 0.0);
    }

    @Test
    @DisplayName("normalization is clamped to [0, 1]")
    void normalizationClamped() {
        assertEquals(0.0, MassCorrection.normalization(1.0, P));
        assertEquals(1.0, MassCorrection.normalization(1e50, P));
        assertEquals(0.5, MassCorrection.normalization(1e26, P), 1e-12);
    }

    @Test
    @DisplayName("raw term approaches B for stellar r_s and A + B as r_s → 0")
    void rawTerm() {
        assertEquals(P.deltaB(), MassCorrection.raw(3.0e3, P), 1e-12);
        assertEquals(P.deltaA() + P.deltaB(), MassCorrection.raw(0.0, P), 1e-12);
    }

    @Test
    @DisplayName("apply() scales multiplicatively")
    void apply() {
        assertEquals(0.2 * 1.05, MassCorrection.apply(0.2, 5.0), 1e-15);
        assertEquals(0.2, MassCorrection.apply(0.2, 0.0));
    }
}
