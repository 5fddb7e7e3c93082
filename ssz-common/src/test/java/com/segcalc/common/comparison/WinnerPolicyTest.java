package com.segcalc.common.comparison;

import com.segcalc.common.model.ObservationComparison;
import com.segcalc.common.model.Winner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WinnerPolicyTest {

    @Test
    @DisplayName("smaller absolute residual wins")
    void smallerWins() {
        assertEquals(Winner.SSZ, WinnerPolicy.decide(0.001, -0.004));
        assertEquals(Winner.GR, WinnerPolicy.decide(-0.01, 0.002));
    }

    @Test
    @DisplayName("residuals equal in magnitude but opposite in sign tie")
    void oppositeSignsTie() {
        assertEquals(Winner.TIE, WinnerPolicy.decide(0.003, -0.003));
    }

    @Test
    @DisplayName("differences within the relative epsilon tie")
    void withinEpsilon() {
        assertEquals(Winner.TIE, WinnerPolicy.decide(0.1, 0.1 + 1e-14));
        assertEquals(Winner.SSZ, WinnerPolicy.decide(0.1, 0.1 + 1e-9));
    }

    @Test
    @DisplayName("two zero residuals tie via the epsilon floor")
    void zeroResiduals() {
        assertEquals(Winner.TIE, WinnerPolicy.decide(0.0, 0.0));
        assertEquals(Winner.TIE, WinnerPolicy.decide(0.0, 1e-33));
    }

    @Test
    @DisplayName("NaN residual loses; two NaNs tie")
    void nanResiduals() {
        assertEquals(Winner.GR, WinnerPolicy.decide(Double.NaN, 0.5));
        assertEquals(Winner.SSZ, WinnerPolicy.decide(0.5, Double.NaN));
        assertEquals(Winner.TIE, WinnerPolicy.decide(Double.NaN, Double.NaN));
    }

    @Test
    @DisplayName("infinite residual loses against a finite one")
    void infiniteAgainstFinite() {
        assertEquals(Winner.GR, WinnerPolicy.decide(Double.POSITIVE_INFINITY, 0.3166));
        assertEquals(Winner.GR, WinnerPolicy.decide(Double.NEGATIVE_INFINITY, 1e6));
        assertEquals(Winner.SSZ, WinnerPolicy.decide(0.002, Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("infinite and NaN residuals are both missing and tie")
    void infiniteAgainstNan() {
        assertEquals(Winner.TIE, WinnerPolicy.decide(Double.POSITIVE_INFINITY, Double.NaN));
        assertEquals(Winner.TIE, WinnerPolicy.decide(Double.NaN, Double.NEGATIVE_INFINITY));
        assertEquals(Winner.TIE, WinnerPolicy.decide(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("repeated calls return the same winner")
    void deterministic() {
        Winner first = WinnerPolicy.decide(0.0123, 0.0456);
        for (int i = 0; i < 5; i++) {
            assertSame(first, WinnerPolicy.decide(0.0123, 0.0456));
        }
    }

    @Test
    @DisplayName("compare() signs residuals as prediction − observation")
    void compare() {
        ObservationComparison c = WinnerPolicy.compare(0.30, 0.31, 0.27);
        assertEquals(0.01, c.residualSsz(), 1e-15);
        assertEquals(-0.03, c.residualGr(), 1e-15);
        assertEquals(Winner.SSZ, c.winner());
        assertEquals(0.30, c.observedRedshift());
    }
}
