package com.segcalc.engine.calculator;

import com.segcalc.common.classifier.RegimeClassifier;
import com.segcalc.common.comparison.WinnerPolicy;
import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CalculationResult;
import com.segcalc.common.model.CelestialObject;
import com.segcalc.common.model.ObservationComparison;
import com.segcalc.common.model.Regime;
import com.segcalc.common.model.ResultStatus;
import com.segcalc.common.physics.PowerLaw;
import com.segcalc.common.physics.RedshiftBreakdown;
import com.segcalc.common.physics.RedshiftCalculator;
import com.segcalc.common.physics.Schwarzschild;
import com.segcalc.common.physics.SegmentDensity;
import com.segcalc.common.physics.TimeDilation;

import java.util.Locale;

/**
 * Computes every derived quantity for one {@link CelestialObject} under one {@link RunConfig}.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>r_s, x = r/r_s and the regime</li>
 *   <li>Ξ (run's Ξ mode), D_SSZ, D_GR and their difference</li>
 *   <li>redshift breakdown with the regime-gated correction</li>
 *   <li>power-law energy and D at the universal intersection</li>
 *   <li>residuals and winner, only when the object carries an observation</li>
 * </ol>
 *
 * <p>Degenerate geometry is reported through {@link ResultStatus#DEGENERATE_GEOMETRY},
 * never thrown. No logging. No side-effects.
 */
public final class ObjectCalculator {

    private ObjectCalculator() {}

    public static CalculationResult calculate(CelestialObject object, RunConfig config) {
        PhysicalConstants k = config.constants();
        ModelParameters params = config.parameters();

        double massKg = object.massKg(k);
        double r = object.radiusMeters();
        double rs = Schwarzschild.radius(massKg, k);
        double x = Schwarzschild.normalizedRadius(r, rs);
        Regime regime = RegimeClassifier.classify(r, rs, params);

        double xi = SegmentDensity.evaluate(r, rs, config);
        double dSsz = TimeDilation.ssz(xi);
        double dGr = TimeDilation.gr(r, rs);

        RedshiftBreakdown z = RedshiftCalculator.breakdown(
            massKg, r, object.velocityMetersPerSecond(), regime, config);

        ResultStatus status = ResultStatus.OK;
        String diagnostic = null;
        if (z.isDegenerate()) {
            status = ResultStatus.DEGENERATE_GEOMETRY;
            diagnostic = String.format(Locale.ROOT,
                "radius at or inside r_s (r/r_s=%.6f); GR redshift undefined", x);
        } else if (!Double.isFinite(z.zSszGrav())) {
            status = ResultStatus.DEGENERATE_GEOMETRY;
            diagnostic = String.format(Locale.ROOT,
                "geometric-hint factor is non-positive at r/r_s=%.6f", x);
        }

        ObservationComparison comparison = object.hasObservation()
            ? WinnerPolicy.compare(object.observedRedshift(), z.zSszTotal(), z.zGrSr())
            : null;

        return new CalculationResult(
            object.name(),
            object.massMsun(),
            object.radiusKm(),
            object.velocityKms(),
            rs,
            x,
            regime,
            xi,
            dSsz,
            dGr,
            TimeDilation.difference(dSsz, dGr),
            TimeDilation.differencePercent(dSsz, dGr),
            z.zGr(),
            z.zDoppler(),
            z.zGrSr(),
            z.zSszGrav(),
            z.zSszTotal(),
            z.correctionPercent(),
            PowerLaw.compactness(rs, r),
            PowerLaw.energyNormalized(rs, r, params),
            TimeDilation.atIntersection(config),
            config.xiMode(),
            config.redshiftMode(),
            status,
            diagnostic,
            config.runId(),
            comparison);
    }
}
