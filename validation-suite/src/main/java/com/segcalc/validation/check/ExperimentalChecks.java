package com.segcalc.validation.check;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CalculationResult;
import com.segcalc.common.model.CelestialObject;
import com.segcalc.common.model.Regime;
import com.segcalc.common.physics.PowerLaw;
import com.segcalc.common.physics.Ppn;
import com.segcalc.common.physics.Schwarzschild;
import com.segcalc.common.physics.SegmentDensity;
import com.segcalc.common.physics.TimeDilation;
import com.segcalc.validation.model.ValidationCategory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Cross-checks against measured clock shifts, the classic solar-system tests
 * (light deflection, Shapiro delay, Mercury's perihelion) and known compact objects.
 *
 * <p>Earth-scale shifts use the weak form of Ξ; height differences are taken as
 * differences of Ξ rather than of D so that values near 1e-15 keep their digits.
 */
@Component
@Order(5)
public class ExperimentalChecks implements ValidationCheckGroup {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private static final double H_GPS = 20_200e3;
    private static final double H_POUND_REBKA = 22.5;
    private static final double H_NIST = 0.33;
    private static final double H_TOKYO_SKYTREE = 450.0;

    private static final double R_SUN = 696_340e3;
    private static final double SOLAR_DEFLECTION_ARCSEC = 1.75;
    private static final double MERCURY_PERIHELION_ARCSEC = 42.98;
    private static final double MERCURY_A_AU = 0.387098;
    private static final double MERCURY_E = 0.205630;
    private static final double MERCURY_T_YEARS = 0.240846;
    // Cassini 2002 conjunction: γ − 1 = (2.1 ± 2.3)·1e-5
    private static final double CASSINI_GAMMA_BOUND = 2.3e-5;
    private static final double CASSINI_DISTANCE_AU = 8.43;
    private static final double CASSINI_IMPACT_RSUN = 1.6;

    private static final List<CelestialObject> PULSARS = List.of(
        CelestialObject.of("PSR J0740+6620", 2.08, 13.7),
        CelestialObject.of("PSR J0348+0432", 2.01, 13.0),
        CelestialObject.of("PSR J0030+0451", 1.44, 13.0));

    @Override
    public ValidationCategory category() {
        return ValidationCategory.EXPERIMENTAL;
    }

    @Override
    public void run(ValidationContext context, CheckRecorder recorder) {
        RunConfig config = context.config();
        PhysicalConstants k = config.constants();
        ModelParameters params = config.parameters();
        double rsEarth = Schwarzschild.radius(CoreFormulaChecks.M_EARTH, k);
        double rEarth = CoreFormulaChecks.R_EARTH;

        // ── clocks near Earth ─────────────────────────────────────────────
        recorder.absolute("exp.gps_us_per_day", 45.7, 1.0, () -> {
            double gain = dilationGain(rEarth, rEarth + H_GPS, rsEarth);
            return gain * SECONDS_PER_DAY * 1e6;
        });

        recorder.relative("exp.pound_rebka", 2.46e-15, 0.05, () -> {
            double xiLow = SegmentDensity.weak(rEarth, rsEarth);
            double xiHigh = SegmentDensity.weak(rEarth + H_POUND_REBKA, rsEarth);
            return (xiLow - xiHigh) / (1.0 + xiHigh);
        });

        recorder.relative("exp.nist_33cm", 4e-17, 0.5,
            () -> SegmentDensity.weak(rEarth, rsEarth) * H_NIST / rEarth);

        recorder.verify("exp.tokyo_skytree_ns_per_day", "> 0", "strict", () -> {
            double ns = dilationGain(rEarth, rEarth + H_TOKYO_SKYTREE, rsEarth) * SECONDS_PER_DAY * 1e9;
            return Evaluation.of(ns > 0.0, String.format(Locale.ROOT, "%.3f ns/day", ns));
        });

        recorder.absolute("exp.earth_ssz_matches_gr", 0.0, 1e-10, () -> {
            double dSsz = TimeDilation.ssz(SegmentDensity.weak(rEarth, rsEarth));
            double dGr = TimeDilation.gr(rEarth, rsEarth);
            return Math.abs(dSsz - dGr) / dGr;
        });

        // ── neutron stars ─────────────────────────────────────────────────
        for (CelestialObject pulsar : PULSARS) {
            String id = "exp.ns." + pulsar.name().replace("PSR ", "").toLowerCase(Locale.ROOT);
            recorder.verify(id + ".regime", "not weak", "exact", () -> {
                Regime regime = context.calculator().calculate(pulsar, config).regime();
                return Evaluation.of(regime != Regime.WEAK, regime.label());
            });
            recorder.verify(id + ".correction", "z_ssz > z_gr", "strict", () -> {
                CalculationResult r = context.calculator().calculate(pulsar, config);
                double increase = 100.0 * (r.zSszGrav() - r.zGr()) / r.zGr();
                return Evaluation.of(increase > 0.0, String.format(Locale.ROOT, "+%.4f%%", increase));
            });
        }

        // ── power law ─────────────────────────────────────────────────────
        double eSun = energy(1.0, 696_340.0, k, params);
        double eWhiteDwarf = energy(1.0, 6_000.0, k, params);
        double eNeutronStar = energy(2.0, 13.0, k, params);
        recorder.within("exp.power_law.sun", 1.0, 1.0001, () -> eSun);
        recorder.within("exp.power_law.neutron_star", 1.1, Double.POSITIVE_INFINITY, () -> eNeutronStar);
        recorder.verify("exp.power_law.scaling", "E_sun < E_wd < E_ns", "ordering", () -> Evaluation.of(
            eSun < eWhiteDwarf && eWhiteDwarf < eNeutronStar,
            String.format(Locale.ROOT, "%.6f < %.6f < %.6f", eSun, eWhiteDwarf, eNeutronStar)));

        // ── solar-system PPN tests ────────────────────────────────────────
        double mSun = k.solarMass();
        double au = Ppn.ASTRONOMICAL_UNIT;
        recorder.relative("exp.ppn.solar_deflection_arcsec", SOLAR_DEFLECTION_ARCSEC, 0.01,
            () -> Ppn.lightDeflectionArcsec(mSun, R_SUN, k));
        recorder.relative("exp.ppn.mercury_perihelion_arcsec_per_century", MERCURY_PERIHELION_ARCSEC, 0.01,
            () -> Ppn.perihelionPrecessionArcsecPerCentury(mSun, MERCURY_A_AU * au, MERCURY_E, MERCURY_T_YEARS, k));
        recorder.within("exp.ppn.shapiro_grazing_sun_us", 200.0, 300.0,
            () -> Ppn.shapiroDelay(mSun, au, au, R_SUN, Ppn.GAMMA, k) * 1e6);
        recorder.absolute("exp.ppn.cassini_gamma", 1.0, CASSINI_GAMMA_BOUND, () -> {
            double r2 = CASSINI_DISTANCE_AU * au;
            double b = CASSINI_IMPACT_RSUN * R_SUN;
            double delay = Ppn.shapiroDelay(mSun, au, r2, b, Ppn.GAMMA, k);
            return Ppn.gammaFromShapiroDelay(delay, mSun, au, r2, b, k);
        });

        recorder.absolute("exp.intersection.d_star", 0.528007, 0.01, () -> TimeDilation.atIntersection(config));
        recorder.verify("exp.intersection.mass_independent", "D_SSZ ≈ D_GR at r*", "rel 0.01", () -> {
            for (double massMsun : new double[] {1.0, 10.0, 100.0, 1e6}) {
                double rs = Schwarzschild.radiusForSolarMasses(massMsun, k);
                double r = params.intersectionROverRs() * rs;
                double dSsz = TimeDilation.ssz(SegmentDensity.strong(r, rs, k.phi(), params.xiMax()));
                double dGr = TimeDilation.gr(r, rs);
                if (Math.abs(dSsz - dGr) / dGr > 0.01) {
                    return Evaluation.of(false, "M=" + massMsun + " M☉ D_SSZ=" + dSsz + " D_GR=" + dGr);
                }
            }
            return Evaluation.of(true, "1, 10, 100, 1e6 M☉");
        });
    }

    /** D(upper) − D(lower) in the weak field, formed from the Ξ difference. */
    private static double dilationGain(double lower, double upper, double rs) {
        double xiLow = SegmentDensity.weak(lower, rs);
        double xiHigh = SegmentDensity.weak(upper, rs);
        return (xiLow - xiHigh) / ((1.0 + xiLow) * (1.0 + xiHigh));
    }

    private static double energy(double massMsun, double radiusKm, PhysicalConstants k, ModelParameters params) {
        double rs = Schwarzschild.radiusForSolarMasses(massMsun, k);
        return PowerLaw.energyNormalized(rs, radiusKm * 1000.0, params);
    }
}
