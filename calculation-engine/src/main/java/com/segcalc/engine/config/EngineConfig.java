package com.segcalc.engine.config;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.RedshiftMode;
import com.segcalc.common.model.XiMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Freezes {@code segcalc.*} properties into one immutable {@link RunConfig}.
 * Defaults are the canonical values, so an empty configuration reproduces
 * {@link RunConfig#canonical()}.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    // ── physical constants ────────────────────────────────────────────────
    @Value("${segcalc.constants.gravitational-constant:6.67430e-11}")
    private double gravitationalConstant;

    @Value("${segcalc.constants.speed-of-light:299792458.0}")
    private double speedOfLight;

    @Value("${segcalc.constants.solar-mass:1.98847e30}")
    private double solarMass;

    // ── model parameters ──────────────────────────────────────────────────
    @Value("${segcalc.model.blend-low:1.8}")
    private double blendLow;

    @Value("${segcalc.model.blend-high:2.2}")
    private double blendHigh;

    @Value("${segcalc.model.photon-sphere-max:3.0}")
    private double photonSphereMax;

    @Value("${segcalc.model.weak-start:10.0}")
    private double weakStart;

    @Value("${segcalc.model.xi-max:1.0}")
    private double xiMax;

    @Value("${segcalc.model.delta-a:98.01}")
    private double deltaA;

    @Value("${segcalc.model.delta-alpha:2.7177e4}")
    private double deltaAlpha;

    @Value("${segcalc.model.delta-b:1.96}")
    private double deltaB;

    @Value("${segcalc.model.log-mass-min:10.0}")
    private double logMassMin;

    @Value("${segcalc.model.log-mass-max:42.0}")
    private double logMassMax;

    @Value("${segcalc.model.power-law-alpha:0.3187}")
    private double powerLawAlpha;

    @Value("${segcalc.model.power-law-beta:0.9821}")
    private double powerLawBeta;

    @Value("${segcalc.model.intersection-r-over-rs:1.386562}")
    private double intersectionROverRs;

    // ── run ───────────────────────────────────────────────────────────────
    @Value("${segcalc.run.version:1.0.0}")
    private String version;

    @Value("${segcalc.run.xi-mode:auto}")
    private String xiMode;

    @Value("${segcalc.run.redshift-mode:delta_m}")
    private String redshiftMode;

    @Value("${segcalc.run.bootstrap-seed:42}")
    private long bootstrapSeed;

    @Value("${segcalc.run.bootstrap-rounds:2000}")
    private int bootstrapRounds;

    @Bean
    public RunConfig runConfig() {
        PhysicalConstants constants = new PhysicalConstants(
            gravitationalConstant, speedOfLight, solarMass, PhysicalConstants.GOLDEN_RATIO);
        ModelParameters parameters = new ModelParameters(
            blendLow, blendHigh, photonSphereMax, weakStart, xiMax,
            deltaA, deltaAlpha, deltaB, logMassMin, logMassMax,
            powerLawAlpha, powerLawBeta, intersectionROverRs);
        RunConfig config = new RunConfig(null, version, constants, parameters,
            XiMode.fromLabel(xiMode), RedshiftMode.fromLabel(redshiftMode),
            bootstrapSeed, bootstrapRounds);
        log.info("[EngineConfig] {} version={}", config.summaryShort(), config.version());
        return config;
    }
}
