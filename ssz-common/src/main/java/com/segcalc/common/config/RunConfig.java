package com.segcalc.common.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.segcalc.common.model.RedshiftMode;
import com.segcalc.common.model.XiMode;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Frozen configuration snapshot for one calculation batch.
 *
 * <p>Created once and passed explicitly to every engine call. There is no
 * process-wide "current run"; two batches with different configurations can
 * run side by side.
 *
 * <p>{@code runId} is derived from every field value (FNV-1a over the raw bits),
 * so the same configuration yields the same id on any JVM.
 */
public record RunConfig(
    @JsonProperty("run_id")           String runId,
    @JsonProperty("version")          String version,
    @JsonProperty("constants")        PhysicalConstants constants,
    @JsonProperty("parameters")       ModelParameters parameters,
    @JsonProperty("xi_mode")          XiMode xiMode,
    @JsonProperty("redshift_mode")    RedshiftMode redshiftMode,
    @JsonProperty("bootstrap_seed")   long bootstrapSeed,
    @JsonProperty("bootstrap_rounds") int bootstrapRounds
) {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final long DEFAULT_BOOTSTRAP_SEED = 42L;
    public static final int DEFAULT_BOOTSTRAP_ROUNDS = 2000;

    public RunConfig {
        Objects.requireNonNull(constants, "constants");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(xiMode, "xiMode");
        Objects.requireNonNull(redshiftMode, "redshiftMode");
        if (version == null || version.isBlank()) {
            version = DEFAULT_VERSION;
        }
        if (bootstrapRounds < 0) {
            throw new IllegalArgumentException("bootstrap rounds must be >= 0, got " + bootstrapRounds);
        }
        if (runId == null || runId.isBlank()) {
            runId = deriveRunId(version, constants, parameters, xiMode, redshiftMode,
                                bootstrapSeed, bootstrapRounds);
        }
    }

    /** Canonical constants and parameters, AUTO Ξ, Δ(M) redshift. */
    public static RunConfig canonical() {
        return of(PhysicalConstants.CODATA_2018, ModelParameters.CANONICAL, XiMode.AUTO, RedshiftMode.DELTA_M);
    }

    public static RunConfig of(PhysicalConstants constants, ModelParameters parameters,
                               XiMode xiMode, RedshiftMode redshiftMode) {
        return new RunConfig(null, DEFAULT_VERSION, constants, parameters, xiMode, redshiftMode,
                             DEFAULT_BOOTSTRAP_SEED, DEFAULT_BOOTSTRAP_ROUNDS);
    }

    /** Same run with another Ξ mode; every other field is kept and the run id re-derived. */
    public RunConfig withXiMode(XiMode mode) {
        return new RunConfig(null, version, constants, parameters, mode, redshiftMode,
                             bootstrapSeed, bootstrapRounds);
    }

    public RunConfig withRedshiftMode(RedshiftMode mode) {
        return new RunConfig(null, version, constants, parameters, xiMode, mode,
                             bootstrapSeed, bootstrapRounds);
    }

    /** One-line banner, e.g. {@code Run: run_1a2b3c4d | φ=1.618034 | Mode: auto/delta_m}. */
    public String summaryShort() {
        return String.format(Locale.ROOT, "Run: %s | φ=%.6f | Mode: %s/%s",
            runId, constants.phi(), xiMode.label(), redshiftMode.label());
    }

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static String deriveRunId(String version, PhysicalConstants constants, ModelParameters parameters,
                                      XiMode xiMode, RedshiftMode redshiftMode,
                                      long bootstrapSeed, int bootstrapRounds) {
        long h = FNV_OFFSET;
        h = mix(h, version);
        for (double v : new double[] {
                constants.gravitationalConstant(), constants.speedOfLight(),
                constants.solarMass(), constants.phi(),
                parameters.blendLow(), parameters.blendHigh(), parameters.photonSphereMax(),
                parameters.weakStart(), parameters.xiMax(),
                parameters.deltaA(), parameters.deltaAlpha(), parameters.deltaB(),
                parameters.logMassMin(), parameters.logMassMax(),
                parameters.powerLawAlpha(), parameters.powerLawBeta(),
                parameters.intersectionROverRs()}) {
            h = mix(h, Double.doubleToLongBits(v));
        }
        h = mix(h, xiMode.label());
        h = mix(h, redshiftMode.label());
        h = mix(h, bootstrapSeed);
        h = mix(h, bootstrapRounds);
        return String.format(Locale.ROOT, "run_%08x", (int) (h ^ (h >>> 32)));
    }

    private static long mix(long h, long value) {
        for (int i = 0; i < Long.BYTES; i++) {
            h ^= (value >>> (8 * i)) & 0xffL;
            h *= FNV_PRIME;
        }
        return h;
    }

    // length suffix keeps ("ab", "c") and ("a", "bc") apart
    private static long mix(long h, String value) {
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            h ^= b & 0xffL;
            h *= FNV_PRIME;
        }
        return mix(h, value.length());
    }
}
