package com.segcalc.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable per-object output of the calculation engine.
 *
 * <p>Lengths are in metres, redshifts are dimensionless, percentages are in %.
 * {@code comparison} is null when the input carried no observed redshift.
 * Rows with {@link ResultStatus#FAILED} carry NaN scalars and a diagnostic.
 */
public record CalculationResult(
    @JsonProperty("name")                String name,
    @JsonProperty("mass_msun")           double massMsun,
    @JsonProperty("radius_km")           double radiusKm,
    @JsonProperty("velocity_kms")        double velocityKms,
    @JsonProperty("r_s_m")               double schwarzschildRadius,
    @JsonProperty("r_over_rs")           double normalizedRadius,
    @JsonProperty("regime")              Regime regime,
    @JsonProperty("xi")                  double xi,
    @JsonProperty("D_ssz")               double dilationSsz,
    @JsonProperty("D_gr")                double dilationGr,
    @JsonProperty("delta_D")             double dilationDifference,
    @JsonProperty("delta_D_pct")         double dilationDifferencePercent,
    @JsonProperty("z_gr")                double zGr,
    @JsonProperty("z_doppler")           double zDoppler,
    @JsonProperty("z_grsr")              double zGrSr,
    @JsonProperty("z_ssz_grav")          double zSszGrav,
    @JsonProperty("z_ssz_total")         double zSszTotal,
    @JsonProperty("delta_m_pct")         double correctionPercent,
    @JsonProperty("compactness")         double compactness,
    @JsonProperty("E_norm")              double energyNormalized,
    @JsonProperty("D_intersection")      double dilationAtIntersection,
    @JsonProperty("xi_mode")             XiMode xiMode,
    @JsonProperty("redshift_mode")       RedshiftMode redshiftMode,
    @JsonProperty("status")              ResultStatus status,
    @JsonProperty("diagnostic")          String diagnostic,
    @JsonProperty("run_id")              String runId,
    @JsonProperty("comparison")          ObservationComparison comparison
) {

    /** Placeholder row for an input that could not be computed. Keeps the batch row count intact. */
    public static CalculationResult failed(CelestialObject object, String runId, String diagnostic) {
        double nan = Double.NaN;
        return new CalculationResult(
            object.name(), object.massMsun(), object.radiusKm(), object.velocityKms(),
            nan, nan, null, nan, nan, nan, nan, nan,
            nan, nan, nan, nan, nan, nan, nan, nan, nan,
            null, null, ResultStatus.FAILED, diagnostic, runId, null);
    }

    @JsonIgnore
    public boolean hasObservation() {
        return comparison != null;
    }

    /** Winner against the observation, or null when there is none. */
    @JsonIgnore
    public Winner winner() {
        return comparison == null ? null : comparison.winner();
    }

    @JsonIgnore
    public boolean isOk() {
        return status == ResultStatus.OK;
    }
}
