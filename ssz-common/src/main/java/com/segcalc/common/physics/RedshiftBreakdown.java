package com.segcalc.common.physics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.segcalc.common.model.RedshiftMode;

/**
 * All redshift components for one body.
 *
 * @param zGr               GR gravitational redshift; NaN inside r_s
 * @param zDoppler          special-relativistic Doppler redshift
 * @param zGrSr             GR gravitational combined with Doppler
 * @param zSszGrav          SSZ gravitational redshift for {@code mode}
 * @param zSszTotal         SSZ gravitational combined with Doppler
 * @param correctionPercent Δ(M) applied, 0 in the weak field
 */
public record RedshiftBreakdown(
    @JsonProperty("z_gr")        double zGr,
    @JsonProperty("z_doppler")   double zDoppler,
    @JsonProperty("z_grsr")      double zGrSr,
    @JsonProperty("z_ssz_grav")  double zSszGrav,
    @JsonProperty("z_ssz_total") double zSszTotal,
    @JsonProperty("delta_m_pct") double correctionPercent,
    @JsonProperty("mode")        RedshiftMode mode
) {

    public boolean isDegenerate() {
        return Double.isNaN(zGr);
    }
}
