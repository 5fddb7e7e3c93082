package com.segcalc.validation.golden;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.segcalc.common.model.CelestialObject;
import com.segcalc.common.model.Winner;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the golden reference catalogue, bound by header name.
 */
@Data
@NoArgsConstructor
public class GoldenRecord {

    @JsonProperty("name")
    private String name;

    @JsonProperty("mass_msun")
    private double massMsun;

    @JsonProperty("radius_km")
    private double radiusKm;

    @JsonProperty("velocity_kms")
    private Double velocityKms;

    @JsonProperty("z_obs")
    private Double observedRedshift;

    @JsonProperty("z_ssz_ref")
    private double sszReference;

    @JsonProperty("z_grsr_ref")
    private double grSrReference;

    @JsonProperty("winner_ref")
    private String winnerReference;

    /** Validated input for the engine; throws on out-of-range values. */
    public CelestialObject toCelestialObject() {
        return new CelestialObject(name, massMsun, radiusKm,
            velocityKms == null ? 0.0 : velocityKms, observedRedshift);
    }

    public Winner referenceWinner() {
        return Winner.fromLabel(winnerReference);
    }
}
