package com.segcalc.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.exception.InvalidObjectException;

/**
 * One input body: mass in solar masses, radius in km, velocity in km/s.
 *
 * <p>Validation happens here, once, at the boundary:
 * <ul>
 *   <li>name must be non-blank</li>
 *   <li>mass and radius must be positive and finite</li>
 *   <li>a missing or NaN velocity becomes 0; |v| ≥ c is rejected</li>
 *   <li>a non-finite observed redshift is treated as absent; z_obs ≤ −1 is rejected</li>
 * </ul>
 *
 * @param observedRedshift nullable; presence enables the model comparison
 */
public record CelestialObject(
    @JsonProperty("name")         String name,
    @JsonProperty("mass_msun")    double massMsun,
    @JsonProperty("radius_km")    double radiusKm,
    @JsonProperty("velocity_kms") double velocityKms,
    @JsonProperty("z_obs")        Double observedRedshift
) {

    private static final double SPEED_OF_LIGHT_KMS = PhysicalConstants.CODATA_2018.speedOfLightKms();

    public CelestialObject {
        if (name == null || name.isBlank()) {
            throw new InvalidObjectException(name, "name must not be empty");
        }
        name = name.trim();
        if (!(massMsun > 0.0) || !Double.isFinite(massMsun)) {
            throw new InvalidObjectException(name, "mass must be a positive finite number, got " + massMsun);
        }
        if (!(radiusKm > 0.0) || !Double.isFinite(radiusKm)) {
            throw new InvalidObjectException(name, "radius must be a positive finite number, got " + radiusKm);
        }
        if (Double.isNaN(velocityKms)) {
            velocityKms = 0.0;
        }
        if (Math.abs(velocityKms) >= SPEED_OF_LIGHT_KMS) {
            throw new InvalidObjectException(name,
                "|velocity| must be below c (" + SPEED_OF_LIGHT_KMS + " km/s), got " + velocityKms);
        }
        if (observedRedshift != null && !Double.isFinite(observedRedshift)) {
            observedRedshift = null;
        }
        if (observedRedshift != null && observedRedshift <= -1.0) {
            throw new InvalidObjectException(name, "observed redshift must be > -1, got " + observedRedshift);
        }
    }

    /** Body at rest with no observation. */
    public static CelestialObject of(String name, double massMsun, double radiusKm) {
        return new CelestialObject(name, massMsun, radiusKm, 0.0, null);
    }

    public static CelestialObject observed(String name, double massMsun, double radiusKm,
                                           double velocityKms, double observedRedshift) {
        return new CelestialObject(name, massMsun, radiusKm, velocityKms, observedRedshift);
    }

    public boolean hasObservation() {
        return observedRedshift != null;
    }

    public double massKg(PhysicalConstants constants) {
        return massMsun * constants.solarMass();
    }

    public double radiusMeters() {
        return radiusKm * 1000.0;
    }

    public double velocityMetersPerSecond() {
        return velocityKms * 1000.0;
    }
}
