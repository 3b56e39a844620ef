package vflux.physics.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.flux.UndefinedReason;
import vflux.domain.medium.ThermalMedium;
import vflux.exception.PhysicalDomainException;

import static org.junit.jupiter.api.Assertions.*;

class HatchAmplitudeMethodTest {

    private static final ThermalMedium SAND = ThermalMedium.saturatedSand();
    private static final double ALPHA = 8.0e-7;
    private static final double DZ = 0.1;
    private static final double OMEGA = 2 * Math.PI / 86400.0;

    private final HatchAmplitudeMethod method = new HatchAmplitudeMethod();

    private static SensorPairObservation observation(double bs, double bd, double dphi) {
        double logRatio = (bs > 0 && bd > 0) ? Math.log(bs / bd) : Double.NaN;
        return new SensorPairObservation(DZ, bs, bd, logRatio, dphi);
    }

    @Test
    @DisplayName("Ar = 1.5: v = (α/Δz)·ln(1.5)")
    void estimate_attenuatedSignal() {
        FluxEstimate estimate = method.estimate(observation(3.0, 2.0, 0.3), SAND, OMEGA);

        assertTrue(estimate.isDefined());
        assertEquals(FluxMethodType.HATCH_AMPLITUDE, estimate.method());
        assertEquals(ALPHA / DZ * Math.log(1.5), estimate.velocity(), 1e-18);
        assertEquals(3.2437e-6, estimate.velocity(), 1e-9);
        assertFalse(estimate.fallbackUsed());
    }

    @Test
    @DisplayName("Ar ≤ 1 es indefinido (NaN), nunca cero ni negativo")
    void estimate_ratioNotAboveOne_isUndefined() {
        FluxEstimate amplified = method.estimate(observation(2.0, 3.0, 0.3), SAND, OMEGA);
        FluxEstimate equal = method.estimate(observation(2.0, 2.0, 0.3), SAND, OMEGA);

        assertTrue(Double.isNaN(amplified.velocity()));
        assertEquals(UndefinedReason.AMPLITUDE_RATIO_NOT_ABOVE_ONE, amplified.undefinedReason());
        assertTrue(Double.isNaN(equal.velocity()));
        assertTrue(Double.isNaN(HatchAmplitudeMethod.velocity(2.0, 3.0, DZ, ALPHA)));
    }

    @Test
    @DisplayName("Amplitud nula o negativa: NON_POSITIVE_AMPLITUDE")
    void estimate_nonPositiveAmplitude_isUndefined() {
        FluxEstimate estimate = method.estimate(observation(3.0, 0.0, 0.3), SAND, OMEGA);

        assertEquals(UndefinedReason.NON_POSITIVE_AMPLITUDE, estimate.undefinedReason());
        assertTrue(Double.isNaN(HatchAmplitudeMethod.velocity(-1.0, 2.0, DZ, ALPHA)));
    }

    @Test
    @DisplayName("Δz o α no positivos lanzan PhysicalDomainException")
    void velocity_invalidDomain_throws() {
        assertThrows(PhysicalDomainException.class, () -> HatchAmplitudeMethod.velocity(3.0, 2.0, 0.0, ALPHA));
        assertThrows(PhysicalDomainException.class, () -> HatchAmplitudeMethod.velocity(3.0, 2.0, DZ, -ALPHA));
        assertThrows(PhysicalDomainException.class, () -> method.estimate(observation(3.0, 2.0, 0.3), SAND, 0.0));
    }

    @Test
    @DisplayName("El nombre del componente es el del tipo de método")
    void name_comesFromType() {
        assertEquals("Hatch-Amplitud", method.getName());
        assertFalse(method.getDescription().isBlank());
    }
}
