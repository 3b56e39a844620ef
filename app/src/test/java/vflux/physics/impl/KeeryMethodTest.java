package vflux.physics.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.flux.UndefinedReason;
import vflux.domain.medium.ThermalMedium;

import static org.junit.jupiter.api.Assertions.*;

class KeeryMethodTest {

    private static final ThermalMedium SAND = ThermalMedium.saturatedSand();
    private static final double ALPHA = 8.0e-7;
    private static final double DZ = 0.1;
    private static final double OMEGA = 2 * Math.PI / 86400.0;

    private final KeeryMethod method = new KeeryMethod();

    @Test
    @DisplayName("Con Δφ = (βΔz)² los términos de fase se anulan: v = (2α/Δz)·ln(Ar)")
    void phaseTermsCancel() {
        // ARRANGE
        double lag = OMEGA * DZ * DZ / (2.0 * ALPHA);
        SensorPairObservation observation = new SensorPairObservation(DZ, 3.0, 2.0, Math.log(1.5), lag);

        // ACT
        FluxEstimate estimate = method.estimate(observation, SAND, OMEGA);

        // ASSERT
        assertEquals(2.0 * ALPHA / DZ * Math.log(1.5), estimate.velocity(), 1e-15);
        assertTrue(estimate.provisional(), "Keery se informa como provisional");
    }

    @Test
    @DisplayName("Usa el desfase total, sin restar la componente conductiva")
    void usesRawTotalLag() {
        double lag = 0.4828;
        double beta = Math.sqrt(OMEGA / (2.0 * ALPHA));
        double expected = (2.0 * ALPHA / DZ) * (Math.log(1.2) + beta * DZ - lag / (beta * DZ));

        double v = KeeryMethod.velocity(3.0, 2.5, 0.0, lag, DZ, ALPHA, OMEGA);

        assertEquals(expected, v, 1e-15);
    }

    @Test
    @DisplayName("Un desfase negativo se pliega a [0, 2π) antes de aplicar la fórmula")
    void negativePhaseDifference_isFolded() {
        double folded = KeeryMethod.velocity(3.0, 2.5, 0.2, 0.1, DZ, ALPHA, OMEGA);
        double explicit = KeeryMethod.velocityFromLag(3.0, 2.5, 2 * Math.PI - 0.1, DZ, ALPHA, OMEGA);

        assertEquals(explicit, folded, 1e-15);
    }

    @Test
    @DisplayName("Amplitudes no positivas: indefinido")
    void nonPositiveAmplitude_isUndefined() {
        SensorPairObservation observation = new SensorPairObservation(DZ, 0.0, 2.0, Double.NaN, 0.4);

        FluxEstimate estimate = method.estimate(observation, SAND, OMEGA);

        assertEquals(UndefinedReason.NON_POSITIVE_AMPLITUDE, estimate.undefinedReason());
        assertTrue(Double.isNaN(KeeryMethod.velocity(3.0, -1.0, 0.0, 0.4, DZ, ALPHA, OMEGA)));
    }
}
