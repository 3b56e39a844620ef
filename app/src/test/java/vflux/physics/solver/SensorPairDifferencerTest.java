package vflux.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.flux.UndefinedReason;
import vflux.domain.medium.ThermalMedium;
import vflux.domain.signal.HarmonicSignal;
import vflux.exception.PhysicalDomainException;
import vflux.physics.impl.HatchPhaseMethod;
import vflux.utils.PhaseAngles;

import static org.junit.jupiter.api.Assertions.*;

class SensorPairDifferencerTest {

    private static final double OMEGA_HOURS = 2 * Math.PI / 24.0;

    @Test
    @DisplayName("ΔA = ln(Bs/Bd) y NaN con amplitudes no positivas")
    void amplitudeLogRatio() {
        assertEquals(Math.log(1.5), SensorPairDifferencer.amplitudeLogRatio(3.0, 2.0), 1e-15);
        assertTrue(Double.isNaN(SensorPairDifferencer.amplitudeLogRatio(0.0, 2.0)));
        assertTrue(Double.isNaN(SensorPairDifferencer.amplitudeLogRatio(3.0, -1.0)));
    }

    @Test
    @DisplayName("Δφ se normaliza a (−π, π] cuando el ajuste da la vuelta")
    void phaseDifference_isNormalized() {
        assertEquals(6.0 - 2 * Math.PI, SensorPairDifferencer.phaseDifference(0.2, 6.2), 1e-12);
        assertEquals(0.3 - 6.0 + 2 * Math.PI, SensorPairDifferencer.phaseDifference(6.0, 0.3), 1e-12);
        assertEquals(0.25, SensorPairDifferencer.phaseDifference(1.0, 1.25), 1e-12);
    }

    @Test
    @DisplayName("Fases prácticamente iguales dan retraso nulo y Hatch-Fase indefinido")
    void nearlyEqualPhases_giveZeroLag() {
        // ARRANGE
        HarmonicSignal shallow = HarmonicSignal.fromFitInHours(20.0, 3.0, OMEGA_HOURS, 1e-17);
        HarmonicSignal deep = HarmonicSignal.fromFitInHours(19.0, 2.0, OMEGA_HOURS, 0.0);

        // ACT
        SensorPairObservation observation = SensorPairDifferencer.difference(shallow, deep, 0.1);
        FluxEstimate hatchPhase = new HatchPhaseMethod().estimate(observation, ThermalMedium.saturatedSand(),
                2 * Math.PI / 86400.0);

        // ASSERT
        assertTrue(observation.phaseLag() < PhaseAngles.TWO_PI, "Retraso fuera de rango: " + observation.phaseLag());
        assertEquals(0.0, observation.phaseLag(), 1e-15);
        assertFalse(hatchPhase.isDefined());
        assertEquals(UndefinedReason.NO_ADVECTIVE_PHASE_LAG, hatchPhase.undefinedReason());
    }

    @Test
    @DisplayName("difference: construye la observación con |Δz|")
    void difference_buildsObservation() {
        // ARRANGE
        HarmonicSignal shallow = HarmonicSignal.fromFitInHours(20.0, 3.0, OMEGA_HOURS, 0.1);
        HarmonicSignal deep = HarmonicSignal.fromFitInHours(19.0, 2.0, OMEGA_HOURS, 0.6);

        // ACT
        SensorPairObservation observation = SensorPairDifferencer.difference(shallow, deep, -0.1);

        // ASSERT
        assertEquals(0.1, observation.depthDifference(), 0.0);
        assertEquals(3.0, observation.amplitudeShallow());
        assertEquals(2.0, observation.amplitudeDeep());
        assertEquals(Math.log(1.5), observation.amplitudeLogRatio(), 1e-15);
        assertEquals(0.5, observation.phaseDifference(), 1e-12);
    }

    @Test
    @DisplayName("Δz nulo lanza PhysicalDomainException")
    void zeroDepthDifference_throws() {
        HarmonicSignal signal = HarmonicSignal.fromFitInHours(20.0, 3.0, OMEGA_HOURS, 0.1);

        assertThrows(PhysicalDomainException.class, () -> SensorPairDifferencer.difference(signal, signal, 0.0));
    }

    @Test
    @DisplayName("Unidades de tiempo distintas no son comparables")
    void mismatchedTimeUnits_throws() {
        HarmonicSignal hours = HarmonicSignal.fromFitInHours(20.0, 3.0, OMEGA_HOURS, 0.1);
        HarmonicSignal seconds = HarmonicSignal.fromFit(19.0, 2.0, OMEGA_HOURS / 3600.0, 0.6, 1.0);

        assertThrows(IllegalArgumentException.class, () -> SensorPairDifferencer.difference(hours, seconds, 0.1));
    }

    @Test
    @DisplayName("Frecuencias ajustadas distintas sólo generan un aviso")
    void frequencyMismatch_isOnlyWarned() {
        HarmonicSignal shallow = HarmonicSignal.fromFitInHours(20.0, 3.0, OMEGA_HOURS, 0.1);
        HarmonicSignal deep = HarmonicSignal.fromFitInHours(19.0, 2.0, 2 * Math.PI / 20.0, 0.6);

        SensorPairObservation observation = SensorPairDifferencer.difference(shallow, deep, 0.1);

        assertEquals(0.5, observation.phaseDifference(), 1e-12);
    }
}
