package vflux.domain.signal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HarmonicSignalTest {

    private static final double OMEGA_HOURS = 2 * Math.PI / 24.0;

    @Test
    @DisplayName("Amplitud negativa: se normaliza a |B| con φ+π y el modelo no cambia")
    void fromFit_negativeAmplitude_isEquivalent() {
        // ARRANGE
        double mean = 18.0;
        double rawAmplitude = -2.5;
        double rawPhase = 0.7;

        // ACT
        HarmonicSignal signal = HarmonicSignal.fromFitInHours(mean, rawAmplitude, OMEGA_HOURS, rawPhase);

        // ASSERT
        assertEquals(2.5, signal.amplitude(), 1e-15);
        assertEquals(rawPhase + Math.PI, signal.phase(), 1e-12);
        for (double t = 0.0; t <= 72.0; t += 0.25) {
            double original = mean + rawAmplitude * Math.sin(OMEGA_HOURS * t + rawPhase);
            assertEquals(original, signal.valueAt(t), 1e-10, "Modelo distinto en t=" + t);
        }
    }

    @Test
    @DisplayName("Amplitud negativa con fase cercana a 2π: la fase resultante se envuelve a [0, 2π)")
    void fromFit_negativeAmplitude_wrapsPhase() {
        HarmonicSignal signal = HarmonicSignal.fromFitInHours(10.0, -1.0, OMEGA_HOURS, 5.0);

        assertEquals(5.0 + Math.PI - 2 * Math.PI, signal.phase(), 1e-12);
        assertTrue(signal.phase() >= 0.0 && signal.phase() < 2 * Math.PI);
    }

    @Test
    @DisplayName("Frecuencia negativa: se pliega a positiva conservando el modelo")
    void fromFit_negativeFrequency_isEquivalent() {
        HarmonicSignal signal = HarmonicSignal.fromFitInHours(20.0, 2.0, -OMEGA_HOURS, 0.5);

        assertEquals(OMEGA_HOURS, signal.angularFrequency(), 1e-15);
        assertTrue(signal.amplitude() >= 0.0);
        for (double t = 0.0; t <= 48.0; t += 0.5) {
            double original = 20.0 + 2.0 * Math.sin(-OMEGA_HOURS * t + 0.5);
            assertEquals(original, signal.valueAt(t), 1e-10);
        }
    }

    @Test
    @DisplayName("Periodo y conversión de ω a rad/s con tiempo en horas")
    void periodAndUnits() {
        HarmonicSignal signal = HarmonicSignal.fromFitInHours(20.0, 3.0, OMEGA_HOURS, 0.0);

        assertEquals(24.0, signal.period(), 1e-12);
        assertEquals(86400.0, signal.periodSeconds(), 1e-8);
        assertEquals(2 * Math.PI / 86400.0, signal.angularFrequencyPerSecond(), 1e-18);
    }

    @Test
    @DisplayName("El constructor canónico rechaza amplitudes negativas y ω no positiva")
    void constructor_rejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new HarmonicSignal(20.0, -1.0, OMEGA_HOURS, 0.0, 3600.0));
        assertThrows(IllegalArgumentException.class, () -> new HarmonicSignal(20.0, 1.0, 0.0, 0.0, 3600.0));
        assertThrows(IllegalArgumentException.class, () -> new HarmonicSignal(20.0, 1.0, OMEGA_HOURS, Double.NaN, 3600.0));
        assertThrows(IllegalArgumentException.class, () -> new HarmonicSignal(20.0, 1.0, OMEGA_HOURS, 0.0, 0.0));
    }

    @Test
    @DisplayName("Amplitud nula (serie plana) es una señal válida")
    void zeroAmplitude_isAllowed() {
        HarmonicSignal flat = HarmonicSignal.fromFitInHours(15.0, 0.0, OMEGA_HOURS, 0.0);

        assertEquals(0.0, flat.amplitude());
        assertEquals(15.0, flat.valueAt(7.0), 0.0);
    }
}
