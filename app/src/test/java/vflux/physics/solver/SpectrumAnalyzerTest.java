package vflux.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import vflux.domain.signal.AmplitudeSpectrum;

import static org.junit.jupiter.api.Assertions.*;

class SpectrumAnalyzerTest {

    private static double[] hourlyTime(int n) {
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i;
        }
        return t;
    }

    private static double[] sine(double[] t, double mean, double amplitude, double period, double phase) {
        double[] y = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            y[i] = mean + amplitude * Math.sin(2 * Math.PI / period * t[i] + phase);
        }
        return y;
    }

    @Test
    @DisplayName("Ciclo diario horario de 10 días: pico en 1/24 h⁻¹ con amplitud ≈ 3")
    void dailyCycle_peakAtOnePerDay() {
        // ARRANGE
        double[] t = hourlyTime(240);
        double[] y = sine(t, 20.0, 3.0, 24.0, 0.4);

        // ACT
        AmplitudeSpectrum spectrum = SpectrumAnalyzer.computeSpectrum(t, y);

        // ASSERT
        // 240 muestras → relleno hasta 1024: resolución 1/1024 h⁻¹
        assertEquals(511, spectrum.frequencies().length);
        assertEquals(1.0 / 24.0, spectrum.dominantFrequency(), 1.0 / 1024);
        assertEquals(3.0, spectrum.dominantAmplitude(), 0.1);
    }

    @Test
    @DisplayName("La media no aparece como pico aunque domine la serie")
    void largeMean_isRemoved() {
        double[] t = hourlyTime(240);
        double[] y = sine(t, 500.0, 0.5, 12.0, 0.0);

        double omega = SpectrumAnalyzer.dominantAngularFrequency(t, y);

        assertEquals(2 * Math.PI / 12.0, omega, 2 * Math.PI / 1024);
    }

    @Test
    @DisplayName("Muestreo en minutos: la frecuencia se expresa en ciclos por unidad de tiempo")
    void frequencyUsesSamplingInterval() {
        double[] t = new double[960];
        for (int i = 0; i < t.length; i++) {
            t[i] = 0.25 * i;
        }
        double[] y = sine(t, 15.0, 2.0, 24.0, 1.0);

        AmplitudeSpectrum spectrum = SpectrumAnalyzer.computeSpectrum(t, y);

        assertEquals(1.0 / 24.0, spectrum.dominantFrequency(), 1.0 / (4096 * 0.25));
    }

    @Test
    @DisplayName("nextPowerOfTwo redondea hacia arriba")
    void nextPowerOfTwo() {
        assertEquals(1, SpectrumAnalyzer.nextPowerOfTwo(1));
        assertEquals(16, SpectrumAnalyzer.nextPowerOfTwo(16));
        assertEquals(1024, SpectrumAnalyzer.nextPowerOfTwo(960));
        assertEquals(4096, SpectrumAnalyzer.nextPowerOfTwo(3840));
    }

    @Test
    @DisplayName("Series inválidas se rechazan")
    void invalidSeries_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> SpectrumAnalyzer.computeSpectrum(new double[]{0, 1, 2}, new double[]{1, 2, 3}));
    }
}
