package vflux.domain.signal;

import java.util.Arrays;
import java.util.Objects;

/**
 * Espectro de amplitudes de frecuencias positivas de una serie sin media.
 *
 * @param frequencies Frecuencias en ciclos por unidad de tiempo, crecientes.
 * @param amplitudes  Amplitud de cada frecuencia, normalizada como 2/n·|Y(k)|.
 */
public record AmplitudeSpectrum(double[] frequencies, double[] amplitudes) {

    public AmplitudeSpectrum {
        Objects.requireNonNull(frequencies, "El vector de frecuencias no puede ser nulo.");
        Objects.requireNonNull(amplitudes, "El vector de amplitudes no puede ser nulo.");
        if (frequencies.length != amplitudes.length || frequencies.length == 0) {
            throw new IllegalArgumentException("El espectro debe tener el mismo número (no nulo) de frecuencias y amplitudes.");
        }
        frequencies = frequencies.clone();
        amplitudes = amplitudes.clone();
    }

    public int peakIndex() {
        int best = 0;
        for (int k = 1; k < amplitudes.length; k++) {
            if (amplitudes[k] > amplitudes[best]) {
                best = k;
            }
        }
        return best;
    }

    /**
     * Frecuencia (ciclos por unidad de tiempo) del bin de mayor amplitud.
     */
    public double dominantFrequency() {
        return frequencies[peakIndex()];
    }

    public double dominantAmplitude() {
        return amplitudes[peakIndex()];
    }

    @Override
    public double[] frequencies() {
        return frequencies.clone();
    }

    @Override
    public double[] amplitudes() {
        return amplitudes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AmplitudeSpectrum that = (AmplitudeSpectrum) o;
        return Arrays.equals(frequencies, that.frequencies) && Arrays.equals(amplitudes, that.amplitudes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(frequencies) + Arrays.hashCode(amplitudes);
    }

    @Override
    public String toString() {
        return "AmplitudeSpectrum[bins=" + frequencies.length + ", dominant=" + dominantFrequency() + "]";
    }
}
