package vflux.physics.solver;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import vflux.domain.signal.AmplitudeSpectrum;
import vflux.domain.signal.SensorSeries;

/**
 * Espectro de amplitudes de una serie de temperatura mediante FFT.
 * <p>
 * La serie se centra restando su media y se rellena con ceros hasta una potencia de dos
 * de al menos {@value #PADDING_FACTOR} veces su longitud. El relleno interpola el espectro,
 * de modo que el pico de un registro corto (pocos ciclos) cae cerca de la frecuencia real
 * en lugar de en el bin entero más próximo.
 * <p>
 * Con muestreo irregular se usa el intervalo medio.
 */
public final class SpectrumAnalyzer {

    private static final int PADDING_FACTOR = 4;

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    /**
     * Prohibido construir esta clase utilidad
     */
    private SpectrumAnalyzer() {
    }

    /**
     * Calcula el espectro de frecuencias positivas (excluida la componente continua).
     *
     * @param time        Vector de tiempo estrictamente creciente.
     * @param temperature Temperaturas de la misma longitud.
     * @return Frecuencias en ciclos por unidad de tiempo y amplitudes normalizadas 2/n·|Y|.
     */
    public static AmplitudeSpectrum computeSpectrum(double[] time, double[] temperature) {
        SensorSeries.validateSamples(time, temperature);
        final int n = temperature.length;
        final double samplingInterval = (time[n - 1] - time[0]) / (n - 1);

        double mean = 0.0;
        for (double value : temperature) {
            mean += value;
        }
        mean /= n;

        final int paddedLength = nextPowerOfTwo(PADDING_FACTOR * n);
        double[] padded = new double[paddedLength];
        for (int i = 0; i < n; i++) {
            padded[i] = temperature[i] - mean;
        }

        Complex[] transform = FFT.transform(padded, TransformType.FORWARD);

        // Bins positivos 1 .. N/2-1
        int positiveBins = paddedLength / 2 - 1;
        double[] frequencies = new double[positiveBins];
        double[] amplitudes = new double[positiveBins];
        for (int k = 1; k <= positiveBins; k++) {
            frequencies[k - 1] = k / (paddedLength * samplingInterval);
            amplitudes[k - 1] = 2.0 / n * transform[k].abs();
        }
        return new AmplitudeSpectrum(frequencies, amplitudes);
    }

    /**
     * Frecuencia angular (rad por unidad de tiempo) del pico dominante del espectro.
     */
    public static double dominantAngularFrequency(double[] time, double[] temperature) {
        return 2.0 * Math.PI * computeSpectrum(time, temperature).dominantFrequency();
    }

    static int nextPowerOfTwo(int value) {
        int power = 1;
        while (power < value) {
            power <<= 1;
        }
        return power;
    }
}
