package vflux.physics.model;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import vflux.domain.medium.ThermalMedium;
import vflux.domain.signal.HarmonicSignal;
import vflux.domain.signal.SensorSeries;
import vflux.exception.PhysicalDomainException;
import vflux.physics.solver.ThermalPropertyResolver;

/**
 * Generador de series térmicas sintéticas con parámetros armónicos conocidos analíticamente.
 * <p>
 * La onda diaria impuesta en la profundidad de referencia se propaga hacia abajo según
 * la descomposición conductiva + advectiva:
 * <ul>
 * <li><b>Amplitud:</b> B(z) = B₀·exp(−v·Δz/α).</li>
 * <li><b>Fase:</b> φ(z) = φ₀ + √(ωΔz²/4α) + v·Cw·Δz/(2λ).</li>
 * </ul>
 * Con estas expresiones los métodos Hatch-Amplitud y Hatch-Fase recuperan exactamente el
 * flujo inyectado, lo que permite tests de ida y vuelta.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
public class SyntheticThermalSeriesGenerator {

    private static final double SECONDS_PER_DAY = 86400.0;

    /** Propiedades térmicas del lecho. */
    private final ThermalMedium medium;

    /** Flujo de Darcy inyectado (m/s), positivo hacia abajo. */
    private final double targetFlux;

    /** Frecuencia angular del forzamiento (rad/s). */
    @Builder.Default
    private final double angularFrequency = 2.0 * Math.PI / SECONDS_PER_DAY;

    /** Profundidad (m) a la que se imponen la media, la amplitud y la fase de referencia. */
    @Builder.Default
    private final double referenceDepth = 0.0;

    @Builder.Default
    private final double referenceMean = 20.0;

    @Builder.Default
    private final double referenceAmplitude = 3.0;

    @Builder.Default
    private final double referencePhase = 0.0;

    /** Descenso de la temperatura media con la profundidad (°C/m). */
    @Builder.Default
    private final double meanGradient = 10.0;

    /** Duración de una unidad del vector de tiempo generado (s). Por defecto horas. */
    @Builder.Default
    private final double timeUnitSeconds = HarmonicSignal.SECONDS_PER_HOUR;

    /** Desviación típica del ruido gaussiano añadido (°C). Cero desactiva el ruido. */
    @Builder.Default
    private final double noiseStdDev = 0.0;

    @Builder.Default
    private final long seed = 12345L;

    /**
     * Desfase advectivo inducido por un flujo v entre dos sensores.
     */
    public static double advectivePhaseLag(double depthDifference, double flux, ThermalMedium medium) {
        return flux * medium.waterHeatCapacity() * depthDifference / (2.0 * medium.thermalConductivity());
    }

    /**
     * Parámetros armónicos exactos de un sensor situado a la profundidad indicada.
     *
     * @param depth Profundidad del sensor (m), mayor o igual que la de referencia.
     */
    public HarmonicSignal signalAtDepth(double depth) {
        validate();
        double dz = depth - referenceDepth;
        if (dz < 0) {
            throw new IllegalArgumentException("La profundidad " + depth + " m está por encima de la referencia " + referenceDepth + " m.");
        }
        double alpha = medium.diffusivity();
        double amplitude = referenceAmplitude * Math.exp(-targetFlux * dz / alpha);
        double phase = referencePhase
                + ThermalPropertyResolver.conductivePhaseLag(dz, alpha, angularFrequency)
                + advectivePhaseLag(dz, targetFlux, medium);
        double mean = referenceMean - meanGradient * dz;

        return HarmonicSignal.fromFit(mean, amplitude, angularFrequency * timeUnitSeconds, phase, timeUnitSeconds);
    }

    /**
     * Genera una serie regular para un sensor.
     *
     * @param sensorId Identificador del sensor.
     * @param depth    Profundidad del sensor (m).
     * @param duration Duración total, en unidades de tiempo (horas por defecto).
     * @param step     Paso de muestreo, en unidades de tiempo.
     */
    public SensorSeries generate(String sensorId, double depth, double duration, double step) {
        if (!(step > 0) || !(duration > step)) {
            throw new IllegalArgumentException("La duración debe ser mayor que el paso y ambos positivos.");
        }
        HarmonicSignal signal = signalAtDepth(depth);
        int samples = (int) Math.floor(duration / step);
        double[] time = new double[samples];
        double[] temperature = new double[samples];

        // Semilla distinta por sensor para descorrelacionar el ruido
        RandomGenerator random = new Well19937c(seed + sensorId.hashCode());
        for (int i = 0; i < samples; i++) {
            time[i] = i * step;
            double noise = (noiseStdDev > 0) ? noiseStdDev * random.nextGaussian() : 0.0;
            temperature[i] = signal.valueAt(time[i]) + noise;
        }

        log.debug("Serie sintética {} a {} m: B={} °C, φ={} rad, {} muestras",
                sensorId, depth, signal.amplitude(), signal.phase(), samples);
        return new SensorSeries(sensorId, depth, time, temperature);
    }

    private void validate() {
        if (medium == null) {
            throw new IllegalStateException("El generador sintético necesita un medio térmico.");
        }
        PhysicalDomainException.requirePositive(angularFrequency, "angularFrequency");
        PhysicalDomainException.requirePositive(timeUnitSeconds, "timeUnitSeconds");
        if (!Double.isFinite(targetFlux)) {
            throw new IllegalArgumentException("El flujo objetivo debe ser finito.");
        }
    }
}
