package vflux.domain.signal;

import vflux.utils.PhaseAngles;

/**
 * Parámetros armónicos del ciclo dominante de un sensor: T(t) = A + B·sin(ωt + φ).
 * <p>
 * Se produce una vez por sensor y ventana de análisis, y sólo lo consume el
 * diferenciador de pares. Por convención la amplitud nunca es negativa y la fase
 * está en [0, 2π). Use {@link #fromFit} para construirlo a partir de parámetros
 * crudos de un ajuste.
 *
 * @param mean             Temperatura media A (°C).
 * @param amplitude        Amplitud B (°C), B ≥ 0.
 * @param angularFrequency Frecuencia angular ω en radianes por unidad de tiempo del vector ajustado.
 * @param phase            Fase φ (rad), en [0, 2π).
 * @param timeUnitSeconds  Segundos que dura una unidad del vector de tiempo (3600 si el tiempo va en horas).
 */
public record HarmonicSignal(
        double mean,
        double amplitude,
        double angularFrequency,
        double phase,
        double timeUnitSeconds
) {
    public static final double SECONDS_PER_HOUR = 3600.0;

    public HarmonicSignal {
        if (!(amplitude >= 0.0)) {
            throw new IllegalArgumentException("La amplitud debe ser no negativa; use HarmonicSignal.fromFit para normalizar (B=" + amplitude + ").");
        }
        if (!(angularFrequency > 0.0) || !Double.isFinite(angularFrequency)) {
            throw new IllegalArgumentException("La frecuencia angular debe ser finita y positiva (ω=" + angularFrequency + ").");
        }
        if (!(timeUnitSeconds > 0.0)) {
            throw new IllegalArgumentException("La unidad de tiempo debe ser positiva (" + timeUnitSeconds + " s).");
        }
        if (!Double.isFinite(mean) || !Double.isFinite(phase)) {
            throw new IllegalArgumentException("La media y la fase deben ser finitas.");
        }
    }

    /**
     * Construye una señal normalizada a partir de parámetros crudos.
     * <p>
     * Una amplitud negativa se convierte en |B| sumando π a la fase; una frecuencia negativa
     * se pliega usando sin(−ωt + φ) = −sin(ωt − φ). La fase resultante queda en [0, 2π).
     */
    public static HarmonicSignal fromFit(double mean, double amplitude, double angularFrequency,
                                         double phase, double timeUnitSeconds) {
        double b = amplitude;
        double w = angularFrequency;
        double phi = phase;

        if (w < 0.0) {
            w = -w;
            phi = -phi;
            b = -b;
        }
        if (b < 0.0) {
            b = -b;
            phi = phi + Math.PI;
        }
        return new HarmonicSignal(mean, b, w, PhaseAngles.wrapPositive(phi), timeUnitSeconds);
    }

    /**
     * Atajo para series cuyo vector de tiempo está en horas.
     */
    public static HarmonicSignal fromFitInHours(double mean, double amplitude, double angularFrequency, double phase) {
        return fromFit(mean, amplitude, angularFrequency, phase, SECONDS_PER_HOUR);
    }

    /**
     * Evalúa el modelo armónico en el instante t (en la unidad de tiempo del ajuste).
     */
    public double valueAt(double t) {
        return mean + amplitude * Math.sin(angularFrequency * t + phase);
    }

    /**
     * Periodo 2π/ω en la unidad de tiempo del ajuste.
     */
    public double period() {
        return PhaseAngles.TWO_PI / angularFrequency;
    }

    public double periodSeconds() {
        return period() * timeUnitSeconds;
    }

    /**
     * Frecuencia angular convertida a rad/s.
     */
    public double angularFrequencyPerSecond() {
        return angularFrequency / timeUnitSeconds;
    }
}
