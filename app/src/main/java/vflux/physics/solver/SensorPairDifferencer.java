package vflux.physics.solver;

import lombok.extern.slf4j.Slf4j;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.signal.HarmonicSignal;
import vflux.exception.PhysicalDomainException;
import vflux.utils.PhaseAngles;

import java.util.Objects;

/**
 * Obtiene ΔA y Δφ a partir de los parámetros armónicos de dos sensores.
 */
@Slf4j
public final class SensorPairDifferencer {

    private static final double FREQUENCY_MISMATCH_TOLERANCE = 0.05;

    /**
     * Prohibido construir esta clase utilidad
     */
    private SensorPairDifferencer() {
    }

    /**
     * ΔA = ln(B_superficial / B_profundo).
     *
     * @return El logaritmo del cociente, o NaN si alguna amplitud ≤ 0 (amplitud no física).
     */
    public static double amplitudeLogRatio(double amplitudeShallow, double amplitudeDeep) {
        if (!(amplitudeShallow > 0.0) || !(amplitudeDeep > 0.0)) {
            return Double.NaN;
        }
        return Math.log(amplitudeShallow / amplitudeDeep);
    }

    /**
     * Δφ = φ_profundo − φ_superficial normalizado a (−π, π].
     */
    public static double phaseDifference(double phaseShallow, double phaseDeep) {
        return PhaseAngles.normalizeSigned(phaseDeep - phaseShallow);
    }

    /**
     * Construye la observación del par.
     *
     * @param shallow         Señal del sensor superficial.
     * @param deep            Señal del sensor profundo.
     * @param depthDifference Separación entre sensores (m); se toma su valor absoluto.
     * @throws PhysicalDomainException  si la separación es nula o no finita.
     * @throws IllegalArgumentException si las señales se ajustaron con unidades de tiempo distintas.
     */
    public static SensorPairObservation difference(HarmonicSignal shallow, HarmonicSignal deep, double depthDifference) {
        Objects.requireNonNull(shallow, "La señal superficial no puede ser nula.");
        Objects.requireNonNull(deep, "La señal profunda no puede ser nula.");
        double dz = PhysicalDomainException.requirePositive(Math.abs(depthDifference), "depthDifference");

        if (Double.compare(shallow.timeUnitSeconds(), deep.timeUnitSeconds()) != 0) {
            throw new IllegalArgumentException("Las señales usan unidades de tiempo distintas ("
                    + shallow.timeUnitSeconds() + " s vs " + deep.timeUnitSeconds() + " s); sus fases no son comparables.");
        }
        double relativeMismatch = Math.abs(shallow.angularFrequency() - deep.angularFrequency()) / shallow.angularFrequency();
        if (relativeMismatch > FREQUENCY_MISMATCH_TOLERANCE) {
            log.warn("Las frecuencias ajustadas del par difieren un {} % (periodos {} y {})",
                    String.format("%.1f", relativeMismatch * 100), shallow.period(), deep.period());
        }

        return new SensorPairObservation(
                dz,
                shallow.amplitude(),
                deep.amplitude(),
                amplitudeLogRatio(shallow.amplitude(), deep.amplitude()),
                phaseDifference(shallow.phase(), deep.phase())
        );
    }
}
