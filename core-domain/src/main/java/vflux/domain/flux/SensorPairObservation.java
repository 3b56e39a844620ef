package vflux.domain.flux;

import vflux.exception.PhysicalDomainException;
import vflux.utils.PhaseAngles;

/**
 * Magnitudes diferenciadas entre un sensor superficial y uno profundo.
 *
 * @param depthDifference   Separación Δz entre sensores (m), siempre positiva.
 * @param amplitudeShallow  Amplitud del sensor superficial (°C).
 * @param amplitudeDeep     Amplitud del sensor profundo (°C).
 * @param amplitudeLogRatio ΔA = ln(B_superficial / B_profundo); NaN si alguna amplitud ≤ 0.
 * @param phaseDifference   Δφ = φ_profundo − φ_superficial normalizado a (−π, π].
 */
public record SensorPairObservation(
        double depthDifference,
        double amplitudeShallow,
        double amplitudeDeep,
        double amplitudeLogRatio,
        double phaseDifference
) {
    public SensorPairObservation {
        PhysicalDomainException.requirePositive(depthDifference, "depthDifference");
    }

    /**
     * Ar = B_superficial / B_profundo, o NaN si alguna amplitud no es positiva.
     */
    public double amplitudeRatio() {
        if (!(amplitudeShallow > 0.0) || !(amplitudeDeep > 0.0)) {
            return Double.NaN;
        }
        return amplitudeShallow / amplitudeDeep;
    }

    public boolean hasPositiveAmplitudes() {
        return amplitudeShallow > 0.0 && amplitudeDeep > 0.0;
    }

    /**
     * Desfase como retraso no negativo en [0, 2π).
     */
    public double phaseLag() {
        return PhaseAngles.foldLag(phaseDifference);
    }
}
