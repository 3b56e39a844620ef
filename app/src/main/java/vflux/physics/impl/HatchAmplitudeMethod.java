package vflux.physics.impl;

import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.flux.UndefinedReason;
import vflux.domain.medium.ThermalMedium;
import vflux.physics.i.IFluxMethod;

/**
 * Método de Hatch et al. (2006) basado en la atenuación de amplitud entre dos sensores.
 * <p>
 * v = (α / Δz)·ln(Ar), con Ar = B_superficial / B_profundo. No depende de la fase y es el
 * más estable numéricamente de los cinco.
 */
public class HatchAmplitudeMethod implements IFluxMethod {

    @Override
    public FluxMethodType type() {
        return FluxMethodType.HATCH_AMPLITUDE;
    }

    @Override
    public String getDescription() {
        return "v = (α/Δz)·ln(Ar); indefinido si Ar ≤ 1";
    }

    @Override
    public FluxEstimate estimate(SensorPairObservation observation, ThermalMedium medium, double angularFrequency) {
        double alpha = medium.diffusivity();
        FluxPreconditions.require(observation.depthDifference(), alpha, angularFrequency);
        return estimateFromAmplitudes(type(), observation.amplitudeShallow(), observation.amplitudeDeep(),
                observation.depthDifference(), alpha);
    }

    /**
     * Estimación etiquetada con el método indicado; McCallum la reutiliza como respaldo.
     */
    static FluxEstimate estimateFromAmplitudes(FluxMethodType reportedAs, double amplitudeShallow, double amplitudeDeep,
                                               double depthDifference, double diffusivity) {
        if (!(amplitudeShallow > 0.0) || !(amplitudeDeep > 0.0)) {
            return FluxEstimate.undefined(reportedAs, UndefinedReason.NON_POSITIVE_AMPLITUDE);
        }
        if (amplitudeShallow / amplitudeDeep <= 1.0) {
            return FluxEstimate.undefined(reportedAs, UndefinedReason.AMPLITUDE_RATIO_NOT_ABOVE_ONE);
        }
        return FluxEstimate.computed(reportedAs, velocity(amplitudeShallow, amplitudeDeep, depthDifference, diffusivity));
    }

    /**
     * @param amplitudeShallow Amplitud superficial (°C).
     * @param amplitudeDeep    Amplitud profunda (°C).
     * @param depthDifference  Δz (m).
     * @param diffusivity      α (m²/s).
     * @return Velocidad de Darcy (m/s), o NaN si alguna amplitud ≤ 0 o Ar ≤ 1.
     */
    public static double velocity(double amplitudeShallow, double amplitudeDeep, double depthDifference, double diffusivity) {
        FluxPreconditions.require(depthDifference, diffusivity);
        if (!(amplitudeShallow > 0.0) || !(amplitudeDeep > 0.0)) {
            return Double.NaN;
        }
        double ar = amplitudeShallow / amplitudeDeep;
        if (ar <= 1.0) {
            return Double.NaN;
        }
        return (diffusivity / depthDifference) * Math.log(ar);
    }
}
