package vflux.physics.impl;

import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.flux.UndefinedReason;
import vflux.domain.medium.ThermalMedium;
import vflux.exception.PhysicalDomainException;
import vflux.physics.i.IFluxMethod;

/**
 * Forma empírica simplificada de Luce et al. (2013), útil como diagnóstico rápido.
 * <p>
 * v = ωΔz / (2·ln(Ar)). Con Ar ≤ 1 el logaritmo cambia de signo o se anula, así que el
 * resultado es indefinido.
 */
public class LuceMethod implements IFluxMethod {

    @Override
    public FluxMethodType type() {
        return FluxMethodType.LUCE;
    }

    @Override
    public String getDescription() {
        return "v = ωΔz / (2·ln(Ar)); indefinido si Ar ≤ 1";
    }

    @Override
    public FluxEstimate estimate(SensorPairObservation observation, ThermalMedium medium, double angularFrequency) {
        FluxPreconditions.require(observation.depthDifference(), medium.diffusivity(), angularFrequency);
        if (!observation.hasPositiveAmplitudes()) {
            return FluxEstimate.undefined(type(), UndefinedReason.NON_POSITIVE_AMPLITUDE);
        }
        if (observation.amplitudeRatio() <= 1.0) {
            return FluxEstimate.undefined(type(), UndefinedReason.AMPLITUDE_RATIO_NOT_ABOVE_ONE);
        }
        return FluxEstimate.computed(type(), velocity(observation.amplitudeShallow(), observation.amplitudeDeep(),
                observation.depthDifference(), angularFrequency));
    }

    /**
     * @return Velocidad (m/s), o NaN si alguna amplitud ≤ 0 o Ar ≤ 1.
     */
    public static double velocity(double amplitudeShallow, double amplitudeDeep, double depthDifference,
                                  double angularFrequency) {
        PhysicalDomainException.requirePositive(depthDifference, "depthDifference");
        PhysicalDomainException.requirePositive(angularFrequency, "angularFrequency");
        if (!(amplitudeShallow > 0.0) || !(amplitudeDeep > 0.0)) {
            return Double.NaN;
        }
        double ar = amplitudeShallow / amplitudeDeep;
        if (ar <= 1.0) {
            return Double.NaN;
        }
        return (angularFrequency * depthDifference) / (2.0 * Math.log(ar));
    }
}
