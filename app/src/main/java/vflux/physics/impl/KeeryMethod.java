package vflux.physics.impl;

import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.flux.UndefinedReason;
import vflux.domain.medium.ThermalMedium;
import vflux.physics.i.IFluxMethod;
import vflux.utils.PhaseAngles;

/**
 * Método de Keery et al. (2007), combinando amplitud y fase.
 * <p>
 * β = √(ω/2α); v = (2α/Δz)·[ln(Ar) + βΔz − Δφ/(βΔz)].
 * <p>
 * Usa el desfase total tal como aparece en la forma cerrada publicada, sin restar la
 * componente conductiva de Hatch-Fase. Los resultados se marcan como provisionales hasta
 * verificar el término de fase contra el artículo original.
 */
public class KeeryMethod implements IFluxMethod {

    @Override
    public FluxMethodType type() {
        return FluxMethodType.KEERY;
    }

    @Override
    public String getDescription() {
        return "v = (2α/Δz)·[ln(Ar) + βΔz − Δφ/(βΔz)], β = √(ω/2α)";
    }

    @Override
    public FluxEstimate estimate(SensorPairObservation observation, ThermalMedium medium, double angularFrequency) {
        double alpha = medium.diffusivity();
        FluxPreconditions.require(observation.depthDifference(), alpha, angularFrequency);
        if (!observation.hasPositiveAmplitudes()) {
            return FluxEstimate.undefined(type(), UndefinedReason.NON_POSITIVE_AMPLITUDE);
        }
        double v = velocityFromLag(observation.amplitudeShallow(), observation.amplitudeDeep(), observation.phaseLag(),
                observation.depthDifference(), alpha, angularFrequency);
        return FluxEstimate.computed(type(), v);
    }

    /**
     * @return Velocidad de Darcy (m/s), o NaN si alguna amplitud ≤ 0.
     */
    public static double velocity(double amplitudeShallow, double amplitudeDeep, double phaseShallow, double phaseDeep,
                                  double depthDifference, double diffusivity, double angularFrequency) {
        double lag = PhaseAngles.foldLag(phaseDeep - phaseShallow);
        return velocityFromLag(amplitudeShallow, amplitudeDeep, lag, depthDifference, diffusivity, angularFrequency);
    }

    public static double velocityFromLag(double amplitudeShallow, double amplitudeDeep, double phaseLag,
                                         double depthDifference, double diffusivity, double angularFrequency) {
        FluxPreconditions.require(depthDifference, diffusivity, angularFrequency);
        if (!(amplitudeShallow > 0.0) || !(amplitudeDeep > 0.0)) {
            return Double.NaN;
        }
        double beta = Math.sqrt(angularFrequency / (2.0 * diffusivity));
        double betaDz = beta * depthDifference;
        double bracket = Math.log(amplitudeShallow / amplitudeDeep) + betaDz - phaseLag / betaDz;
        return (2.0 * diffusivity / depthDifference) * bracket;
    }
}
