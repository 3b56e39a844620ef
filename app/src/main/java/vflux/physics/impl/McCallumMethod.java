package vflux.physics.impl;

import lombok.extern.slf4j.Slf4j;
import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.flux.UndefinedReason;
import vflux.domain.medium.ThermalMedium;
import vflux.physics.i.IFluxMethod;
import vflux.utils.PhaseAngles;

/**
 * Método combinado de McCallum et al. (2012).
 * <p>
 * D = ΔA² + ωΔz²/(4α) − Δφ²; si D ≥ 0, v = (α/Δz)·(ΔA + √D).
 * Si D &lt; 0 la ecuación no tiene solución real y el método devuelve, por definición,
 * el resultado de Hatch-Amplitud para las mismas entradas, marcado con
 * {@link FluxEstimate#fallbackUsed()}.
 * <p>
 * Igual que Keery, usa el desfase total publicado; sus resultados son provisionales.
 */
@Slf4j
public class McCallumMethod implements IFluxMethod {

    @Override
    public FluxMethodType type() {
        return FluxMethodType.MCCALLUM;
    }

    @Override
    public String getDescription() {
        return "v = (α/Δz)·[ΔA + √(ΔA² + ωΔz²/4α − Δφ²)]; respaldo Hatch-Amplitud si el discriminante < 0";
    }

    @Override
    public FluxEstimate estimate(SensorPairObservation observation, ThermalMedium medium, double angularFrequency) {
        double alpha = medium.diffusivity();
        double dz = observation.depthDifference();
        FluxPreconditions.require(dz, alpha, angularFrequency);
        if (!observation.hasPositiveAmplitudes()) {
            return FluxEstimate.undefined(type(), UndefinedReason.NON_POSITIVE_AMPLITUDE);
        }

        double deltaA = Math.log(observation.amplitudeShallow() / observation.amplitudeDeep());
        double d = discriminant(deltaA, observation.phaseLag(), dz, alpha, angularFrequency);

        if (d < 0.0) {
            log.debug("McCallum: discriminante negativo ({}), se usa Hatch-Amplitud", d);
            FluxEstimate fallback = HatchAmplitudeMethod.estimateFromAmplitudes(type(),
                    observation.amplitudeShallow(), observation.amplitudeDeep(), dz, alpha);
            return new FluxEstimate(type(), fallback.velocity(), true, fallback.undefinedReason(), type().isProvisional());
        }
        return FluxEstimate.computed(type(), (alpha / dz) * (deltaA + Math.sqrt(d)));
    }

    /**
     * D = ΔA² + ωΔz²/(4α) − Δφ². Un valor negativo indica que se usará el respaldo.
     */
    public static double discriminant(double amplitudeLogRatio, double phaseLag, double depthDifference,
                                      double diffusivity, double angularFrequency) {
        FluxPreconditions.require(depthDifference, diffusivity, angularFrequency);
        return amplitudeLogRatio * amplitudeLogRatio
                + angularFrequency * depthDifference * depthDifference / (4.0 * diffusivity)
                - phaseLag * phaseLag;
    }

    /**
     * Contrato puramente numérico: la velocidad (m/s) o NaN. Para saber si se usó el
     * respaldo consulte {@link #discriminant}.
     */
    public static double velocity(double amplitudeShallow, double amplitudeDeep, double phaseShallow, double phaseDeep,
                                  double depthDifference, double diffusivity, double angularFrequency) {
        FluxPreconditions.require(depthDifference, diffusivity, angularFrequency);
        if (!(amplitudeShallow > 0.0) || !(amplitudeDeep > 0.0)) {
            return Double.NaN;
        }
        double deltaA = Math.log(amplitudeShallow / amplitudeDeep);
        double lag = PhaseAngles.foldLag(phaseDeep - phaseShallow);
        double d = discriminant(deltaA, lag, depthDifference, diffusivity, angularFrequency);
        if (d < 0.0) {
            return HatchAmplitudeMethod.velocity(amplitudeShallow, amplitudeDeep, depthDifference, diffusivity);
        }
        return (diffusivity / depthDifference) * (deltaA + Math.sqrt(d));
    }
}
