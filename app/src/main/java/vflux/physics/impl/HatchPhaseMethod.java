package vflux.physics.impl;

import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.flux.UndefinedReason;
import vflux.domain.medium.ThermalMedium;
import vflux.physics.i.IFluxMethod;
import vflux.physics.solver.ThermalPropertyResolver;
import vflux.utils.PhaseAngles;

/**
 * Método de Hatch et al. (2006) basado en el desfase entre dos sensores, con la
 * separación explícita entre desfase conductivo y advectivo.
 * <p>
 * El desfase total medido se descompone en:
 * <ul>
 * <li><b>Conductivo:</b> φ_cond = √(ωΔz²/4α), solución de Stallman (1965) para un lecho sin flujo.</li>
 * <li><b>Advectivo:</b> φ_adv = Δφ − φ_cond, el único atribuible al movimiento del agua.</li>
 * </ul>
 * v = (φ_adv / Δz)·(2λ / Cw). Si φ_adv ≤ 0 no hay señal advectiva descendente resoluble y el
 * resultado es indefinido.
 * <p>
 * La variante v = 4αΔφ/(ωΔz²) atribuye todo el desfase a la advección y sobrestima el flujo en
 * uno o dos órdenes de magnitud para flujos pequeños; es incorrecta y no se implementa.
 */
public class HatchPhaseMethod implements IFluxMethod {

    @Override
    public FluxMethodType type() {
        return FluxMethodType.HATCH_PHASE;
    }

    @Override
    public String getDescription() {
        return "v = [Δφ − √(ωΔz²/4α)]·2λ/(Cw·Δz); indefinido si el desfase advectivo ≤ 0";
    }

    @Override
    public FluxEstimate estimate(SensorPairObservation observation, ThermalMedium medium, double angularFrequency) {
        double alpha = medium.diffusivity();
        FluxPreconditions.require(observation.depthDifference(), alpha, angularFrequency);

        double v = velocityFromLag(observation.phaseLag(), observation.depthDifference(), alpha, angularFrequency,
                medium.thermalConductivity(), medium.waterHeatCapacity());
        if (Double.isNaN(v)) {
            return FluxEstimate.undefined(type(), UndefinedReason.NO_ADVECTIVE_PHASE_LAG);
        }
        return FluxEstimate.computed(type(), v);
    }

    /**
     * @param phaseShallow Fase del sensor superficial (rad).
     * @param phaseDeep    Fase del sensor profundo (rad).
     * @return Velocidad de Darcy (m/s), o NaN si el desfase advectivo no es positivo.
     */
    public static double velocity(double phaseShallow, double phaseDeep, double depthDifference, double diffusivity,
                                  double angularFrequency, double thermalConductivity, double waterHeatCapacity) {
        double lag = PhaseAngles.foldLag(phaseDeep - phaseShallow);
        return velocityFromLag(lag, depthDifference, diffusivity, angularFrequency, thermalConductivity, waterHeatCapacity);
    }

    /**
     * Variante que recibe directamente el desfase total como retraso en [0, 2π).
     */
    public static double velocityFromLag(double phaseLag, double depthDifference, double diffusivity,
                                         double angularFrequency, double thermalConductivity, double waterHeatCapacity) {
        FluxPreconditions.require(depthDifference, diffusivity, angularFrequency);
        double conductive = ThermalPropertyResolver.conductivePhaseLag(depthDifference, diffusivity, angularFrequency);
        double advective = phaseLag - conductive;
        if (!(advective > 0.0)) {
            return Double.NaN;
        }
        return (advective / depthDifference) * (2.0 * thermalConductivity) / waterHeatCapacity;
    }
}
