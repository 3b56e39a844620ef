package vflux.physics.analyzer;

import lombok.extern.slf4j.Slf4j;
import vflux.domain.flux.FluxAnalysisResult;
import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.medium.ThermalMedium;
import vflux.domain.signal.HarmonicSignal;
import vflux.exception.PhysicalDomainException;
import vflux.factory.FluxMethodFactory;
import vflux.physics.i.IFluxMethod;
import vflux.physics.solver.SensorPairDifferencer;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ejecuta todos los métodos del banco sobre un mismo par de sensores.
 * <p>
 * Las precondiciones físicas (Δz, α, ω &gt; 0) se validan una sola vez antes de ejecutar
 * ningún método; después cada método se evalúa de forma independiente y un resultado
 * indefinido en uno no afecta a los demás.
 */
@Slf4j
public class MultiMethodFluxCalculator {

    /** Ciclo diario: 2π/86400 rad/s. */
    public static final double DEFAULT_ANGULAR_FREQUENCY = 2.0 * Math.PI / FluxEstimate.SECONDS_PER_DAY;

    private final List<IFluxMethod> methods;

    public MultiMethodFluxCalculator() {
        this(FluxMethodFactory.createDefaultBank());
    }

    public MultiMethodFluxCalculator(List<IFluxMethod> methods) {
        Objects.requireNonNull(methods, "La lista de métodos no puede ser nula.");
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos un método de flujo.");
        }
        this.methods = List.copyOf(methods);
    }

    public FluxAnalysisResult computeAllMethods(HarmonicSignal shallow, HarmonicSignal deep,
                                                ThermalMedium medium, double depthDifference) {
        return computeAllMethods(shallow, deep, medium, depthDifference, DEFAULT_ANGULAR_FREQUENCY);
    }

    /**
     * @param shallow          Señal ajustada del sensor superficial.
     * @param deep             Señal ajustada del sensor profundo.
     * @param medium           Propiedades térmicas del lecho.
     * @param depthDifference  Separación entre sensores (m).
     * @param angularFrequency ω del forzamiento (rad/s).
     */
    public FluxAnalysisResult computeAllMethods(HarmonicSignal shallow, HarmonicSignal deep, ThermalMedium medium,
                                                double depthDifference, double angularFrequency) {
        SensorPairObservation observation = SensorPairDifferencer.difference(shallow, deep, depthDifference);
        return computeAllMethods(observation, medium, angularFrequency);
    }

    public FluxAnalysisResult computeAllMethods(SensorPairObservation observation, ThermalMedium medium) {
        return computeAllMethods(observation, medium, DEFAULT_ANGULAR_FREQUENCY);
    }

    public FluxAnalysisResult computeAllMethods(SensorPairObservation observation, ThermalMedium medium,
                                                double angularFrequency) {
        Objects.requireNonNull(observation, "La observación no puede ser nula.");
        Objects.requireNonNull(medium, "El medio térmico no puede ser nulo.");
        PhysicalDomainException.requirePositive(observation.depthDifference(), "depthDifference");
        PhysicalDomainException.requirePositive(angularFrequency, "angularFrequency");
        double alpha = medium.diffusivity();

        Map<FluxMethodType, FluxEstimate> estimates = new EnumMap<>(FluxMethodType.class);
        for (IFluxMethod method : methods) {
            FluxEstimate estimate = method.estimate(observation, medium, angularFrequency);
            estimates.put(method.type(), estimate);
            if (!estimate.isDefined()) {
                log.debug("{}: indefinido ({})", method.getName(), estimate.undefinedReason());
            } else if (estimate.fallbackUsed()) {
                log.warn("{}: discriminante negativo, se informa el valor de Hatch-Amplitud", method.getName());
            }
        }
        return new FluxAnalysisResult(observation, alpha, angularFrequency, estimates);
    }
}
