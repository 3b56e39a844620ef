package vflux.domain.flux;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resultado agregado de los cinco métodos para un par de sensores.
 *
 * @param observation        Magnitudes diferenciadas usadas por todos los métodos.
 * @param thermalDiffusivity Difusividad térmica α resuelta (m²/s).
 * @param angularFrequency   Frecuencia angular usada en la inversión (rad/s).
 * @param estimates          Estimación por método.
 */
public record FluxAnalysisResult(
        SensorPairObservation observation,
        double thermalDiffusivity,
        double angularFrequency,
        Map<FluxMethodType, FluxEstimate> estimates
) {
    public FluxAnalysisResult {
        Objects.requireNonNull(observation, "La observación no puede ser nula.");
        Objects.requireNonNull(estimates, "El mapa de estimaciones no puede ser nulo.");
        Map<FluxMethodType, FluxEstimate> copy = new EnumMap<>(FluxMethodType.class);
        copy.putAll(estimates);
        estimates = Collections.unmodifiableMap(copy);
    }

    public FluxEstimate estimate(FluxMethodType method) {
        return estimates.get(method);
    }

    /**
     * Velocidad (m/s) de un método, NaN si no se calculó o es indefinida.
     */
    public double velocity(FluxMethodType method) {
        FluxEstimate estimate = estimates.get(method);
        return (estimate == null) ? Double.NaN : estimate.velocity();
    }

    public Map<String, Double> velocitiesMetersPerSecond() {
        Map<String, Double> out = new LinkedHashMap<>();
        estimates.forEach((method, estimate) -> out.put(method.key(), estimate.velocity()));
        return out;
    }

    public Map<String, Double> velocitiesMmPerDay() {
        Map<String, Double> out = new LinkedHashMap<>();
        estimates.forEach((method, estimate) -> out.put(method.key(), estimate.velocityMmPerDay()));
        return out;
    }
}
