package vflux.physics.i;

import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.SensorPairObservation;
import vflux.domain.medium.ThermalMedium;

/**
 * Inversión analítica de un modelo de transporte de calor para obtener el flujo vertical.
 * <p>
 * Las implementaciones son funciones puras: los casos sin solución física se devuelven como
 * datos (NaN más motivo) y sólo una configuración física inválida lanza excepción.
 */
public interface IFluxMethod {

    FluxMethodType type();

    /**
     * @param observation      Magnitudes diferenciadas del par de sensores.
     * @param medium           Propiedades térmicas del lecho.
     * @param angularFrequency Frecuencia angular del forzamiento (rad/s).
     * @return La estimación, definida o con su motivo de indefinición.
     * @throws vflux.exception.PhysicalDomainException si Δz, α u ω no son positivos.
     */
    FluxEstimate estimate(SensorPairObservation observation, ThermalMedium medium, double angularFrequency);

    /**
     * Nombre del método tal como aparece en logs e informes.
     */
    default String getName() {
        return type().displayName();
    }

    /**
     * Ecuación que invierte el método, en notación legible.
     */
    String getDescription();
}
