package vflux.physics.solver;

import vflux.exception.PhysicalDomainException;

/**
 * Conversión de propiedades térmicas del sedimento y desfase conductivo asociado.
 * Clase utilidad sin estado, segura para uso concurrente.
 */
public final class ThermalPropertyResolver {

    /**
     * Prohibido construir esta clase utilidad
     */
    private ThermalPropertyResolver() {
    }

    /**
     * Calcula la difusividad térmica α = λ / C.
     *
     * @param conductivity Conductividad térmica λ (W·m⁻¹·K⁻¹).
     * @param heatCapacity Capacidad calorífica volumétrica C (J·m⁻³·K⁻¹).
     * @return Difusividad térmica (m²/s), siempre positiva.
     * @throws PhysicalDomainException si alguno de los parámetros no es finito y positivo.
     */
    public static double diffusivity(double conductivity, double heatCapacity) {
        PhysicalDomainException.requirePositive(heatCapacity, "heatCapacity");
        PhysicalDomainException.requirePositive(conductivity, "conductivity");
        return conductivity / heatCapacity;
    }

    /**
     * Desfase puramente conductivo √(ωΔz²/4α) entre dos puntos separados Δz (solución de
     * Stallman para un lecho sin flujo). Es la única definición que comparten el modelo
     * sintético y la inversión de Hatch por fase.
     *
     * @param depthDifference  Separación Δz (m), cero o positiva.
     * @param diffusivity      Difusividad térmica α (m²/s).
     * @param angularFrequency Frecuencia angular ω (rad/s).
     * @return Desfase en radianes.
     * @throws PhysicalDomainException si α u ω no son positivos o Δz es negativa o no finita.
     */
    public static double conductivePhaseLag(double depthDifference, double diffusivity, double angularFrequency) {
        PhysicalDomainException.requirePositive(diffusivity, "diffusivity");
        PhysicalDomainException.requirePositive(angularFrequency, "angularFrequency");
        if (!Double.isFinite(depthDifference) || depthDifference < 0.0) {
            throw new PhysicalDomainException("La separación entre sensores no puede ser negativa (recibida: " + depthDifference + ").");
        }
        return Math.sqrt(angularFrequency * depthDifference * depthDifference / (4.0 * diffusivity));
    }
}
