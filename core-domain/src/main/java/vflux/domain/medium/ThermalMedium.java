package vflux.domain.medium;

import lombok.Builder;
import lombok.With;
import vflux.exception.PhysicalDomainException;
import vflux.physics.solver.ThermalPropertyResolver;

/**
 * Propiedades térmicas inmutables del lecho saturado.
 * <p>
 * Se crea una vez por análisis a partir de la configuración y se pasa explícitamente a
 * cada cálculo; no existe estado global de constantes físicas.
 *
 * @param thermalConductivity   Conductividad térmica λ del sedimento saturado (W·m⁻¹·K⁻¹).
 * @param sedimentHeatCapacity  Capacidad calorífica volumétrica del sedimento Cs (J·m⁻³·K⁻¹).
 * @param waterHeatCapacity     Capacidad calorífica volumétrica del agua Cw (J·m⁻³·K⁻¹).
 */
@Builder
@With
public record ThermalMedium(
        double thermalConductivity,
        double sedimentHeatCapacity,
        double waterHeatCapacity
) {
    public ThermalMedium {
        PhysicalDomainException.requirePositive(thermalConductivity, "thermalConductivity");
        PhysicalDomainException.requirePositive(sedimentHeatCapacity, "sedimentHeatCapacity");
        PhysicalDomainException.requirePositive(waterHeatCapacity, "waterHeatCapacity");
    }

    /**
     * Difusividad térmica α = λ / Cs (m²/s).
     */
    public double diffusivity() {
        return ThermalPropertyResolver.diffusivity(thermalConductivity, sedimentHeatCapacity);
    }

    /**
     * Arena saturada de referencia: λ = 2.0, Cs = 2.5e6, Cw = 4.18e6.
     */
    public static ThermalMedium saturatedSand() {
        return new ThermalMedium(2.0, 2.5e6, 4.18e6);
    }
}
