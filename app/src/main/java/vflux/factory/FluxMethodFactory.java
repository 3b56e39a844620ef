package vflux.factory;

import vflux.physics.i.IFluxMethod;
import vflux.physics.impl.HatchAmplitudeMethod;
import vflux.physics.impl.HatchPhaseMethod;
import vflux.physics.impl.KeeryMethod;
import vflux.physics.impl.LuceMethod;
import vflux.physics.impl.McCallumMethod;

import java.util.List;

/**
 * Construye el banco de métodos de flujo.
 */
public final class FluxMethodFactory {

    private FluxMethodFactory() {
    }

    /**
     * Los cinco métodos en el orden en que se informan: Hatch-Amplitud, Hatch-Fase, Keery,
     * McCallum y Luce. Los métodos no tienen estado, así que la lista puede compartirse.
     */
    public static List<IFluxMethod> createDefaultBank() {
        return List.of(
                new HatchAmplitudeMethod(),
                new HatchPhaseMethod(),
                new KeeryMethod(),
                new McCallumMethod(),
                new LuceMethod()
        );
    }
}
