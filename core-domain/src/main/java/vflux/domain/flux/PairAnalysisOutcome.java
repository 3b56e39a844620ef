package vflux.domain.flux;

/**
 * Resultado del análisis de un par de sensores dentro de un perfil.
 *
 * @param shallowSensorId Sensor superficial.
 * @param deepSensorId    Sensor profundo.
 * @param status          Estado del análisis.
 * @param message         Detalle legible (motivo del fallo de ajuste, vacío si todo fue bien).
 * @param result          Resultado de los cinco métodos; {@code null} si no hubo ajuste armónico.
 */
public record PairAnalysisOutcome(
        String shallowSensorId,
        String deepSensorId,
        Status status,
        String message,
        FluxAnalysisResult result
) {
    public enum Status {
        COMPUTED,
        NO_HARMONIC_FIT
    }

    public static PairAnalysisOutcome computed(String shallowId, String deepId, FluxAnalysisResult result) {
        return new PairAnalysisOutcome(shallowId, deepId, Status.COMPUTED, "", result);
    }

    public static PairAnalysisOutcome noFit(String shallowId, String deepId, String message) {
        return new PairAnalysisOutcome(shallowId, deepId, Status.NO_HARMONIC_FIT, message, null);
    }

    public boolean isComputed() {
        return status == Status.COMPUTED;
    }

    public String pairLabel() {
        return shallowSensorId + "→" + deepSensorId;
    }
}
