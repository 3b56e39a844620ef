package vflux.domain.flux;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Estimación de flujo vertical de un método.
 * <p>
 * Convención: velocidad positiva = flujo descendente (infiltración). Un resultado
 * indefinido se representa con NaN más un {@link UndefinedReason}, nunca con cero.
 *
 * @param method          Método que produjo la estimación.
 * @param velocity        Velocidad de Darcy (m/s), NaN si es indefinida.
 * @param fallbackUsed    {@code true} si el valor procede del método de respaldo (McCallum → Hatch-Amplitud).
 * @param undefinedReason Motivo de indefinición, o {@link UndefinedReason#NONE}.
 * @param provisional     Resultado de un método pendiente de verificación bibliográfica.
 */
public record FluxEstimate(
        FluxMethodType method,
        double velocity,
        boolean fallbackUsed,
        UndefinedReason undefinedReason,
        boolean provisional
) {
    public static final double SECONDS_PER_DAY = 86400.0;
    public static final double MM_PER_M = 1000.0;

    public FluxEstimate {
        Objects.requireNonNull(method, "El método no puede ser nulo.");
        Objects.requireNonNull(undefinedReason, "El motivo de indefinición no puede ser nulo (use NONE).");
    }

    public static FluxEstimate computed(FluxMethodType method, double velocity) {
        return new FluxEstimate(method, velocity, false, UndefinedReason.NONE, method.isProvisional());
    }

    public static FluxEstimate undefined(FluxMethodType method, UndefinedReason reason) {
        return new FluxEstimate(method, Double.NaN, false, reason, method.isProvisional());
    }

    public boolean isDefined() {
        return !Double.isNaN(velocity);
    }

    /**
     * Velocidad en mm/día (×1000×86400); NaN se conserva.
     */
    @JsonProperty("velocityMmPerDay")
    public double velocityMmPerDay() {
        return toMmPerDay(velocity);
    }

    public static double toMmPerDay(double metersPerSecond) {
        return metersPerSecond * MM_PER_M * SECONDS_PER_DAY;
    }

    public static double fromMmPerDay(double mmPerDay) {
        return mmPerDay / MM_PER_M / SECONDS_PER_DAY;
    }
}
