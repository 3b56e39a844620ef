package vflux.exception;

/**
 * El ajuste armónico no convergió dentro del presupuesto de iteraciones o produjo
 * parámetros degenerados.
 * <p>
 * Es una excepción comprobada: el llamador decide si reintenta con otra estimación
 * inicial o descarta el sensor.
 */
public class HarmonicFitException extends Exception {

    public HarmonicFitException(String message) {
        super(message);
    }

    public HarmonicFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
