package vflux.exception;

/**
 * Señala una entrada físicamente imposible: capacidades caloríficas, conductividad,
 * difusividad, separación entre sensores o frecuencia angular no positivas.
 * <p>
 * Indica un error de configuración y nunca debe transformarse silenciosamente en NaN.
 */
public class PhysicalDomainException extends IllegalArgumentException {

    public PhysicalDomainException(String message) {
        super(message);
    }

    /**
     * Comprueba que un parámetro físico sea finito y estrictamente positivo.
     *
     * @param value El valor a validar.
     * @param name  Nombre del parámetro, usado en el mensaje de error.
     * @return El propio valor, para poder encadenar la llamada.
     * @throws PhysicalDomainException si el valor es NaN, infinito o menor o igual a cero.
     */
    public static double requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new PhysicalDomainException(
                    "El parámetro '" + name + "' debe ser finito y positivo (recibido: " + value + ").");
        }
        return value;
    }
}
