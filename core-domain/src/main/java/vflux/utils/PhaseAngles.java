package vflux.utils;

/**
 * Utilidades de normalización de ángulos de fase (radianes).
 * <p>
 * La fase sólo tiene sentido módulo 2π; estas funciones la llevan a un rango canónico
 * para evitar valores grandes espurios cuando el ajuste "da la vuelta".
 */
public final class PhaseAngles {

    public static final double TWO_PI = 2.0 * Math.PI;

    private PhaseAngles() {
    }

    /**
     * Normaliza un ángulo al intervalo (−π, π].
     * Es idempotente: {@code normalizeSigned(normalizeSigned(x)) == normalizeSigned(x)}.
     *
     * @param angle Ángulo en radianes (cualquier valor real).
     * @return Ángulo equivalente en (−π, π], o NaN si la entrada no es finita.
     */
    public static double normalizeSigned(double angle) {
        if (!Double.isFinite(angle)) {
            return Double.NaN;
        }
        double r = angle % TWO_PI;
        if (r > Math.PI) {
            r -= TWO_PI;
        } else if (r <= -Math.PI) {
            r += TWO_PI;
        }
        return r;
    }

    /**
     * Envuelve un ángulo al intervalo [0, 2π).
     *
     * @param angle Ángulo en radianes.
     * @return Ángulo equivalente en [0, 2π), o NaN si la entrada no es finita.
     */
    public static double wrapPositive(double angle) {
        if (!Double.isFinite(angle)) {
            return Double.NaN;
        }
        double r = angle % TWO_PI;
        if (r < 0.0) {
            r += TWO_PI;
        }
        // El redondeo de r + 2π con r diminuto negativo puede dar exactamente 2π.
        return (r >= TWO_PI) ? 0.0 : r;
    }

    /**
     * Re-normaliza un desfase ya normalizado a (−π, π] como retraso no negativo en [0, 2π).
     * Lo usan los métodos que asumen que la señal profunda siempre llega después.
     */
    public static double foldLag(double phaseDifference) {
        double normalized = normalizeSigned(phaseDifference);
        if (normalized >= 0.0 || Double.isNaN(normalized)) {
            return normalized;
        }
        double lag = normalized + TWO_PI;
        // Un desfase negativo diminuto redondea a 2π: es un retraso nulo, no una vuelta completa.
        return (lag >= TWO_PI) ? 0.0 : lag;
    }
}
