package vflux.domain.signal;

import java.util.Arrays;
import java.util.Objects;

/**
 * Serie de temperatura de un sensor, ya alineada a una malla temporal.
 * <p>
 * El núcleo de cálculo sólo exige tiempo estrictamente creciente y ausencia de huecos;
 * el remuestreo es responsabilidad del cargador de datos.
 *
 * @param sensorId    Identificador del sensor (ej: "T1").
 * @param depth       Profundidad del sensor bajo el lecho (m), positiva hacia abajo.
 * @param time        Vector de tiempo (unidad arbitraria, típicamente horas desde el inicio).
 * @param temperature Temperaturas medidas (°C).
 */
public record SensorSeries(
        String sensorId,
        double depth,
        double[] time,
        double[] temperature
) {
    public static final int MINIMUM_SAMPLES = 4;

    public SensorSeries {
        Objects.requireNonNull(sensorId, "El identificador del sensor no puede ser nulo.");
        Objects.requireNonNull(time, "El vector de tiempo no puede ser nulo.");
        Objects.requireNonNull(temperature, "El vector de temperatura no puede ser nulo.");
        if (!Double.isFinite(depth)) {
            throw new IllegalArgumentException("La profundidad del sensor " + sensorId + " debe ser finita.");
        }
        validateSamples(time, temperature);

        time = time.clone();
        temperature = temperature.clone();
    }

    /**
     * Comprueba las precondiciones de una serie muestreada: misma longitud, al menos
     * {@value #MINIMUM_SAMPLES} muestras, tiempo finito y estrictamente creciente y
     * temperaturas finitas.
     *
     * @throws IllegalArgumentException si alguna precondición no se cumple.
     */
    public static void validateSamples(double[] time, double[] temperature) {
        if (time.length != temperature.length) {
            throw new IllegalArgumentException("Los vectores de tiempo (" + time.length
                    + ") y temperatura (" + temperature.length + ") deben tener la misma longitud.");
        }
        if (time.length < MINIMUM_SAMPLES) {
            throw new IllegalArgumentException("Se necesitan al menos " + MINIMUM_SAMPLES + " muestras (recibidas: " + time.length + ").");
        }
        for (int i = 0; i < time.length; i++) {
            if (!Double.isFinite(time[i]) || !Double.isFinite(temperature[i])) {
                throw new IllegalArgumentException("Valor no finito en la muestra " + i + ".");
            }
            if (i > 0 && time[i] <= time[i - 1]) {
                throw new IllegalArgumentException("El tiempo debe ser estrictamente creciente (muestra " + i + ").");
            }
        }
    }

    public int size() {
        return time.length;
    }

    /**
     * Duración total cubierta por la serie, en la unidad del vector de tiempo.
     */
    public double span() {
        return time[time.length - 1] - time[0];
    }

    @Override
    public double[] time() {
        return time.clone();
    }

    @Override
    public double[] temperature() {
        return temperature.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SensorSeries that = (SensorSeries) o;
        return Double.compare(depth, that.depth) == 0 &&
                sensorId.equals(that.sensorId) &&
                Arrays.equals(time, that.time) &&
                Arrays.equals(temperature, that.temperature);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sensorId, depth);
        result = 31 * result + Arrays.hashCode(time);
        result = 31 * result + Arrays.hashCode(temperature);
        return result;
    }

    @Override
    public String toString() {
        return "SensorSeries[" + sensorId + ", depth=" + depth + ", samples=" + time.length + "]";
    }
}
