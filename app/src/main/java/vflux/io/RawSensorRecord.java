package vflux.io;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * Lecturas crudas de un termopar tal como vienen en el fichero, con su propio reloj.
 *
 * @param sensorIndex  Posición del sensor en el fichero (0 = primer par de columnas).
 * @param timestamps   Instantes de lectura, crecientes y sin duplicados.
 * @param temperatures Temperaturas (°C) de cada instante.
 */
public record RawSensorRecord(int sensorIndex, LocalDateTime[] timestamps, double[] temperatures) {

    public RawSensorRecord {
        Objects.requireNonNull(timestamps, "Los instantes no pueden ser nulos.");
        Objects.requireNonNull(temperatures, "Las temperaturas no pueden ser nulas.");
        if (timestamps.length != temperatures.length) {
            throw new IllegalArgumentException("Instantes (" + timestamps.length + ") y temperaturas ("
                    + temperatures.length + ") deben tener la misma longitud.");
        }
        timestamps = timestamps.clone();
        temperatures = temperatures.clone();
    }

    public int size() {
        return timestamps.length;
    }

    public LocalDateTime first() {
        return timestamps[0];
    }

    public LocalDateTime last() {
        return timestamps[timestamps.length - 1];
    }

    @Override
    public LocalDateTime[] timestamps() {
        return timestamps.clone();
    }

    @Override
    public double[] temperatures() {
        return temperatures.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawSensorRecord that = (RawSensorRecord) o;
        return sensorIndex == that.sensorIndex
                && Arrays.equals(timestamps, that.timestamps)
                && Arrays.equals(temperatures, that.temperatures);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * sensorIndex + Arrays.hashCode(timestamps)) + Arrays.hashCode(temperatures);
    }

    @Override
    public String toString() {
        return "RawSensorRecord[sensor=" + sensorIndex + ", samples=" + timestamps.length + "]";
    }
}
