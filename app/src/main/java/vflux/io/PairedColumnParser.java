package vflux.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Convierte una tabla de texto {@code fecha1,temp1,fecha2,temp2,...} en un {@link RawSensorRecord}
 * por sensor. La primera fila es la cabecera; sólo cuenta su número de columnas.
 * <p>
 * Las celdas vacías se ignoran, ya que los sensores pueden tener registros de distinta longitud.
 * Cada sensor se ordena por tiempo y se descartan los instantes duplicados (gana la primera lectura).
 */
@Slf4j
final class PairedColumnParser {

    private PairedColumnParser() {
    }

    static List<RawSensorRecord> toRecords(List<String[]> rows, Object source) throws IOException {
        if (rows.isEmpty()) {
            throw new IOException("El fichero está vacío: " + source);
        }
        String[] header = rows.get(0);
        if (header.length < 2 || header.length % 2 != 0) {
            throw new IOException("La cabecera debe tener pares de columnas tiempo/temperatura (columnas: " + header.length + ").");
        }

        int sensorCount = header.length / 2;
        List<RawSensorRecord> records = new ArrayList<>(sensorCount);
        for (int sensor = 0; sensor < sensorCount; sensor++) {
            records.add(readSensor(rows, sensor));
        }
        log.info("{} sensores cargados ({} filas de datos)", sensorCount, rows.size() - 1);
        return records;
    }

    private static RawSensorRecord readSensor(List<String[]> rows, int sensor) throws IOException {
        int timeColumn = 2 * sensor;
        int tempColumn = timeColumn + 1;
        Map<LocalDateTime, Double> samples = new TreeMap<>();

        for (int r = 1; r < rows.size(); r++) {
            String[] row = rows.get(r);
            if (row.length <= tempColumn || row[timeColumn].isBlank() || row[tempColumn].isBlank()) {
                continue;
            }
            try {
                LocalDateTime instant = parseTimestamp(row[timeColumn]);
                double temperature = Double.parseDouble(row[tempColumn].trim());
                samples.putIfAbsent(instant, temperature);
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new IOException("Valor no válido en la fila " + (r + 1) + ", sensor " + (sensor + 1) + ": " + e.getMessage(), e);
            }
        }

        LocalDateTime[] timestamps = samples.keySet().toArray(new LocalDateTime[0]);
        double[] temperatures = samples.values().stream().mapToDouble(Double::doubleValue).toArray();
        log.debug("Sensor {}: {} lecturas", sensor + 1, timestamps.length);
        return new RawSensorRecord(sensor, timestamps, temperatures);
    }

    /**
     * Fecha-hora ISO-8601 local; se admite espacio como separador entre fecha y hora.
     */
    static LocalDateTime parseTimestamp(String text) {
        return LocalDateTime.parse(text.trim().replace(' ', 'T'));
    }
}
