package vflux.io;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import vflux.domain.signal.SensorSeries;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lleva las lecturas crudas de todos los sensores a una malla temporal común y regular.
 * <p>
 * La malla cubre sólo el solape de todos los sensores, de modo que la interpolación lineal
 * nunca extrapola y las series resultantes no tienen huecos. El tiempo de salida va en horas
 * desde el inicio de la malla.
 */
@Slf4j
public final class SeriesAligner {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private SeriesAligner() {
    }

    /**
     * @param raw    Lecturas de cada sensor.
     * @param depths Profundidad de cada sensor (m), en el mismo orden.
     * @param step   Paso de la malla.
     * @return Una {@link SensorSeries} por sensor con identificadores "T1", "T2", ...
     * @throws IllegalArgumentException si no hay solape suficiente o las profundidades no cuadran.
     */
    public static List<SensorSeries> alignAndResample(List<RawSensorRecord> raw, List<Double> depths, Duration step) {
        Objects.requireNonNull(raw, "Las lecturas no pueden ser nulas.");
        Objects.requireNonNull(depths, "Las profundidades no pueden ser nulas.");
        if (step == null || step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("El paso de remuestreo debe ser positivo.");
        }
        if (raw.size() != depths.size()) {
            throw new IllegalArgumentException("Hay " + raw.size() + " sensores pero " + depths.size() + " profundidades.");
        }

        LocalDateTime start = null;
        LocalDateTime end = null;
        for (RawSensorRecord record : raw) {
            if (record.size() < 2) {
                throw new IllegalArgumentException("El sensor " + (record.sensorIndex() + 1) + " tiene menos de dos lecturas.");
            }
            if (start == null || record.first().isAfter(start)) start = record.first();
            if (end == null || record.last().isBefore(end)) end = record.last();
        }
        if (start == null || !end.isAfter(start)) {
            throw new IllegalArgumentException("Los registros de los sensores no se solapan en el tiempo.");
        }

        List<LocalDateTime> grid = new ArrayList<>();
        for (LocalDateTime t = start; !t.isAfter(end); t = t.plus(step)) {
            grid.add(t);
        }
        double[] gridHours = new double[grid.size()];
        for (int i = 0; i < gridHours.length; i++) {
            gridHours[i] = hoursBetween(start, grid.get(i));
        }
        log.info("Malla común: {} → {} cada {} min ({} puntos)", start, end, step.toMinutes(), grid.size());

        LinearInterpolator interpolator = new LinearInterpolator();
        List<SensorSeries> aligned = new ArrayList<>(raw.size());
        for (int s = 0; s < raw.size(); s++) {
            RawSensorRecord record = raw.get(s);
            LocalDateTime[] stamps = record.timestamps();
            double[] knots = new double[stamps.length];
            for (int i = 0; i < stamps.length; i++) {
                knots[i] = hoursBetween(start, stamps[i]);
            }
            PolynomialSplineFunction function = interpolator.interpolate(knots, record.temperatures());

            double[] resampled = new double[gridHours.length];
            for (int i = 0; i < gridHours.length; i++) {
                resampled[i] = function.value(gridHours[i]);
            }
            aligned.add(new SensorSeries("T" + (record.sensorIndex() + 1), depths.get(s), gridHours, resampled));
        }
        return aligned;
    }

    private static double hoursBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }
}
