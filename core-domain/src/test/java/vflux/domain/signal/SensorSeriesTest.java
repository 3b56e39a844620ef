package vflux.domain.signal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SensorSeriesTest {

    @Test
    @DisplayName("Copia defensiva: modificar el array original no altera la serie")
    void arraysAreDefensivelyCopied() {
        // ARRANGE
        double[] time = {0, 1, 2, 3};
        double[] temp = {20, 21, 20, 19};
        SensorSeries series = new SensorSeries("T1", 0.1, time, temp);

        // ACT
        time[0] = 99;
        series.temperature()[0] = 99;

        // ASSERT
        assertEquals(0.0, series.time()[0]);
        assertEquals(20.0, series.temperature()[0]);
        assertEquals(4, series.size());
        assertEquals(3.0, series.span());
    }

    @Test
    @DisplayName("Validación: longitudes distintas, pocas muestras, tiempo no creciente o NaN")
    void invalidSamples_areRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new SensorSeries("T1", 0.1, new double[]{0, 1, 2, 3}, new double[]{1, 2, 3}));
        assertThrows(IllegalArgumentException.class,
                () -> new SensorSeries("T1", 0.1, new double[]{0, 1, 2}, new double[]{1, 2, 3}));
        assertThrows(IllegalArgumentException.class,
                () -> new SensorSeries("T1", 0.1, new double[]{0, 1, 1, 3}, new double[]{1, 2, 3, 4}));
        assertThrows(IllegalArgumentException.class,
                () -> new SensorSeries("T1", 0.1, new double[]{0, 1, 2, 3}, new double[]{1, Double.NaN, 3, 4}));
    }

    @Test
    @DisplayName("equals compara el contenido de los arrays")
    void equals_comparesContent() {
        SensorSeries a = new SensorSeries("T1", 0.1, new double[]{0, 1, 2, 3}, new double[]{1, 2, 3, 4});
        SensorSeries b = new SensorSeries("T1", 0.1, new double[]{0, 1, 2, 3}, new double[]{1, 2, 3, 4});

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, b.toString());
    }
}
