package vflux.physics.analyzer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import vflux.domain.signal.HarmonicSignal;
import vflux.domain.signal.SensorSeries;
import vflux.exception.HarmonicFitException;
import vflux.physics.solver.HarmonicParameterExtractor;

import java.util.concurrent.Callable;

/**
 * Tarea que ajusta el armónico de un único sensor. Está pensada para ejecutarse en un pool
 * de hilos: un fallo de convergencia no lanza, queda registrado en {@link #getFailureMessage()}.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class HarmonicFitTask implements Callable<HarmonicFitTask> {

    // --- Entradas ---
    private final SensorSeries series;
    private final HarmonicParameterExtractor extractor;

    // --- Resultados ---
    private HarmonicSignal signal;
    private String failureMessage;

    @Override
    public HarmonicFitTask call() {
        try {
            this.signal = extractor.extract(series);
        } catch (HarmonicFitException e) {
            log.warn("Sin ajuste armónico para el sensor {}: {}", series.sensorId(), e.getMessage());
            this.failureMessage = e.getMessage();
        }
        return this;
    }

    public boolean isFitted() {
        return signal != null;
    }
}
