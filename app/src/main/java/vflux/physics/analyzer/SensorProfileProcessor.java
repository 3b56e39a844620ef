package vflux.physics.analyzer;

import lombok.extern.slf4j.Slf4j;
import vflux.config.FluxAnalysisConfig;
import vflux.domain.flux.FluxAnalysisResult;
import vflux.domain.flux.PairAnalysisOutcome;
import vflux.domain.signal.HarmonicSignal;
import vflux.domain.signal.SensorSeries;
import vflux.physics.solver.HarmonicParameterExtractor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orquestador del análisis de un perfil de sensores.
 * <p>
 * Responsabilidades:
 * 1. Ajustar el armónico de cada sensor una sola vez, en paralelo.
 * 2. Ordenar los sensores por profundidad y formar todos los pares i &lt; j.
 * 3. Delegar cada par en {@link MultiMethodFluxCalculator}.
 * <p>
 * Un sensor sin ajuste produce resultados {@link PairAnalysisOutcome.Status#NO_HARMONIC_FIT}
 * en sus pares; el resto del perfil se sigue calculando.
 */
@Slf4j
public class SensorProfileProcessor implements AutoCloseable {

    private final FluxAnalysisConfig config;
    private final HarmonicParameterExtractor extractor;
    private final MultiMethodFluxCalculator calculator;
    private final ExecutorService threadPool;

    public SensorProfileProcessor(FluxAnalysisConfig config) {
        this(config, new HarmonicParameterExtractor(config), new MultiMethodFluxCalculator());
    }

    public SensorProfileProcessor(FluxAnalysisConfig config, HarmonicParameterExtractor extractor,
                                  MultiMethodFluxCalculator calculator) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.extractor = Objects.requireNonNull(extractor, "El extractor no puede ser nulo.");
        this.calculator = Objects.requireNonNull(calculator, "El calculador no puede ser nulo.");
        this.threadPool = Executors.newFixedThreadPool(Math.max(config.processorCount(), 1));
        log.info("SensorProfileProcessor inicializado. (Hilos: {}, ω ajustada: {})",
                config.processorCount(), config.useFittedFrequency());
    }

    /**
     * Analiza todos los pares del perfil.
     *
     * @param sensors Series de al menos dos sensores, en cualquier orden.
     * @return Un resultado por par, ordenados por (superficial, profundo) según la profundidad.
     */
    public List<PairAnalysisOutcome> analyzeProfile(List<SensorSeries> sensors) {
        Objects.requireNonNull(sensors, "La lista de sensores no puede ser nula.");
        if (sensors.size() < 2) {
            throw new IllegalArgumentException("Se necesitan al menos dos sensores (recibidos: " + sensors.size() + ").");
        }
        long startTime = System.currentTimeMillis();

        List<SensorSeries> ordered = new ArrayList<>(sensors);
        ordered.sort(Comparator.comparingDouble(SensorSeries::depth));

        List<HarmonicFitTask> tasks = new ArrayList<>(ordered.size());
        for (SensorSeries series : ordered) {
            tasks.add(new HarmonicFitTask(series, extractor));
        }
        List<HarmonicFitTask> fits = runAll(tasks);

        List<PairAnalysisOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < fits.size(); i++) {
            for (int j = i + 1; j < fits.size(); j++) {
                outcomes.add(analyzeFittedPair(fits.get(i), fits.get(j)));
            }
        }

        log.info("Perfil de {} sensores analizado: {} pares en {} ms",
                ordered.size(), outcomes.size(), System.currentTimeMillis() - startTime);
        return outcomes;
    }

    /**
     * Analiza un único par en el hilo del llamador. El sensor más somero se toma como superficial.
     */
    public PairAnalysisOutcome analyzePair(SensorSeries first, SensorSeries second) {
        SensorSeries shallow = (first.depth() <= second.depth()) ? first : second;
        SensorSeries deep = (shallow == first) ? second : first;
        return analyzeFittedPair(new HarmonicFitTask(shallow, extractor).call(),
                new HarmonicFitTask(deep, extractor).call());
    }

    private List<HarmonicFitTask> runAll(List<HarmonicFitTask> tasks) {
        List<Future<HarmonicFitTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Ajuste de sensores interrumpido.", e);
        }

        List<HarmonicFitTask> done = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                done.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Ajuste de sensores interrumpido.", e);
            } catch (ExecutionException e) {
                throw new RuntimeException("Error ajustando el sensor " + tasks.get(i).getSeries().sensorId(), e.getCause());
            }
        }
        return done;
    }

    private PairAnalysisOutcome analyzeFittedPair(HarmonicFitTask shallowFit, HarmonicFitTask deepFit) {
        SensorSeries shallow = shallowFit.getSeries();
        SensorSeries deep = deepFit.getSeries();

        if (!shallowFit.isFitted() || !deepFit.isFitted()) {
            HarmonicFitTask failed = shallowFit.isFitted() ? deepFit : shallowFit;
            return PairAnalysisOutcome.noFit(shallow.sensorId(), deep.sensorId(),
                    "Sin ajuste armónico para " + failed.getSeries().sensorId() + ": " + failed.getFailureMessage());
        }

        HarmonicSignal shallowSignal = shallowFit.getSignal();
        HarmonicSignal deepSignal = deepFit.getSignal();
        double omega = config.useFittedFrequency()
                ? (shallowSignal.angularFrequencyPerSecond() + deepSignal.angularFrequencyPerSecond()) / 2.0
                : MultiMethodFluxCalculator.DEFAULT_ANGULAR_FREQUENCY;

        FluxAnalysisResult result = calculator.computeAllMethods(shallowSignal, deepSignal, config.medium(),
                deep.depth() - shallow.depth(), omega);
        log.debug("Par {}→{} calculado (Δz={} m, ω={} rad/s)", shallow.sensorId(), deep.sensorId(),
                result.observation().depthDifference(), omega);
        return PairAnalysisOutcome.computed(shallow.sensorId(), deep.sensorId(), result);
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("SensorProfileProcessor cerrado.");
    }
}
