package vflux.physics.solver;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.util.Pair;
import vflux.config.FluxAnalysisConfig;
import vflux.config.FrequencyInitialization;
import vflux.domain.signal.HarmonicSignal;
import vflux.domain.signal.SensorSeries;
import vflux.exception.HarmonicFitException;

/**
 * Ajusta T(t) = A + B·sin(ωt + φ) a la serie de un sensor.
 * <p>
 * El proceso tiene tres fases:
 * <ol>
 * <li><b>ω inicial:</b> periodo conocido o pico del espectro ({@link SpectrumAnalyzer}).</li>
 * <li><b>Semilla lineal:</b> con ω fijo, T ≈ c + a·sin ωt + b·cos ωt por mínimos cuadrados
 *     ordinarios, de donde B₀ = √(a²+b²) y φ₀ = atan2(b, a).</li>
 * <li><b>Refinado:</b> Levenberg-Marquardt sobre (A, B, ω, φ) con jacobiano analítico y
 *     presupuesto acotado de evaluaciones e iteraciones.</li>
 * </ol>
 * El resultado se normaliza con {@link HarmonicSignal#fromFit}. La instancia es inmutable y
 * puede compartirse entre hilos.
 */
@Slf4j
@Getter
public class HarmonicParameterExtractor {

    private static final double RELATIVE_TOLERANCE = 1e-10;
    private static final double MINIMUM_CYCLES = 1.5;
    private static final double EXACT_SEED_TOLERANCE = 1e-9;
    // Pivote mínimo de la QR de la proyección lineal
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final FrequencyInitialization frequencyInitialization;
    /** Periodo esperado, en la unidad del vector de tiempo. */
    private final double expectedPeriod;
    private final int maxEvaluations;
    private final int maxIterations;
    /** Segundos por unidad del vector de tiempo. */
    private final double timeUnitSeconds;

    public HarmonicParameterExtractor() {
        this(FluxAnalysisConfig.getDefault());
    }

    /**
     * Extractor para series con el tiempo en horas, tal como las produce el alineador.
     */
    public HarmonicParameterExtractor(FluxAnalysisConfig config) {
        this(config.frequencyInitialization(), config.expectedPeriodHours(),
                config.maxFitEvaluations(), config.maxFitIterations(), HarmonicSignal.SECONDS_PER_HOUR);
    }

    public HarmonicParameterExtractor(FrequencyInitialization frequencyInitialization, double expectedPeriod,
                                      int maxEvaluations, int maxIterations, double timeUnitSeconds) {
        if (frequencyInitialization == null) {
            throw new IllegalArgumentException("La política de inicialización de frecuencia no puede ser nula.");
        }
        if (!(expectedPeriod > 0) || !(timeUnitSeconds > 0)) {
            throw new IllegalArgumentException("El periodo esperado y la unidad de tiempo deben ser positivos.");
        }
        if (maxEvaluations < 1 || maxIterations < 1) {
            throw new IllegalArgumentException("Los presupuestos del optimizador deben ser al menos 1.");
        }
        this.frequencyInitialization = frequencyInitialization;
        this.expectedPeriod = expectedPeriod;
        this.maxEvaluations = maxEvaluations;
        this.maxIterations = maxIterations;
        this.timeUnitSeconds = timeUnitSeconds;
    }

    public HarmonicSignal extract(SensorSeries series) throws HarmonicFitException {
        try {
            return extract(series.time(), series.temperature());
        } catch (HarmonicFitException e) {
            throw new HarmonicFitException("Sensor " + series.sensorId() + ": " + e.getMessage(), e);
        }
    }

    public HarmonicSignal extract(double[] time, double[] temperature) throws HarmonicFitException {
        return extract(time, temperature, frequencyInitialization, expectedPeriod);
    }

    /**
     * Ajuste con un periodo esperado explícito (sólo lo usa la política {@link FrequencyInitialization#KNOWN_PERIOD}).
     */
    public HarmonicSignal extract(double[] time, double[] temperature, double periodHint) throws HarmonicFitException {
        return extract(time, temperature, frequencyInitialization, periodHint);
    }

    /**
     * @param time        Tiempo estrictamente creciente.
     * @param temperature Temperaturas (°C).
     * @param policy      Cómo obtener la ω inicial.
     * @param periodHint  Periodo esperado en la unidad del vector de tiempo.
     * @return Parámetros armónicos normalizados (B ≥ 0, φ en [0, 2π)).
     * @throws IllegalArgumentException si la serie no cumple las precondiciones.
     * @throws HarmonicFitException     si el optimizador agota su presupuesto o el ajuste degenera.
     */
    public HarmonicSignal extract(double[] time, double[] temperature, FrequencyInitialization policy,
                                  double periodHint) throws HarmonicFitException {
        SensorSeries.validateSamples(time, temperature);

        final double initialOmega;
        if (policy == FrequencyInitialization.SPECTRAL_PEAK) {
            initialOmega = SpectrumAnalyzer.dominantAngularFrequency(time, temperature);
        } else {
            if (!(periodHint > 0)) {
                throw new IllegalArgumentException("El periodo esperado debe ser positivo (" + periodHint + ").");
            }
            initialOmega = 2.0 * Math.PI / periodHint;
        }

        double span = time[time.length - 1] - time[0];
        double initialPeriod = 2.0 * Math.PI / initialOmega;
        if (span < MINIMUM_CYCLES * initialPeriod) {
            log.warn("El registro cubre {} unidades de tiempo, menos de {} periodos de {}; el ajuste puede ser poco fiable",
                    span, MINIMUM_CYCLES, initialPeriod);
        }

        double[] start = seedParameters(time, temperature, initialOmega);
        log.debug("Semilla del ajuste: A={}, B={}, ω={}, φ={}", start[0], start[1], start[2], start[3]);

        // Una semilla que ya reproduce la serie a precisión de máquina no admite refinado
        double[] fitted = (seedResidualRms(time, temperature, start) <= EXACT_SEED_TOLERANCE * Math.max(1.0, start[1]))
                ? start
                : refine(time, temperature, start);
        double mean = fitted[0];
        double amplitude = fitted[1];
        double omega = fitted[2];
        double phase = fitted[3];

        for (double p : fitted) {
            if (!Double.isFinite(p)) {
                throw new HarmonicFitException("El ajuste produjo parámetros no finitos.");
            }
        }
        if (omega == 0.0) {
            throw new HarmonicFitException("El ajuste degeneró a frecuencia nula.");
        }

        HarmonicSignal signal = HarmonicSignal.fromFit(mean, amplitude, omega, phase, timeUnitSeconds);
        log.debug("Ajuste armónico: A={}, B={}, periodo={}, φ={}",
                signal.mean(), signal.amplitude(), signal.period(), signal.phase());
        return signal;
    }

    /**
     * Semilla (A, B, ω, φ) por proyección lineal a ω fija.
     * Si la matriz de diseño es singular se recurre a media, semiamplitud pico a pico y φ = 0.
     */
    static double[] seedParameters(double[] time, double[] temperature, double omega) {
        int n = time.length;
        double[][] design = new double[n][2];
        for (int i = 0; i < n; i++) {
            design[i][0] = Math.sin(omega * time[i]);
            design[i][1] = Math.cos(omega * time[i]);
        }
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            regression.newSampleData(temperature, design);
            double[] beta = regression.estimateRegressionParameters();
            return new double[]{beta[0], Math.hypot(beta[1], beta[2]), omega, Math.atan2(beta[2], beta[1])};
        } catch (MathIllegalArgumentException e) {
            log.debug("Proyección lineal singular ({}); se usa la semilla pico a pico", e.getMessage());
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0.0;
            for (double value : temperature) {
                min = Math.min(min, value);
                max = Math.max(max, value);
                sum += value;
            }
            return new double[]{sum / n, (max - min) / 2.0, omega, 0.0};
        }
    }

    static double seedResidualRms(double[] time, double[] temperature, double[] params) {
        double sum = 0.0;
        for (int i = 0; i < time.length; i++) {
            double r = temperature[i] - (params[0] + params[1] * Math.sin(params[2] * time[i] + params[3]));
            sum += r * r;
        }
        return Math.sqrt(sum / time.length);
    }

    private double[] refine(double[] time, double[] temperature, double[] start) throws HarmonicFitException {
        MultivariateJacobianFunction model = point -> {
            double a = point.getEntry(0);
            double b = point.getEntry(1);
            double w = point.getEntry(2);
            double phi = point.getEntry(3);

            RealVector value = new ArrayRealVector(time.length);
            RealMatrix jacobian = new Array2DRowRealMatrix(time.length, 4);
            for (int i = 0; i < time.length; i++) {
                double arg = w * time[i] + phi;
                double s = Math.sin(arg);
                double c = Math.cos(arg);
                value.setEntry(i, a + b * s);
                jacobian.setEntry(i, 0, 1.0);
                jacobian.setEntry(i, 1, s);
                jacobian.setEntry(i, 2, b * time[i] * c);
                jacobian.setEntry(i, 3, b * c);
            }
            return new Pair<>(value, jacobian);
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .model(model)
                .target(temperature)
                .lazyEvaluation(false)
                .maxEvaluations(maxEvaluations)
                .maxIterations(maxIterations)
                .build();

        LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(RELATIVE_TOLERANCE)
                .withParameterRelativeTolerance(RELATIVE_TOLERANCE);
        try {
            LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
            log.debug("Levenberg-Marquardt: {} evaluaciones, {} iteraciones, RMS={}",
                    optimum.getEvaluations(), optimum.getIterations(), optimum.getRMS());
            return optimum.getPoint().toArray();
        } catch (MathIllegalStateException e) {
            throw new HarmonicFitException("El ajuste armónico no convergió: " + e.getMessage(), e);
        }
    }
}
