package vflux.config;

import lombok.Builder;
import lombok.With;
import vflux.domain.medium.ThermalMedium;

import java.util.List;
import java.util.Objects;

/**
 * Un objeto de valor inmutable con todos los parámetros de un análisis de flujo vertical.
 * <p>
 * Sustituye a las constantes globales (λ, Cs, Cw, profundidades) que antes se
 * repetían entre scripts: todo cálculo recibe la configuración de forma explícita.
 * Los campos numéricos que lleguen a cero desde el JSON toman su valor por defecto.
 *
 * @param medium                  Propiedades térmicas del lecho.
 * @param sensorDepths            Profundidad de cada sensor (m), en el orden de las columnas del fichero.
 * @param resampleStepMinutes     Paso de la malla común de remuestreo, en minutos.
 * @param frequencyInitialization Política de estimación inicial de ω.
 * @param expectedPeriodHours     Periodo esperado del ciclo dominante (h), usado por {@link FrequencyInitialization#KNOWN_PERIOD}.
 * @param useFittedFrequency      Si es {@code true}, la inversión usa la ω media ajustada del par en lugar de 2π/86400.
 * @param maxFitEvaluations       Presupuesto de evaluaciones del optimizador Levenberg-Marquardt.
 * @param maxFitIterations        Presupuesto de iteraciones del optimizador.
 * @param processorCount          Número de hilos para ajustar sensores en paralelo.
 */
@Builder
@With
public record FluxAnalysisConfig(
        ThermalMedium medium,
        List<Double> sensorDepths,
        double resampleStepMinutes,
        FrequencyInitialization frequencyInitialization,
        double expectedPeriodHours,
        boolean useFittedFrequency,
        int maxFitEvaluations,
        int maxFitIterations,
        int processorCount
) {
    public static final double DEFAULT_RESAMPLE_STEP_MINUTES = 15.0;
    public static final double DEFAULT_PERIOD_HOURS = 24.0;
    public static final int DEFAULT_MAX_EVALUATIONS = 5000;
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    public FluxAnalysisConfig {
        Objects.requireNonNull(medium, "La configuración debe incluir las propiedades térmicas del medio.");
        sensorDepths = (sensorDepths == null) ? List.of() : List.copyOf(sensorDepths);
        if (resampleStepMinutes <= 0) resampleStepMinutes = DEFAULT_RESAMPLE_STEP_MINUTES;
        if (frequencyInitialization == null) frequencyInitialization = FrequencyInitialization.KNOWN_PERIOD;
        if (expectedPeriodHours <= 0) expectedPeriodHours = DEFAULT_PERIOD_HOURS;
        if (maxFitEvaluations <= 0) maxFitEvaluations = DEFAULT_MAX_EVALUATIONS;
        if (maxFitIterations <= 0) maxFitIterations = DEFAULT_MAX_ITERATIONS;
        if (processorCount <= 0) processorCount = 1;
    }

    /**
     * Configuración de referencia: arena saturada con termopares a 10, 20 y 30 cm,
     * muestreo de 15 minutos y ciclo diario conocido.
     */
    public static FluxAnalysisConfig getDefault() {
        return FluxAnalysisConfig.builder()
                .medium(ThermalMedium.saturatedSand())
                .sensorDepths(List.of(0.10, 0.20, 0.30))
                .resampleStepMinutes(DEFAULT_RESAMPLE_STEP_MINUTES)
                .frequencyInitialization(FrequencyInitialization.KNOWN_PERIOD)
                .expectedPeriodHours(DEFAULT_PERIOD_HOURS)
                .useFittedFrequency(false)
                .maxFitEvaluations(DEFAULT_MAX_EVALUATIONS)
                .maxFitIterations(DEFAULT_MAX_ITERATIONS)
                .processorCount(2)
                .build();
    }
}
