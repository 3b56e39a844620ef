package vflux.report;

import vflux.domain.flux.FluxAnalysisResult;
import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.PairAnalysisOutcome;

import java.util.List;
import java.util.Locale;

/**
 * Informe de texto plano con los resultados de cada par de sensores.
 * <p>
 * Los valores indefinidos se muestran como "n/d"; {@value #FALLBACK_MARK} marca un valor
 * de respaldo y {@value #PROVISIONAL_MARK} un método pendiente de verificación.
 */
public class FluxReportFormatter {

    static final String UNDEFINED = "n/d";
    static final String FALLBACK_MARK = "†";
    static final String PROVISIONAL_MARK = "*";

    public String format(List<PairAnalysisOutcome> outcomes) {
        StringBuilder sb = new StringBuilder();
        for (PairAnalysisOutcome outcome : outcomes) {
            sb.append(format(outcome)).append(System.lineSeparator());
        }
        sb.append(PROVISIONAL_MARK).append(" método provisional   ")
                .append(FALLBACK_MARK).append(" respaldo Hatch-Amplitud (discriminante < 0)")
                .append(System.lineSeparator());
        return sb.toString();
    }

    public String format(PairAnalysisOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append("Par ").append(outcome.pairLabel());
        if (!outcome.isComputed()) {
            sb.append(": SIN AJUSTE ARMÓNICO (").append(outcome.message()).append(')').append(System.lineSeparator());
            return sb.toString();
        }
        FluxAnalysisResult result = outcome.result();
        sb.append(String.format(Locale.ROOT, "  Δz=%.3f m  ΔA=%s  Δφ=%s rad  α=%.3e m²/s%n",
                result.observation().depthDifference(),
                number(result.observation().amplitudeLogRatio(), "%.4f"),
                number(result.observation().phaseDifference(), "%.4f"),
                result.thermalDiffusivity()));
        sb.append(String.format(Locale.ROOT, "  %-18s %14s %12s  %s%n", "Método", "v (m/s)", "v (mm/día)", "Estado"));
        for (FluxMethodType type : FluxMethodType.values()) {
            FluxEstimate estimate = result.estimate(type);
            if (estimate != null) {
                sb.append(formatRow(estimate));
            }
        }
        return sb.toString();
    }

    String formatRow(FluxEstimate estimate) {
        String name = estimate.method().displayName()
                + (estimate.provisional() ? PROVISIONAL_MARK : "")
                + (estimate.fallbackUsed() ? FALLBACK_MARK : "");
        String status = estimate.isDefined() ? "ok" : estimate.undefinedReason().name();
        return String.format(Locale.ROOT, "  %-18s %14s %12s  %s%n",
                name,
                number(estimate.velocity(), "%.4e"),
                number(estimate.velocityMmPerDay(), "%.3f"),
                status);
    }

    private static String number(double value, String pattern) {
        return Double.isNaN(value) ? UNDEFINED : String.format(Locale.ROOT, pattern, value);
    }
}
