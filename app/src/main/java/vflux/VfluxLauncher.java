package vflux;

import lombok.extern.slf4j.Slf4j;
import vflux.config.FluxAnalysisConfig;
import vflux.domain.flux.PairAnalysisOutcome;
import vflux.domain.signal.SensorSeries;
import vflux.io.IThermocoupleLoader;
import vflux.io.JsonFileHandler;
import vflux.io.RawSensorRecord;
import vflux.io.SeriesAligner;
import vflux.io.ThermocoupleCsvLoader;
import vflux.io.ThermocoupleExcelLoader;
import vflux.physics.analyzer.SensorProfileProcessor;
import vflux.report.FluxReportFormatter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Punto de entrada de línea de comandos.
 * <p>
 * Uso: {@code vflux config.json datos.(csv|xlsx) [resultados.json]}. El lector de datos se elige
 * por la extensión del fichero: {@code .xlsx} se lee como libro Excel y el resto como CSV.
 */
@Slf4j
public class VfluxLauncher {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private final JsonFileHandler jsonFileHandler;
    private final IThermocoupleLoader csvLoader;
    private final IThermocoupleLoader excelLoader;
    private final FluxReportFormatter formatter;
    private final PrintStream out;

    public VfluxLauncher() {
        this(new JsonFileHandler(), new ThermocoupleCsvLoader(), new ThermocoupleExcelLoader(),
                new FluxReportFormatter(), System.out);
    }

    VfluxLauncher(JsonFileHandler jsonFileHandler, IThermocoupleLoader csvLoader, IThermocoupleLoader excelLoader,
                  FluxReportFormatter formatter, PrintStream out) {
        this.jsonFileHandler = jsonFileHandler;
        this.csvLoader = csvLoader;
        this.excelLoader = excelLoader;
        this.formatter = formatter;
        this.out = out;
    }

    public static void main(String[] args) {
        int code = new VfluxLauncher().run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Ejecuta el análisis completo y devuelve el código de salida.
     */
    public int run(String[] args) {
        if (args == null || args.length < 2 || args.length > 3) {
            out.println("Uso: vflux <config.json> <datos.csv|datos.xlsx> [resultados.json]");
            return EXIT_USAGE;
        }
        try {
            FluxAnalysisConfig config = jsonFileHandler.readFromFile(Path.of(args[0]), FluxAnalysisConfig.class);
            Path dataPath = Path.of(args[1]);
            List<RawSensorRecord> raw = loaderFor(dataPath).load(dataPath);
            long stepSeconds = Math.round(config.resampleStepMinutes() * 60.0);
            List<SensorSeries> series = SeriesAligner.alignAndResample(raw, config.sensorDepths(), Duration.ofSeconds(stepSeconds));

            List<PairAnalysisOutcome> outcomes;
            try (SensorProfileProcessor processor = new SensorProfileProcessor(config)) {
                outcomes = processor.analyzeProfile(series);
            }
            out.print(formatter.format(outcomes));

            if (args.length == 3) {
                jsonFileHandler.writeToFile(outcomes, Path.of(args[2]));
            }
            return EXIT_OK;
        } catch (IOException | IllegalArgumentException e) {
            log.error("El análisis no pudo completarse: {}", e.getMessage());
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    IThermocoupleLoader loaderFor(Path dataPath) {
        String name = dataPath.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xlsx") ? excelLoader : csvLoader;
    }
}
