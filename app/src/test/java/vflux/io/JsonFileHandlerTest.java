package vflux.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import vflux.config.FluxAnalysisConfig;
import vflux.config.FrequencyInitialization;
import vflux.domain.flux.FluxEstimate;
import vflux.domain.flux.FluxMethodType;
import vflux.domain.flux.UndefinedReason;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileHandlerTest {

    @TempDir
    Path tempDir;

    private final JsonFileHandler handler = new JsonFileHandler();

    @Test
    @DisplayName("La configuración sobrevive a escritura y lectura")
    void config_survivesWriteAndRead() throws IOException {
        // ARRANGE
        FluxAnalysisConfig original = FluxAnalysisConfig.getDefault()
                .withFrequencyInitialization(FrequencyInitialization.SPECTRAL_PEAK);
        Path file = tempDir.resolve("sub/config.json");

        // ACT
        handler.writeToFile(original, file);
        FluxAnalysisConfig read = handler.readFromFile(file, FluxAnalysisConfig.class);

        // ASSERT
        assertEquals(original, read);
    }

    @Test
    @DisplayName("Campos omitidos toman su valor por defecto y los desconocidos se ignoran")
    void partialConfig_getsDefaults() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\n"
                + "  \"medium\": {\"thermalConductivity\": 1.8, \"sedimentHeatCapacity\": 2.4e6, \"waterHeatCapacity\": 4.18e6},\n"
                + "  \"sensorDepths\": [0.05, 0.15],\n"
                + "  \"comentario\": \"campaña de verano\"\n"
                + "}");

        FluxAnalysisConfig config = handler.readFromFile(file, FluxAnalysisConfig.class);

        assertEquals(1.8, config.medium().thermalConductivity());
        assertEquals(2, config.sensorDepths().size());
        assertEquals(FluxAnalysisConfig.DEFAULT_RESAMPLE_STEP_MINUTES, config.resampleStepMinutes());
        assertEquals(FrequencyInitialization.KNOWN_PERIOD, config.frequencyInitialization());
        assertEquals(1, config.processorCount());
    }

    @Test
    @DisplayName("Las estimaciones incluyen la velocidad en mm/día y el motivo de indefinición")
    void estimate_serializesMmPerDayAndNaN() throws IOException {
        String defined = handler.toJson(FluxEstimate.computed(FluxMethodType.LUCE, 1.0e-6));
        String undefined = handler.toJson(FluxEstimate.undefined(FluxMethodType.LUCE, UndefinedReason.AMPLITUDE_RATIO_NOT_ABOVE_ONE));

        assertTrue(defined.contains("\"velocityMmPerDay\""), defined);
        assertTrue(defined.contains("\"LUCE\""), defined);
        assertTrue(undefined.contains("NaN"), undefined);
        assertTrue(undefined.contains("AMPLITUDE_RATIO_NOT_ABOVE_ONE"));
    }

    @Test
    @DisplayName("Leer un fichero inexistente lanza IOException")
    void missingFile_throws() {
        assertThrows(IOException.class, () -> handler.readFromFile(tempDir.resolve("nada.json"), FluxAnalysisConfig.class));
    }
}
