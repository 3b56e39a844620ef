package vflux.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura JSON de la configuración del análisis y de sus resultados.
 * <p>
 * Trabaja con cualquier tipo compatible con Jackson, incluidos los records del dominio.
 */
@Slf4j
public class JsonFileHandler {

    // Thread-safe una vez configurado; se reutiliza.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Las claves desconocidas de un JSON de configuración no deben abortar la carga
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a JSON. Si el fichero existe se sobrescribe.
     *
     * @param data     Objeto a serializar. No puede ser nulo.
     * @param filePath Ruta de destino (ej: "resultados/perfil_norte.json").
     * @throws IOException Si falla la escritura.
     */
    public <T> void writeToFile(T data, Path filePath) throws IOException {
        Path path = filePath.toAbsolutePath();
        log.info("Serializando {} a {}", data.getClass().getSimpleName(), path);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    /**
     * Reconstruye un objeto a partir de un fichero JSON.
     *
     * @param filePath   Ruta del fichero.
     * @param objectType Tipo destino (ej: FluxAnalysisConfig.class).
     * @throws IOException Si el fichero no existe o su contenido no es válido.
     */
    public <T> T readFromFile(Path filePath, Class<T> objectType) throws IOException {
        Path path = filePath.toAbsolutePath();
        log.info("Deserializando {} a {}", path, objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON {}", path, e);
            throw e;
        }
    }

    /**
     * Representación JSON en memoria, para informes y tests.
     */
    public String toJson(Object data) throws IOException {
        return objectMapper.writeValueAsString(data);
    }
}
