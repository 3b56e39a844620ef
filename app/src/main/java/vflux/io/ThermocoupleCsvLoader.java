package vflux.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Carga el CSV de termopares: una cabecera {@code time1,temp1,time2,temp2,...} y, por
 * cada sensor, un par de columnas con su propio reloj (fecha-hora ISO-8601 local, se admite
 * espacio como separador) y su temperatura.
 */
@Slf4j
public class ThermocoupleCsvLoader implements IThermocoupleLoader {

    private static final CsvMapper csvMapper = createConfiguredMapper();

    private static CsvMapper createConfiguredMapper() {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        return mapper;
    }

    @Override
    public List<RawSensorRecord> load(Path csvPath) throws IOException {
        Path path = csvPath.toAbsolutePath();
        log.info("Cargando termopares desde {}", path);
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }

        List<String[]> rows;
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class).readValues(path.toFile())) {
            rows = iterator.readAll();
        } catch (IOException e) {
            log.error("Error al leer el CSV {}", path, e);
            throw e;
        }
        return PairedColumnParser.toRecords(rows, path);
    }
}
