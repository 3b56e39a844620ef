package vflux.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Fuente de lecturas crudas de termopares con un par de columnas tiempo/temperatura por sensor.
 */
public interface IThermocoupleLoader {

    /**
     * @param path Ruta del fichero.
     * @return Un registro por sensor, en el orden de las columnas.
     * @throws IOException si el fichero no existe, no se puede leer o su formato no es válido.
     */
    List<RawSensorRecord> load(Path path) throws IOException;
}
