package vflux.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThermocoupleCsvLoaderTest {

    @TempDir
    Path tempDir;

    private final ThermocoupleCsvLoader loader = new ThermocoupleCsvLoader();

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("termopares.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Carga pares de columnas con relojes propios, ignora celdas vacías y duplicados")
    void load_readsSensorPairs() throws IOException {
        // ARRANGE
        Path csv = write(String.join("\n",
                "time1,temp1,time2,temp2",
                "2024-06-01 00:00:00,20.0,2024-06-01 00:30:00,18.0",
                "2024-06-01 01:00:00,22.0,2024-06-01 01:30:00,19.0",
                "2024-06-01 02:00:00,21.0,,",
                "2024-06-01 01:00:00,99.0,2024-06-01T02:30:00,20.0",
                ""));

        // ACT
        List<RawSensorRecord> records = loader.load(csv);

        // ASSERT
        assertEquals(2, records.size());
        RawSensorRecord first = records.get(0);
        assertEquals(0, first.sensorIndex());
        assertEquals(3, first.size());
        assertArrayEquals(new double[]{20.0, 22.0, 21.0}, first.temperatures(), 0.0);
        assertEquals(LocalDateTime.of(2024, 6, 1, 0, 0), first.first());

        RawSensorRecord second = records.get(1);
        assertEquals(3, second.size());
        assertEquals(LocalDateTime.of(2024, 6, 1, 2, 30), second.last());
    }

    @Test
    @DisplayName("Las lecturas desordenadas se ordenan por tiempo")
    void load_sortsByTime() throws IOException {
        Path csv = write(String.join("\n",
                "time1,temp1",
                "2024-06-01T02:00,3.0",
                "2024-06-01T00:00,1.0",
                "2024-06-01T01:00,2.0"));

        RawSensorRecord record = loader.load(csv).get(0);

        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, record.temperatures(), 0.0);
    }

    @Test
    @DisplayName("Cabecera con un número impar de columnas: IOException")
    void load_oddHeader_throws() throws IOException {
        Path csv = write("time1,temp1,time2\n2024-06-01T00:00,1.0,2024-06-01T00:00\n");

        assertThrows(IOException.class, () -> loader.load(csv));
    }

    @Test
    @DisplayName("Temperatura no numérica: IOException con la fila")
    void load_badNumber_throws() throws IOException {
        Path csv = write("time1,temp1\n2024-06-01T00:00,abc\n");

        IOException e = assertThrows(IOException.class, () -> loader.load(csv));
        assertTrue(e.getMessage().contains("fila 2"));
    }

    @Test
    @DisplayName("Fichero inexistente: IOException")
    void load_missingFile_throws() {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("no_existe.csv")));
    }
}
