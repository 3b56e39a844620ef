package vflux.io;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Carga el libro Excel (.xlsx) de termopares: primera hoja con cabecera
 * {@code fecha1,temp1,fecha2,temp2,...}, el formato que exportan los registradores de campo.
 * <p>
 * Las fechas pueden venir como celdas de fecha de Excel o como texto ISO-8601; las
 * temperaturas como números o texto. Las celdas de fórmula se leen por su valor en caché.
 */
@Slf4j
public class ThermocoupleExcelLoader implements IThermocoupleLoader {

    @Override
    public List<RawSensorRecord> load(Path workbookPath) throws IOException {
        Path path = workbookPath.toAbsolutePath();
        log.info("Cargando termopares desde el libro {}", path);
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }

        List<String[]> rows;
        try (InputStream in = Files.newInputStream(path);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            rows = readRows(workbook.getSheetAt(0), workbook.isDate1904());
        } catch (UnsupportedFileFormatException | POIXMLException e) {
            log.error("{} no es un libro .xlsx válido", path, e);
            throw new IOException("No es un libro Excel (.xlsx) válido: " + path, e);
        } catch (IOException e) {
            log.error("Error al leer el libro {}", path, e);
            throw e;
        }
        return PairedColumnParser.toRecords(rows, path);
    }

    private List<String[]> readRows(Sheet sheet, boolean date1904) {
        List<String[]> rows = new ArrayList<>();
        Row header = sheet.getRow(sheet.getFirstRowNum());
        if (header == null || header.getLastCellNum() <= 0) {
            return rows;
        }
        int width = header.getLastCellNum();
        for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            String[] values = new String[width];
            for (int c = 0; c < width; c++) {
                Cell cell = (row == null) ? null : row.getCell(c);
                boolean timeColumn = (c % 2 == 0) && r > sheet.getFirstRowNum();
                values[c] = cellText(cell, timeColumn, date1904);
            }
            rows.add(values);
        }
        return rows;
    }

    /**
     * Texto equivalente de una celda: las fechas numéricas se pasan a ISO-8601 redondeando al segundo.
     */
    static String cellText(Cell cell, boolean timeColumn, boolean date1904) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                double value = cell.getNumericCellValue();
                return timeColumn
                        ? DateUtil.getLocalDateTime(value, date1904, true).toString()
                        : Double.toString(value);
            case STRING:
                return cell.getStringCellValue().trim();
            // Se deja un texto no convertible para que el análisis lo rechace indicando la fila
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case ERROR:
                return "#ERROR";
            default:
                return "";
        }
    }
}
