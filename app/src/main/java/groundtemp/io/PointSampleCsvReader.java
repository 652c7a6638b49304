package groundtemp.io;

import groundtemp.domain.surface.PointSample;
import groundtemp.domain.surface.SurfaceMaterial;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lee la tabla de puntos de muestreo generada por el preprocesado geográfico.
 * <p>
 * Las columnas se localizan por nombre de cabecera. Las celdas vacías o no numéricas se leen como
 * {@code NaN}: en las sombras las rellena la convención nocturna y en el material provocan el
 * rechazo del punto al simplificar. Los campos entre comillas (RFC 4180) pueden contener comas.
 */
@Slf4j
public class PointSampleCsvReader {

    private static final int HOURS = 24;

    private static final String[] REQUIRED_COLUMNS = {"id", "x", "y", "Long", "Lat", "Material"};
    private static final String[] MATERIAL_COLUMNS = {"alb", "em", "Cv", "lambd", "ep", "kc", "FixedTemp"};

    public List<PointSample> read(Path path) throws IOException {
        log.info("Leyendo puntos de muestreo: {}", path.toAbsolutePath());
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            log.error("Error al leer la tabla de puntos {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee la tabla completa y cierra el lector.
     *
     * @throws IOException Si falta la cabecera, alguna columna obligatoria, una coordenada no es numérica
     *                     o hay comillas sin cerrar.
     */
    public List<PointSample> read(Reader source) throws IOException {
        try (CSVReader csv = new CSVReaderBuilder(source)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            String[] header = readNext(csv);
            if (header == null) {
                throw new IOException("La tabla de puntos está vacía.");
            }
            Map<String, Integer> columns = indexColumns(header);
            for (String required : REQUIRED_COLUMNS) {
                requireColumn(columns, required);
            }
            for (String required : MATERIAL_COLUMNS) {
                requireColumn(columns, required);
            }
            for (int h = 1; h <= HOURS; h++) {
                requireColumn(columns, "Shadow" + h);
            }

            List<PointSample> points = new ArrayList<>();
            String[] fields;
            while ((fields = readNext(csv)) != null) {
                if (isBlank(fields)) {
                    continue;
                }
                points.add(parseRow(fields, columns, csv.getLinesRead()));
            }
            log.info("{} puntos de muestreo leídos.", points.size());
            return points;
        }
    }

    private static String[] readNext(CSVReader csv) throws IOException {
        try {
            return csv.readNext();
        } catch (CsvValidationException e) {
            throw new IOException("Línea " + csv.getLinesRead() + ": fila CSV no válida.", e);
        }
    }

    private static boolean isBlank(String[] fields) {
        for (String field : fields) {
            if (!field.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private PointSample parseRow(String[] fields, Map<String, Integer> columns, long lineNumber) throws IOException {
        String id = text(fields, columns, "id");
        if (id.isEmpty()) {
            throw new IOException("Línea " + lineNumber + ": el punto no tiene identificador.");
        }

        SurfaceMaterial material = SurfaceMaterial.builder()
                .name(text(fields, columns, "Material"))
                .albedo(number(fields, columns, "alb"))
                .emissivity(number(fields, columns, "em"))
                .volumetricHeatCapacity(number(fields, columns, "Cv"))
                .thermalConductivity(number(fields, columns, "lambd"))
                .thickness(number(fields, columns, "ep"))
                .evapotranspirationCoefficient(number(fields, columns, "kc"))
                .fixedTemperature(number(fields, columns, "FixedTemp"))
                .build();

        double[] sunlit = new double[HOURS];
        for (int h = 0; h < HOURS; h++) {
            sunlit[h] = number(fields, columns, "Shadow" + (h + 1));
        }

        return PointSample.builder()
                .id(id)
                .x(coordinate(fields, columns, "x", lineNumber))
                .y(coordinate(fields, columns, "y", lineNumber))
                .longitude(coordinate(fields, columns, "Long", lineNumber))
                .latitude(coordinate(fields, columns, "Lat", lineNumber))
                .material(material)
                .sunlitFraction(sunlit)
                .build();
    }

    private double coordinate(String[] fields, Map<String, Integer> columns, String column, long lineNumber) throws IOException {
        double value = number(fields, columns, column);
        if (!Double.isFinite(value)) {
            throw new IOException("Línea " + lineNumber + ": la columna " + column + " no es numérica.");
        }
        return value;
    }

    private static Map<String, Integer> indexColumns(String[] names) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            // BOM de ficheros exportados desde hojas de cálculo
            columns.put(names[i].trim().replace("\uFEFF", ""), i);
        }
        return columns;
    }

    private static void requireColumn(Map<String, Integer> columns, String name) throws IOException {
        if (!columns.containsKey(name)) {
            throw new IOException("Falta la columna obligatoria '" + name + "' en la tabla de puntos.");
        }
    }

    private static String text(String[] fields, Map<String, Integer> columns, String column) {
        int index = columns.get(column);
        return index < fields.length ? fields[index].trim() : "";
    }

    private static double number(String[] fields, Map<String, Integer> columns, String column) {
        String value = text(fields, columns, column);
        if (value.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Valor no numérico '{}' en la columna {}; se interpreta como ausente.", value, column);
            return Double.NaN;
        }
    }
}
