package groundtemp.io;

import groundtemp.domain.simulation.PointTemperatureResult;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Exporta las temperaturas por punto: {@code id,x,y,T01..T24,min_DegC,mean_DegC,max_DegC,converged}.
 * <p>
 * Sólo se entrecomillan los campos que lo necesitan. Los números se escriben en notación decimal
 * sin exponente.
 */
@Slf4j
public class ComputedPointsCsvWriter {

    public static final String DEFAULT_FILE_NAME = "ComputedPoints.csv";

    public void write(List<PointTemperatureResult> points, Path path) throws IOException {
        log.info("Exportando {} puntos a {}", points.size(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(points, writer);
            }
        } catch (IOException e) {
            log.error("Error al escribir {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Escribe la tabla en el {@link Writer} dado. No lo cierra.
     */
    public void write(List<PointTemperatureResult> points, Writer writer) throws IOException {
        ICSVWriter csv = new CSVWriter(writer);
        csv.writeNext(header(), false);
        for (PointTemperatureResult point : points) {
            csv.writeNext(row(point), false);
        }
        csv.flush();
        if (csv.checkError()) {
            throw new IOException("Error de escritura en la tabla de resultados.", csv.getException());
        }
    }

    static String[] header() {
        List<String> names = new ArrayList<>(List.of("id", "x", "y"));
        for (int h = 1; h <= 24; h++) {
            names.add(String.format(Locale.ROOT, "T%02d", h));
        }
        names.addAll(List.of("min_DegC", "mean_DegC", "max_DegC", "converged"));
        return names.toArray(new String[0]);
    }

    static String[] row(PointTemperatureResult point) {
        List<String> values = new ArrayList<>();
        values.add(point.id());
        values.add(format(point.x()));
        values.add(format(point.y()));
        for (double t : point.temperatures()) {
            values.add(format(t));
        }
        values.add(format(point.min()));
        values.add(format(point.mean()));
        values.add(format(point.max()));
        values.add(Boolean.toString(point.converged()));
        return values.toArray(new String[0]);
    }

    static String format(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).toPlainString();
    }
}
