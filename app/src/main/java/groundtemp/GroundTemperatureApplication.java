package groundtemp;

import groundtemp.config.ThermalConfig;
import groundtemp.domain.simulation.GroundTemperatureResult;
import groundtemp.domain.surface.PointSample;
import groundtemp.domain.weather.WeatherRecord;
import groundtemp.io.ComputedPointsCsvWriter;
import groundtemp.io.EpwWeatherReader;
import groundtemp.io.JsonFileHandler;
import groundtemp.io.PointSampleCsvReader;
import groundtemp.physics.simulator.GroundTemperatureSimulator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Punto de entrada por línea de comandos.
 * <p>
 * Uso: {@code GroundTemperatureApplication <weather.epw> <points.csv> <outputDir> [config.json]}
 * <p>
 * Escribe {@code ComputedPoints.csv} y {@code ComputedPoints.json} en el directorio de salida.
 */
@Slf4j
public class GroundTemperatureApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final String JSON_FILE_NAME = "ComputedPoints.json";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 3 || args.length > 4) {
            log.error("Uso: GroundTemperatureApplication <weather.epw> <points.csv> <outputDir> [config.json]");
            return EXIT_ERROR;
        }

        Path weatherFile = Path.of(args[0]);
        Path pointsFile = Path.of(args[1]);
        Path outputDir = Path.of(args[2]);
        JsonFileHandler jsonHandler = new JsonFileHandler();

        try {
            ThermalConfig config = args.length == 4
                    ? jsonHandler.readFromFile(Path.of(args[3]), ThermalConfig.class)
                    : ThermalConfig.defaults();

            List<WeatherRecord> records = new EpwWeatherReader().read(weatherFile);
            List<PointSample> points = new PointSampleCsvReader().read(pointsFile);

            GroundTemperatureResult result;
            try (GroundTemperatureSimulator simulator = new GroundTemperatureSimulator(config)) {
                result = simulator.run(records, points);
            }

            new ComputedPointsCsvWriter().write(result.points(), outputDir.resolve(ComputedPointsCsvWriter.DEFAULT_FILE_NAME));
            jsonHandler.writeToFile(result, outputDir.resolve(JSON_FILE_NAME));

            if (!result.isComplete()) {
                log.warn("Resultado parcial: {} fallos, {} puntos rechazados, {} grupos cancelados.",
                        result.failures().size(), result.rejections().size(), result.skipped().size());
            }
            result.meanSurfaceTemperature().ifPresent(mean ->
                    log.info("Temperatura superficial media de la escena: {} °C", String.format("%.2f", mean)));
            log.info(">>> Cálculo completado. Resultados en {}", outputDir.toAbsolutePath());
            return EXIT_OK;

        } catch (IOException e) {
            log.error(">>> FATAL: error de entrada/salida: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            log.error(">>> FATAL: el cálculo no pudo completarse.", e);
            return EXIT_ERROR;
        }
    }
}
