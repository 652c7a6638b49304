package groundtemp.io;

import groundtemp.domain.weather.WeatherRecord;
import groundtemp.physics.model.WeatherProfileExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Lee un fichero meteorológico EPW y lo convierte en registros horarios.
 * Las cabeceras EPW suelen venir en Latin-1.
 */
@Slf4j
@RequiredArgsConstructor
public class EpwWeatherReader {

    private final WeatherProfileExtractor extractor;

    public EpwWeatherReader() {
        this(new WeatherProfileExtractor());
    }

    /**
     * @throws IOException Si el archivo no se puede leer.
     * @throws groundtemp.domain.weather.WeatherDataFormatException si el contenido no es un EPW válido.
     */
    public List<WeatherRecord> read(Path path) throws IOException {
        log.info("Leyendo fichero meteorológico: {}", path.toAbsolutePath());
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            log.error("Error al leer el fichero meteorológico {}", path.toAbsolutePath(), e);
            throw e;
        }
        List<WeatherRecord> records = extractor.parseRecords(lines);
        log.info("{} registros horarios leídos.", records.size());
        return records;
    }
}
