package groundtemp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GroundTemperatureApplicationTest {

    @TempDir
    Path tempDir;

    private static String pointsCsv() {
        StringBuilder header = new StringBuilder("id,x,y,Long,Lat,Material,alb,em,Cv,lambd,ep,kc,FixedTemp");
        StringBuilder sunlit = new StringBuilder("S1,700000,4400000,2.0,40.0,Soil,0.3,0.9,2000000,1.0,0.1,0.9,0");
        StringBuilder shaded = new StringBuilder("S2,700010,4400000,2.0,40.0,Soil,0.3,0.9,2000000,1.0,0.1,0.9,0");
        for (int h = 1; h <= 24; h++) {
            header.append(",Shadow").append(h);
            sunlit.append(",1");
            shaded.append(",0");
        }
        return String.join("\n", header, sunlit, shaded) + "\n";
    }

    @Test
    @DisplayName("Uso incorrecto: Faltan argumentos -> código de salida 1")
    void run_withMissingArguments_shouldFail() {
        assertThat(GroundTemperatureApplication.run(new String[]{"weather.epw"}))
                .isEqualTo(GroundTemperatureApplication.EXIT_ERROR);
    }

    @Test
    @DisplayName("Fichero inexistente: Error fatal -> código de salida 1")
    void run_withMissingWeatherFile_shouldFail() throws IOException {
        Path points = tempDir.resolve("points.csv");
        Files.writeString(points, pointsCsv());

        int exit = GroundTemperatureApplication.run(new String[]{
                tempDir.resolve("missing.epw").toString(), points.toString(), tempDir.resolve("out").toString()});

        assertThat(exit).isEqualTo(GroundTemperatureApplication.EXIT_ERROR);
    }

    @Test
    @DisplayName("Ejecución completa: Escribe ComputedPoints.csv y ComputedPoints.json")
    void run_withValidInputs_shouldWriteOutputs() throws IOException {
        // --- 1. Arrange ---
        Path epw = tempDir.resolve("weather.epw");
        Files.write(epw, TestFixtures.epwYear(), StandardCharsets.ISO_8859_1);
        Path points = tempDir.resolve("points.csv");
        Files.writeString(points, pointsCsv());
        Path config = tempDir.resolve("config.json");
        Files.writeString(config, "{ \"day\": 21, \"month\": 7, \"cpuProcessorCount\": 2 }");
        Path outputDir = tempDir.resolve("out");

        // --- 2. Act ---
        int exit = GroundTemperatureApplication.run(new String[]{
                epw.toString(), points.toString(), outputDir.toString(), config.toString()});

        // --- 3. Assert ---
        assertThat(exit).isEqualTo(GroundTemperatureApplication.EXIT_OK);
        Path csv = outputDir.resolve("ComputedPoints.csv");
        assertThat(csv).exists();
        assertThat(outputDir.resolve(GroundTemperatureApplication.JSON_FILE_NAME)).exists();

        List<String> lines = Files.readAllLines(csv);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(1)).startsWith("S1,");
        assertThat(lines.get(2)).startsWith("S2,");
    }
}
