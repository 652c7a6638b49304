package groundtemp.physics.model;

import groundtemp.domain.weather.DailyWeatherProfile;
import groundtemp.domain.weather.WeatherDataFormatException;
import groundtemp.domain.weather.WeatherRecord;
import com.opencsv.ICSVParser;
import com.opencsv.RFC4180ParserBuilder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extrae el perfil meteorológico del día objetivo a partir de un registro horario anual (formato EPW).
 * <p>
 * Responsabilidades:
 * <ol>
 * <li>Saltar las filas de cabecera hasta la primera fila numérica.</li>
 * <li>Convertir la temperatura del aire a Kelvin y derivar la temperatura de cielo (correlación de Fuentes).</li>
 * <li>Filtrar las 24 horas del día pedido.</li>
 * <li>Calcular la media anual por hora del día y la desviación máxima respecto a los extremos anuales.</li>
 * </ol>
 * Stateless y Thread-Safe.
 */
@Slf4j
public class WeatherProfileExtractor {

    public static final double KELVIN_OFFSET = 273.15;

    // Columnas EPW (base 0)
    private static final int COL_MONTH = 1;
    private static final int COL_DAY = 2;
    private static final int COL_HOUR = 3;
    private static final int COL_DRY_BULB = 6;
    private static final int COL_RELATIVE_HUMIDITY = 8;
    private static final int COL_GLOBAL_HORIZONTAL = 13;
    private static final int MIN_COLUMNS = COL_GLOBAL_HORIZONTAL + 1;

    private static final int HOURS = DailyWeatherProfile.HOURS_PER_DAY;

    /**
     * Convierte las líneas de texto del fichero en registros horarios.
     *
     * @param lines Todas las líneas del fichero, cabecera incluida.
     * @return Registros en el orden del fichero.
     * @throws WeatherDataFormatException si no hay ninguna fila numérica o alguna fila de datos es inválida.
     */
    public List<WeatherRecord> parseRecords(List<String> lines) {
        int firstDataRow = findFirstDataRow(lines);
        log.debug("Primera fila de datos meteorológicos: línea {}", firstDataRow + 1);

        // El parser guarda estado entre líneas: uno por llamada
        ICSVParser parser = new RFC4180ParserBuilder().build();
        List<WeatherRecord> records = new ArrayList<>(lines.size() - firstDataRow);
        for (int i = firstDataRow; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            records.add(parseRow(parser, line, i + 1));
        }
        return records;
    }

    /**
     * Construye el perfil del día (mes, día) a partir del año completo.
     *
     * @throws WeatherDataFormatException si el día pedido no tiene 24 filas.
     */
    public DailyWeatherProfile extract(List<WeatherRecord> records, int month, int day) {
        List<WeatherRecord> dayRecords = records.stream()
                .filter(r -> r.isOn(month, day))
                .toList();

        if (dayRecords.size() < HOURS) {
            throw new WeatherDataFormatException(
                    "El fichero meteorológico sólo contiene " + dayRecords.size() + " horas para el día " + day + "/" + month + " (se necesitan 24).");
        }
        if (dayRecords.size() > HOURS) {
            log.warn("El día {}/{} aparece {} veces en el fichero; se usan las 24 primeras horas.", day, month, dayRecords.size());
        }

        double[] airTemperature = new double[HOURS];
        double[] solarRadiation = new double[HOURS];
        double[] skyTemperature = new double[HOURS];
        double[] relativeHumidity = new double[HOURS];

        for (int h = 0; h < HOURS; h++) {
            WeatherRecord r = dayRecords.get(h);
            airTemperature[h] = r.dryBulbTemperature() + KELVIN_OFFSET;
            solarRadiation[h] = r.globalHorizontalRadiation();
            skyTemperature[h] = skyTemperature(r.dryBulbTemperature());
            relativeHumidity[h] = r.relativeHumidity();
        }

        double[] yearlyMean = yearlyHourlyMean(records);
        double[] yearlyDeviation = yearlyMaxDeviation(records, yearlyMean);

        log.info("Perfil meteorológico extraído para el {}/{} ({} registros anuales).", day, month, records.size());

        return DailyWeatherProfile.builder()
                .month(month)
                .day(day)
                .airTemperature(airTemperature)
                .solarRadiation(solarRadiation)
                .skyTemperature(skyTemperature)
                .relativeHumidity(relativeHumidity)
                .yearlyMeanTemperature(yearlyMean)
                .yearlyMaxDeviation(yearlyDeviation)
                .build();
    }

    /**
     * Temperatura de cielo (correlación empírica de Fuentes, 1987) redondeada a 2 decimales.
     * <p>
     * Bajo cero se usa la potencia con signo para que |T|^1.5 siga definida.
     *
     * @param airTemperatureCelsius Temperatura del aire en °C.
     * @return Temperatura de cielo en K.
     */
    public static double skyTemperature(double airTemperatureCelsius) {
        double signedPower = Math.signum(airTemperatureCelsius) * Math.pow(Math.abs(airTemperatureCelsius), 1.5);
        double tsky = 0.037536 * signedPower + 0.32 * airTemperatureCelsius + KELVIN_OFFSET;
        return Math.round(tsky * 100.0) / 100.0;
    }

    private double[] yearlyHourlyMean(List<WeatherRecord> records) {
        double[] sum = new double[HOURS];
        int[] count = new int[HOURS];
        for (WeatherRecord r : records) {
            int h = r.hourIndex();
            sum[h] += r.dryBulbTemperature() + KELVIN_OFFSET;
            count[h]++;
        }
        double[] mean = new double[HOURS];
        for (int h = 0; h < HOURS; h++) {
            if (count[h] == 0) {
                throw new WeatherDataFormatException("El fichero meteorológico no contiene datos para la hora " + (h + 1));
            }
            mean[h] = sum[h] / count[h];
        }
        return mean;
    }

    private double[] yearlyMaxDeviation(List<WeatherRecord> records, double[] yearlyMean) {
        double yearMin = Double.POSITIVE_INFINITY;
        double yearMax = Double.NEGATIVE_INFINITY;
        for (WeatherRecord r : records) {
            double kelvin = r.dryBulbTemperature() + KELVIN_OFFSET;
            yearMin = Math.min(yearMin, kelvin);
            yearMax = Math.max(yearMax, kelvin);
        }
        double[] deviation = new double[HOURS];
        for (int h = 0; h < HOURS; h++) {
            deviation[h] = Math.max(yearMax - yearlyMean[h], yearlyMean[h] - yearMin);
        }
        return deviation;
    }

    private int findFirstDataRow(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String first = firstField(lines.get(i));
            if (!first.isEmpty() && first.chars().allMatch(Character::isDigit)) {
                return i;
            }
        }
        throw new WeatherDataFormatException("El fichero meteorológico no contiene ninguna fila de datos numérica.");
    }

    private WeatherRecord parseRow(ICSVParser parser, String line, int lineNumber) {
        String[] fields = splitRow(parser, line, lineNumber);
        if (fields.length < MIN_COLUMNS) {
            throw new WeatherDataFormatException(
                    "Línea " + lineNumber + ": se esperaban al menos " + MIN_COLUMNS + " columnas y hay " + fields.length);
        }
        try {
            return new WeatherRecord(
                    Integer.parseInt(fields[COL_MONTH].trim()),
                    Integer.parseInt(fields[COL_DAY].trim()),
                    Integer.parseInt(fields[COL_HOUR].trim()),
                    Double.parseDouble(fields[COL_DRY_BULB].trim()),
                    Double.parseDouble(fields[COL_RELATIVE_HUMIDITY].trim()),
                    Double.parseDouble(fields[COL_GLOBAL_HORIZONTAL].trim())
            );
        } catch (NumberFormatException e) {
            throw new WeatherDataFormatException("Línea " + lineNumber + ": valor no numérico (" + e.getMessage() + ")", e);
        }
    }

    private static String[] splitRow(ICSVParser parser, String line, int lineNumber) {
        try {
            return parser.parseLine(line);
        } catch (IOException e) {
            throw new WeatherDataFormatException("Línea " + lineNumber + ": fila CSV no válida (" + e.getMessage() + ")", e);
        }
    }

    private static String firstField(String line) {
        int comma = line.indexOf(',');
        return (comma < 0 ? line : line.substring(0, comma)).trim();
    }
}
