package groundtemp.domain.weather;

/**
 * Una fila horaria del fichero meteorológico anual.
 *
 * @param month                     Mes (1-12).
 * @param day                       Día del mes (1-31).
 * @param hour                      Hora del fichero (1-24, la hora 1 cubre 00:00-01:00).
 * @param dryBulbTemperature        Temperatura seca del aire [°C].
 * @param relativeHumidity          Humedad relativa [%].
 * @param globalHorizontalRadiation Radiación global horizontal [Wh/m²].
 */
public record WeatherRecord(
        int month,
        int day,
        int hour,
        double dryBulbTemperature,
        double relativeHumidity,
        double globalHorizontalRadiation
) {

    public boolean isOn(int targetMonth, int targetDay) {
        return month == targetMonth && day == targetDay;
    }

    /**
     * Índice horario 0-23 usado por todas las series diarias.
     */
    public int hourIndex() {
        return Math.floorMod(hour - 1, 24);
    }
}
