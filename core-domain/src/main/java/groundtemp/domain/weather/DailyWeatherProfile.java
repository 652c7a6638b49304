package groundtemp.domain.weather;

import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Perfil meteorológico inmutable del día objetivo junto con las estadísticas anuales por hora.
 * <p>
 * Todas las series tienen 24 valores indexados por hora del día (0-23).
 *
 * @param month               Mes del día objetivo.
 * @param day                 Día del mes objetivo.
 * @param airTemperature      Temperatura del aire [K].
 * @param solarRadiation      Radiación global horizontal [Wh/m²].
 * @param skyTemperature      Temperatura de cielo [K].
 * @param relativeHumidity    Humedad relativa [%].
 * @param yearlyMeanTemperature Media anual de la temperatura del aire para cada hora del día [K].
 * @param yearlyMaxDeviation  Desviación máxima respecto a esa media usando los extremos anuales [K].
 */
@Builder
public record DailyWeatherProfile(
        int month,
        int day,
        double[] airTemperature,
        double[] solarRadiation,
        double[] skyTemperature,
        double[] relativeHumidity,
        double[] yearlyMeanTemperature,
        double[] yearlyMaxDeviation
) {
    public static final int HOURS_PER_DAY = 24;

    public DailyWeatherProfile {
        airTemperature = checkedCopy(airTemperature, "airTemperature");
        solarRadiation = checkedCopy(solarRadiation, "solarRadiation");
        skyTemperature = checkedCopy(skyTemperature, "skyTemperature");
        relativeHumidity = checkedCopy(relativeHumidity, "relativeHumidity");
        yearlyMeanTemperature = checkedCopy(yearlyMeanTemperature, "yearlyMeanTemperature");
        yearlyMaxDeviation = checkedCopy(yearlyMaxDeviation, "yearlyMaxDeviation");
    }

    private static double[] checkedCopy(double[] series, String name) {
        Objects.requireNonNull(series, "La serie " + name + " no puede ser nula.");
        if (series.length != HOURS_PER_DAY) {
            throw new IllegalArgumentException("La serie " + name + " debe tener 24 valores, tiene " + series.length);
        }
        return series.clone();
    }

    // Los accesores devuelven copias: el perfil se comparte entre hilos.

    @Override
    public double[] airTemperature() {
        return airTemperature.clone();
    }

    @Override
    public double[] solarRadiation() {
        return solarRadiation.clone();
    }

    @Override
    public double[] skyTemperature() {
        return skyTemperature.clone();
    }

    @Override
    public double[] relativeHumidity() {
        return relativeHumidity.clone();
    }

    @Override
    public double[] yearlyMeanTemperature() {
        return yearlyMeanTemperature.clone();
    }

    @Override
    public double[] yearlyMaxDeviation() {
        return yearlyMaxDeviation.clone();
    }

    public double getAirTemperatureAt(int hour) {
        return airTemperature[hour];
    }

    public double getSolarRadiationAt(int hour) {
        return solarRadiation[hour];
    }

    public double getSkyTemperatureAt(int hour) {
        return skyTemperature[hour];
    }

    public double getRelativeHumidityAt(int hour) {
        return relativeHumidity[hour];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DailyWeatherProfile that = (DailyWeatherProfile) o;
        return month == that.month && day == that.day &&
                Arrays.equals(airTemperature, that.airTemperature) &&
                Arrays.equals(solarRadiation, that.solarRadiation) &&
                Arrays.equals(skyTemperature, that.skyTemperature) &&
                Arrays.equals(relativeHumidity, that.relativeHumidity) &&
                Arrays.equals(yearlyMeanTemperature, that.yearlyMeanTemperature) &&
                Arrays.equals(yearlyMaxDeviation, that.yearlyMaxDeviation);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(month, day);
        result = 31 * result + Arrays.hashCode(airTemperature);
        result = 31 * result + Arrays.hashCode(solarRadiation);
        result = 31 * result + Arrays.hashCode(skyTemperature);
        result = 31 * result + Arrays.hashCode(relativeHumidity);
        return result;
    }

    @Override
    public String toString() {
        return "DailyWeatherProfile{" + day + "/" + month + "}";
    }
}
