package groundtemp.domain.simulation;

import groundtemp.domain.surface.EquivalenceKey;

import java.util.Arrays;
import java.util.Objects;

/**
 * Serie diaria de temperaturas superficiales (°C) resuelta para una clave de equivalencia.
 *
 * @param key          Clave de equivalencia resuelta.
 * @param temperatures 24 temperaturas horarias en °C, redondeadas a 2 decimales.
 * @param min          Mínimo diario.
 * @param mean         Media diaria redondeada a 2 decimales.
 * @param max          Máximo diario.
 * @param converged    {@code false} si se alcanzó el tope de ciclos sin equilibrio.
 * @param cycles       Ciclos de 24 horas ejecutados (0 si la temperatura es impuesta).
 * @param equilibriumError Diferencia |T(23) - T0| del último ciclo evaluado, en °C.
 */
public record SolvedSeries(
        EquivalenceKey key,
        double[] temperatures,
        double min,
        double mean,
        double max,
        boolean converged,
        int cycles,
        double equilibriumError
) {

    public SolvedSeries {
        Objects.requireNonNull(key, "La clave no puede ser nula.");
        Objects.requireNonNull(temperatures, "La serie no puede ser nula.");
        if (temperatures.length != 24) {
            throw new IllegalArgumentException("La serie resuelta debe tener 24 valores, tiene " + temperatures.length);
        }
        temperatures = temperatures.clone();
    }

    /**
     * Construye la serie calculando sus estadísticos.
     * La media se redondea a 2 decimales y se mantiene dentro de [min, max].
     */
    public static SolvedSeries of(EquivalenceKey key, double[] temperatures, boolean converged, int cycles, double equilibriumError) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (double t : temperatures) {
            min = Math.min(min, t);
            max = Math.max(max, t);
            sum += t;
        }
        double mean = round2(sum / temperatures.length);
        mean = Math.max(min, Math.min(max, mean));
        return new SolvedSeries(key, temperatures, min, mean, max, converged, cycles, equilibriumError);
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    @Override
    public double[] temperatures() {
        return temperatures.clone();
    }

    public double getTemperatureAt(int hour) {
        return temperatures[hour];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SolvedSeries that = (SolvedSeries) o;
        return converged == that.converged && cycles == that.cycles &&
                Double.compare(equilibriumError, that.equilibriumError) == 0 &&
                Double.compare(min, that.min) == 0 && Double.compare(mean, that.mean) == 0 &&
                Double.compare(max, that.max) == 0 &&
                key.equals(that.key) && Arrays.equals(temperatures, that.temperatures);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(key, min, mean, max, converged, cycles) + Arrays.hashCode(temperatures);
    }
}
