package groundtemp.domain.simulation;

import java.util.Arrays;
import java.util.Objects;

/**
 * Resultado final de un punto original: identificador, coordenadas y la serie de su grupo.
 */
public record PointTemperatureResult(
        String id,
        double x,
        double y,
        double[] temperatures,
        double min,
        double mean,
        double max,
        boolean converged
) {

    public PointTemperatureResult {
        Objects.requireNonNull(id, "El identificador no puede ser nulo.");
        temperatures = temperatures.clone();
    }

    @Override
    public double[] temperatures() {
        return temperatures.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PointTemperatureResult that = (PointTemperatureResult) o;
        return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0 &&
                Double.compare(min, that.min) == 0 && Double.compare(mean, that.mean) == 0 &&
                Double.compare(max, that.max) == 0 && converged == that.converged &&
                id.equals(that.id) && Arrays.equals(temperatures, that.temperatures);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, x, y, min, mean, max, converged) + Arrays.hashCode(temperatures);
    }
}
