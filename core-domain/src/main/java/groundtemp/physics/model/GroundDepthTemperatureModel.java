package groundtemp.physics.model;

import groundtemp.domain.surface.SurfaceMaterial;
import groundtemp.domain.weather.DailyWeatherProfile;

/**
 * Modelo de temperatura del terreno en profundidad.
 * <p>
 * Propaga la onda térmica anual hasta la profundidad de referencia con la solución clásica de
 * conducción periódica (amortiguamiento exponencial y desfase proporcional a Z/Zo). El resultado
 * actúa como condición de contorno constante del balance de energía.
 */
public class GroundDepthTemperatureModel {

    private static final double SECONDS_IN_A_DAY = 86400.0;
    private static final double ANNUAL_ANGULAR_FREQUENCY = 2.0 * Math.PI / 365.0;

    private final double burialDepth;

    /**
     * @param burialDepth Profundidad Z a la que se evalúa el terreno [m].
     */
    public GroundDepthTemperatureModel(double burialDepth) {
        if (burialDepth <= 0) {
            throw new IllegalArgumentException("La profundidad de referencia debe ser positiva: " + burialDepth);
        }
        this.burialDepth = burialDepth;
    }

    /**
     * Profundidad de amortiguamiento Zo = sqrt(2·Dh/w) con Dh la difusividad en m²/día.
     */
    public double dampingDepth(SurfaceMaterial material) {
        double diffusivity = (material.thermalConductivity() / material.volumetricHeatCapacity()) * SECONDS_IN_A_DAY;
        return Math.sqrt(2.0 * diffusivity / ANNUAL_ANGULAR_FREQUENCY);
    }

    /**
     * Calcula la temperatura del terreno para cada hora del día.
     *
     * @param material  Material de la capa superficial.
     * @param weather   Perfil con las estadísticas anuales por hora.
     * @param dayOfYear Ordinal del día objetivo.
     * @return 24 temperaturas en K.
     */
    public double[] boundaryTemperature(SurfaceMaterial material, DailyWeatherProfile weather, int dayOfYear) {
        final double zo = dampingDepth(material);
        final double ratio = burialDepth / zo;
        final double attenuation = Math.exp(-ratio);
        final double phase = Math.cos(ANNUAL_ANGULAR_FREQUENCY * dayOfYear - ratio);

        double[] yearlyMean = weather.yearlyMeanTemperature();
        double[] deviation = weather.yearlyMaxDeviation();
        double[] tint = new double[DailyWeatherProfile.HOURS_PER_DAY];
        for (int h = 0; h < tint.length; h++) {
            tint[h] = yearlyMean[h] - deviation[h] * attenuation * phase;
        }
        return tint;
    }
}
