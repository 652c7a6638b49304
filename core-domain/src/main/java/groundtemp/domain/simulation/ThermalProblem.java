package groundtemp.domain.simulation;

import groundtemp.domain.surface.EquivalenceKey;
import groundtemp.domain.surface.SurfaceMaterial;
import groundtemp.domain.weather.DailyWeatherProfile;
import lombok.Builder;

import java.util.Objects;

/**
 * Datos de entrada inmutables para resolver un grupo de equivalencia.
 *
 * @param key                Clave del grupo.
 * @param representativeId   Punto representativo (para trazas).
 * @param material           Material del grupo.
 * @param sunlitFraction     Fracción soleada horaria del grupo.
 * @param weather            Perfil meteorológico del día.
 * @param groundTemperature  Temperatura del terreno en profundidad por hora [K].
 * @param latentHeatFlux     Flujo de evapotranspiración de referencia por hora [W/m²].
 */
@Builder
public record ThermalProblem(
        EquivalenceKey key,
        String representativeId,
        SurfaceMaterial material,
        double[] sunlitFraction,
        DailyWeatherProfile weather,
        double[] groundTemperature,
        double[] latentHeatFlux
) {

    public ThermalProblem {
        Objects.requireNonNull(key, "La clave no puede ser nula.");
        Objects.requireNonNull(material, "El material no puede ser nulo.");
        Objects.requireNonNull(weather, "El perfil meteorológico no puede ser nulo.");
        sunlitFraction = Objects.requireNonNull(sunlitFraction, "sunlitFraction").clone();
        groundTemperature = Objects.requireNonNull(groundTemperature, "groundTemperature").clone();
        latentHeatFlux = Objects.requireNonNull(latentHeatFlux, "latentHeatFlux").clone();
    }

    public double getSunlitFractionAt(int hour) {
        return sunlitFraction[hour];
    }

    public double getGroundTemperatureAt(int hour) {
        return groundTemperature[hour];
    }

    public double getLatentHeatFluxAt(int hour) {
        return latentHeatFlux[hour];
    }

    /**
     * Problema trivial para materiales con temperatura impuesta: no necesita forzamientos.
     */
    public static ThermalProblem fixed(EquivalenceKey key, String representativeId, SurfaceMaterial material, DailyWeatherProfile weather) {
        double[] none = new double[DailyWeatherProfile.HOURS_PER_DAY];
        return new ThermalProblem(key, representativeId, material, key.sunlitFractions(), weather, none, none);
    }
}
