package groundtemp.config;

import groundtemp.domain.surface.NightShadingConvention;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Contenedor principal para todos los parámetros de un cálculo de temperatura superficial.
 * Agrupa el día objetivo, la localización temporal y las constantes numéricas del balance de energía.
 */
@Value
@Builder
@With
@Jacksonized
public class ThermalConfig {

    /**
     * Día del mes a simular (1-31).
     */
    @Builder.Default
    int day = 21;

    /**
     * Mes a simular (1-12).
     */
    @Builder.Default
    int month = 7;

    /**
     * Huso horario de los datos meteorológicos. Fija el meridiano de referencia del tiempo solar.
     */
    @Builder.Default
    TimeZoneReference timeZone = TimeZoneReference.UTC_PLUS_1;

    /**
     * Altitud de la zona de estudio en metros.
     */
    @Builder.Default
    double altitude = 100.0;

    /**
     * Umbral de equilibrio del ciclo diario en °C.
     */
    @Builder.Default
    double convergenceThreshold = 0.5;

    /**
     * Número máximo de ciclos de 24 horas antes de abandonar la búsqueda del equilibrio.
     */
    @Builder.Default
    int maxCycles = 25;

    /**
     * Ciclos completos necesarios antes de evaluar la convergencia.
     */
    @Builder.Default
    int minCyclesBeforeCheck = 2;

    /**
     * Temperatura superficial supuesta a medianoche para arrancar el primer ciclo (°C).
     */
    @Builder.Default
    double initialSurfaceTemperature = 28.0;

    /**
     * Coeficiente de convección (viento) en W·m⁻²·K⁻¹.
     */
    @Builder.Default
    double convectiveCoefficient = 5.0;

    /**
     * Profundidad a la que se evalúa la temperatura del terreno (m).
     */
    @Builder.Default
    double burialDepth = 0.2;

    /**
     * Criterio para rellenar las horas sin fracción soleada (noche, fuera de ráster).
     */
    @Builder.Default
    NightShadingConvention nightShadingConvention = NightShadingConvention.FIXED_VALUE;

    /**
     * Fracción soleada usada por {@link NightShadingConvention#FIXED_VALUE}.
     */
    @Builder.Default
    double nightSunlitFraction = 0.0;

    /**
     * Número de hilos del pool de resolución.
     */
    @Builder.Default
    int cpuProcessorCount = Runtime.getRuntime().availableProcessors();

    public static ThermalConfig defaults() {
        return ThermalConfig.builder().build();
    }

    /**
     * Comprueba la coherencia de los parámetros.
     *
     * @throws IllegalArgumentException si algún parámetro está fuera de rango.
     */
    public ThermalConfig validate() {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("El mes debe estar entre 1 y 12: " + month);
        }
        if (day < 1 || day > 31) {
            throw new IllegalArgumentException("El día debe estar entre 1 y 31: " + day);
        }
        if (timeZone == null) {
            throw new IllegalArgumentException("El huso horario es obligatorio.");
        }
        if (altitude < 0 || altitude > 10_000) {
            throw new IllegalArgumentException("La altitud debe estar entre 0 y 10000 m: " + altitude);
        }
        if (convergenceThreshold <= 0) {
            throw new IllegalArgumentException("El umbral de convergencia debe ser positivo.");
        }
        if (maxCycles < 1 || minCyclesBeforeCheck < 1) {
            throw new IllegalArgumentException("El número de ciclos debe ser al menos 1.");
        }
        if (nightSunlitFraction < 0 || nightSunlitFraction > 1) {
            throw new IllegalArgumentException("La fracción soleada nocturna debe estar en [0, 1]: " + nightSunlitFraction);
        }
        if (burialDepth <= 0) {
            throw new IllegalArgumentException("La profundidad de referencia debe ser positiva.");
        }
        return this;
    }
}
