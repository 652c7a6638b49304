package groundtemp.domain.surface;

/**
 * Criterio para las horas sin fracción soleada (noche o fuera de la cobertura de los rásters de sombra).
 * <p>
 * Los valores ausentes llegan como {@code NaN}.
 */
public enum NightShadingConvention {

    /**
     * Todas las horas ausentes toman un valor fijo configurable (0 = totalmente en sombra).
     */
    FIXED_VALUE,

    /**
     * Cada hora ausente repite el último valor observado. Antes de la primera observación se usa el valor fijo.
     */
    LAST_OBSERVED;

    /**
     * Devuelve una copia de la serie con los huecos rellenos.
     *
     * @param sunlitFractions Serie horaria con {@code NaN} en las horas sin dato.
     * @param fixedValue      Valor de relleno por defecto.
     */
    public double[] fill(double[] sunlitFractions, double fixedValue) {
        double[] filled = sunlitFractions.clone();
        double last = fixedValue;
        for (int h = 0; h < filled.length; h++) {
            if (Double.isNaN(filled[h])) {
                filled[h] = (this == LAST_OBSERVED) ? last : fixedValue;
            } else {
                last = filled[h];
            }
        }
        return filled;
    }
}
