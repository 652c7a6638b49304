package groundtemp.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tabla de husos horarios disponibles para el cálculo del tiempo solar.
 * <p>
 * Cada entrada lleva el meridiano de referencia del huso en grados Este (15° por hora de desfase).
 * El orden de las constantes es el mismo que el del selector de la herramienta de escritorio, de modo
 * que {@link #fromIndex(int)} acepta el índice de esa lista.
 */
@Getter
@RequiredArgsConstructor
public enum TimeZoneReference {

    UTC_0("UTC 0 Greenwich London, Lisbon, Abidjan", 0.0),
    UTC_MINUS_1("UTC -1 Azores, Cabo Verde", -15.0),
    UTC_MINUS_2("UTC -2", -30.0),
    UTC_MINUS_3("UTC -3 Greenland, Brasilia, Buenos Aires", -45.0),
    UTC_MINUS_4("UTC -4 Santiago, Caracas, La Paz", -60.0),
    UTC_MINUS_5("UTC -5 Montreal, New York, Lima, Havana", -75.0),
    UTC_MINUS_6("UTC -6 Chicago, Mexico, Dallas", -90.0),
    UTC_MINUS_7("UTC -7 Denver, Edmonton", -105.0),
    UTC_MINUS_8("UTC -8 Los Angeles, Vancouver", -120.0),
    UTC_MINUS_9("UTC -9 Alaska", -135.0),
    UTC_MINUS_10("UTC -10 French Polynesia, Hawaii", -150.0),
    UTC_MINUS_11("UTC -11 Tonga", -165.0),
    UTC_12("UTC -12 / +12 Auckland, Fiji, Marshall Islands", 180.0),
    UTC_PLUS_11("UTC +11 New Caledonia, Solomon Islands", 165.0),
    UTC_PLUS_10("UTC +10 Sydney, Melbourne", 150.0),
    UTC_PLUS_9("UTC +9 Tokyo, Seoul, Central Australia", 135.0),
    UTC_PLUS_8("UTC +8 Beijing, Hong Kong, Western Australia", 120.0),
    UTC_PLUS_7("UTC +7 Thailand, Vietnam", 105.0),
    UTC_PLUS_6("UTC +6 Nur-Sultan, Bangladesh", 90.0),
    UTC_PLUS_5("UTC +5 Uzbekistan, Pakistan, New Delhi", 75.0),
    UTC_PLUS_4("UTC +4 Tehran, Oman", 60.0),
    UTC_PLUS_3("UTC +3 Moscow, Istanbul, Nairobi", 45.0),
    UTC_PLUS_2("UTC +2 Kyiv, Cairo, Cape Town", 30.0),
    UTC_PLUS_1("UTC +1 Berlin, Paris, Madrid, Algiers", 15.0);

    private static final double ANTIMERIDIAN_THRESHOLD = 170.0;

    private final String label;
    private final double referenceMeridian;

    /**
     * Meridiano de referencia ajustado al hemisferio de la zona de estudio.
     * <p>
     * El antimeridiano (180°) se refleja a -180° cuando los puntos están al Oeste de Greenwich.
     *
     * @param meanSampleLongitude Longitud media de los puntos de muestreo (grados Este).
     * @return Meridiano de referencia en grados Este.
     */
    public double meridianFor(double meanSampleLongitude) {
        if (referenceMeridian > ANTIMERIDIAN_THRESHOLD && meanSampleLongitude < 0) {
            return -referenceMeridian;
        }
        return referenceMeridian;
    }

    public static TimeZoneReference fromIndex(int index) {
        TimeZoneReference[] values = values();
        if (index < 0 || index >= values.length) {
            throw new IllegalArgumentException("Índice de huso horario fuera de rango [0, " + (values.length - 1) + "]: " + index);
        }
        return values[index];
    }
}
