package groundtemp.physics.model;

import groundtemp.domain.weather.DailyWeatherProfile;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Evapotranspiración de referencia horaria (método Penman-Monteith, FAO-56) expresada como flujo
 * de calor latente [W/m²].
 * <p>
 * Los términos que sólo dependen del día y del lugar (presión, constante psicrométrica, distancia
 * Tierra-Sol, declinación y corrección estacional) se calculan una vez en el constructor. El modelo
 * es inmutable y se comparte entre hilos.
 */
@Slf4j
@Getter
public class EvapotranspirationModel {

    /**
     * Constante de Stefan-Boltzmann en MJ·m⁻²·h⁻¹·K⁻⁴.
     */
    public static final double HOURLY_STEFAN_BOLTZMANN = 2.043e-10;

    /**
     * Cociente Rs/Rso supuesto durante la noche, cuando no hay radiación de cielo despejado.
     */
    public static final double NIGHT_CLEAR_SKY_RATIO = 0.8;

    /**
     * Velocidad de viento nominal (perfil logarítmico, 1 km/h a la altura de referencia) [m/s].
     */
    public static final double NOMINAL_WIND_SPEED = 0.27 * (4.87 / Math.log(67.8 * 2 - 5.42));

    /**
     * Calor latente de vaporización [J/kg].
     */
    public static final double LATENT_HEAT_OF_VAPORIZATION = 2_260_000.0;

    private static final double DAY_WIND_COEFFICIENT = 0.24;
    private static final double NIGHT_WIND_COEFFICIENT = 0.96;
    private static final double DAY_SOIL_HEAT_FRACTION = 0.1;
    private static final double NIGHT_SOIL_HEAT_FRACTION = 0.5;
    private static final double MID_HOUR_OFFSET = 0.5;
    private static final double SOLAR_CONSTANT = 0.0820; // MJ·m⁻²·min⁻¹

    private final double altitude;
    private final int dayOfYear;
    private final double longitudeOffset;

    private final double atmosphericPressure;
    private final double psychrometricConstant;
    private final double inverseRelativeDistance;
    private final double solarDeclination;
    private final double seasonalCorrection;

    /**
     * @param altitude        Altitud del lugar [m].
     * @param dayOfYear       Ordinal del día objetivo.
     * @param longitudeOffset Longitud media de los puntos menos el meridiano del huso [grados].
     */
    public EvapotranspirationModel(double altitude, int dayOfYear, double longitudeOffset) {
        this.altitude = altitude;
        this.dayOfYear = dayOfYear;
        this.longitudeOffset = longitudeOffset;

        this.atmosphericPressure = 101.3 * Math.pow((293.0 - 0.0065 * altitude) / 293.0, 5.26);
        this.psychrometricConstant = 0.000665 * atmosphericPressure;
        this.inverseRelativeDistance = 1.0 + 0.033 * Math.cos((2.0 * Math.PI / 365.0) * dayOfYear);
        this.solarDeclination = 0.409 * Math.sin((2.0 * Math.PI / 365.0) * dayOfYear - 1.39);

        double b = 2.0 * Math.PI * (dayOfYear - 81) / 364.0;
        this.seasonalCorrection = 0.1645 * Math.sin(2.0 * b) - 0.1255 * Math.cos(b) - 0.025 * Math.sin(b);

        log.debug("EvapotranspirationModel: P={} kPa, gamma={}, dr={}, delta={} rad, Sc={} h",
                atmosphericPressure, psychrometricConstant, inverseRelativeDistance, solarDeclination, seasonalCorrection);
    }

    /**
     * Ángulo horario de la puesta de sol ωs. Se acota a [0, π] en latitudes polares
     * (noche polar: nunca es de día; día polar: siempre es de día).
     */
    public double sunsetHourAngle(double latitudeDegrees) {
        double phi = Math.toRadians(latitudeDegrees);
        double cosWs = -Math.tan(phi) * Math.tan(solarDeclination);
        return Math.acos(Math.max(-1.0, Math.min(1.0, cosWs)));
    }

    /**
     * Ángulo horario solar en el punto medio de la hora.
     */
    public double solarHourAngle(int hour) {
        double solarTime = hour + MID_HOUR_OFFSET + 0.06667 * longitudeOffset + seasonalCorrection;
        return (Math.PI / 12.0) * (solarTime - 12.0);
    }

    /**
     * Calcula el flujo de calor latente de referencia para las 24 horas.
     *
     * @param weather  Perfil meteorológico del día.
     * @param latitude Latitud del punto [grados].
     * @param albedo   Albedo del material.
     * @return 24 flujos en W/m², nunca negativos.
     */
    public double[] hourlyLatentHeatFlux(DailyWeatherProfile weather, double latitude, double albedo) {
        final double phi = Math.toRadians(latitude);
        final double ws = sunsetHourAngle(latitude);
        final double clearSkyFactor = 0.75 + 2e-5 * altitude;

        double[] flux = new double[DailyWeatherProfile.HOURS_PER_DAY];
        for (int h = 0; h < flux.length; h++) {
            // 1. Variables de humedad y temperatura
            double tMean = weather.getAirTemperatureAt(h) - 273.3;
            double rs = weather.getSolarRadiationAt(h) * 0.0036; // Wh/m² -> MJ/m²
            double rns = (1.0 - albedo) * rs;

            double es = 0.6108 * Math.exp(17.27 * tMean / (tMean + 237.3));
            double ea = es * (weather.getRelativeHumidityAt(h) / 100.0);
            double slope = 4098.0 * es / Math.pow(tMean + 237.3, 2);

            // 2. Rama día/noche según el ángulo horario
            double omega = solarHourAngle(h);
            boolean daytime = omega > -ws && omega < ws;

            double clearSkyRatio = NIGHT_CLEAR_SKY_RATIO;
            double soilFraction = NIGHT_SOIL_HEAT_FRACTION;
            double windCoefficient = NIGHT_WIND_COEFFICIENT;
            if (daytime) {
                double omega1 = omega - Math.PI / 24.0;
                double omega2 = omega + Math.PI / 24.0;
                double ra = (12.0 * 60.0 / Math.PI) * SOLAR_CONSTANT * inverseRelativeDistance
                        * ((omega2 - omega1) * Math.sin(phi) * Math.sin(solarDeclination)
                        + Math.cos(phi) * Math.cos(solarDeclination) * (Math.sin(omega2) - Math.sin(omega1)));
                double rso = clearSkyFactor * ra;
                // Un Rso nulo (horizonte) dejaría Rs/Rso indefinido
                if (rso > 0) {
                    clearSkyRatio = rs / rso;
                }
                soilFraction = DAY_SOIL_HEAT_FRACTION;
                windCoefficient = DAY_WIND_COEFFICIENT;
            }

            // 3. Balance radiativo
            double rnl = HOURLY_STEFAN_BOLTZMANN * Math.pow(tMean + 273.16, 4)
                    * (0.34 - 0.14 * Math.sqrt(ea)) * (1.35 * clearSkyRatio - 0.35);
            double rn = rns - rnl;
            double g = soilFraction * rn;

            // 4. Ponderación Penman-Monteith
            double denominator = slope + psychrometricConstant * (1.0 + windCoefficient * NOMINAL_WIND_SPEED);
            double etRadiation = (slope / denominator) * (0.408 * rn - g);
            double etWind = (psychrometricConstant / denominator) * (37.0 / (tMean + 273.0)) * NOMINAL_WIND_SPEED * (es - ea);

            // mm/h -> W/m²
            double latent = (etRadiation + etWind) * LATENT_HEAT_OF_VAPORIZATION / 3600.0;
            flux[h] = Math.max(0.0, latent);
        }
        return flux;
    }
}
