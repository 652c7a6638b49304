package groundtemp.physics.model;

import groundtemp.domain.weather.DailyWeatherProfile;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class EvapotranspirationModelTest {

    private static final int SUMMER_SOLSTICE = CalendarDay.dayOfYear(6, 21);
    private static final int WINTER_SOLSTICE = CalendarDay.dayOfYear(12, 21);

    private static DailyWeatherProfile profile(double relativeHumidity) {
        double[] air = new double[24];
        double[] ghi = new double[24];
        double[] sky = new double[24];
        double[] rh = new double[24];
        for (int h = 0; h < 24; h++) {
            double celsius = 26.0 + 6.0 * Math.sin(2.0 * Math.PI * (h - 9) / 24.0);
            air[h] = celsius + 273.15;
            sky[h] = WeatherProfileExtractor.skyTemperature(celsius);
            ghi[h] = (h >= 6 && h <= 19) ? 850.0 * Math.sin(Math.PI * (h - 5.5) / 14.0) : 0.0;
            rh[h] = relativeHumidity;
        }
        double[] mean = new double[24];
        Arrays.fill(mean, 288.15);
        return DailyWeatherProfile.builder()
                .month(6).day(21)
                .airTemperature(air).solarRadiation(ghi).skyTemperature(sky).relativeHumidity(rh)
                .yearlyMeanTemperature(mean).yearlyMaxDeviation(new double[24])
                .build();
    }

    @Test
    @DisplayName("El flujo latente nunca es negativo")
    void hourlyLatentHeatFlux_shouldNeverBeNegative() {
        EvapotranspirationModel model = new EvapotranspirationModel(100.0, SUMMER_SOLSTICE, 0.0);

        double[] flux = model.hourlyLatentHeatFlux(profile(60.0), 40.0, 0.3);

        assertEquals(24, flux.length);
        for (int h = 0; h < 24; h++) {
            assertTrue(flux[h] >= 0.0, "Flujo negativo en la hora " + h);
        }
        log.info("Flujo latente a mediodía: {} W/m²", flux[12]);
        assertTrue(flux[12] > flux[2], "El mediodía soleado debe evaporar más que la madrugada");
        assertTrue(flux[12] > 50.0, "A mediodía en verano la evaporación de referencia es significativa");
    }

    @Test
    @DisplayName("Rama nocturna: Sin radiación el albedo no influye y el flujo es menor que a mediodía")
    void hourlyLatentHeatFlux_atNight_shouldNotDependOnAlbedo() {
        EvapotranspirationModel model = new EvapotranspirationModel(100.0, SUMMER_SOLSTICE, 0.0);
        DailyWeatherProfile saturated = profile(100.0);

        double[] dark = model.hourlyLatentHeatFlux(saturated, 40.0, 0.1);
        double[] bright = model.hourlyLatentHeatFlux(saturated, 40.0, 0.9);

        // Hora 2 (02:00-03:00): Rs = 0
        assertEquals(dark[2], bright[2], 1e-12);
        assertTrue(dark[12] > bright[12], "De día una superficie oscura absorbe y evapora más");
        assertTrue(dark[2] < dark[12]);
    }

    @Test
    @DisplayName("Ángulo de puesta de sol: π/2 en el ecuador y acotado en latitudes polares")
    void sunsetHourAngle_shouldBeClampedAtPolarLatitudes() {
        EvapotranspirationModel summer = new EvapotranspirationModel(0.0, SUMMER_SOLSTICE, 0.0);
        EvapotranspirationModel winter = new EvapotranspirationModel(0.0, WINTER_SOLSTICE, 0.0);

        assertEquals(Math.PI / 2.0, summer.sunsetHourAngle(0.0), 1e-12);
        assertEquals(Math.PI, summer.sunsetHourAngle(85.0), 1e-12, "Día polar: el sol no se pone");
        assertEquals(0.0, winter.sunsetHourAngle(85.0), 1e-12, "Noche polar: el sol no sale");
    }

    @Test
    @DisplayName("Noche polar: El cálculo sigue siendo finito")
    void hourlyLatentHeatFlux_inPolarNight_shouldStayFinite() {
        EvapotranspirationModel model = new EvapotranspirationModel(0.0, WINTER_SOLSTICE, 0.0);

        double[] flux = model.hourlyLatentHeatFlux(profile(60.0), 85.0, 0.3);

        for (double value : flux) {
            assertTrue(Double.isFinite(value));
            assertTrue(value >= 0.0);
        }
    }

    @Test
    @DisplayName("Ángulo horario: Cero a mediodía solar sin corrección de longitud")
    void solarHourAngle_shouldIncreaseFifteenDegreesPerHour() {
        EvapotranspirationModel model = new EvapotranspirationModel(0.0, SUMMER_SOLSTICE, 0.0);

        double step = model.solarHourAngle(13) - model.solarHourAngle(12);
        assertEquals(Math.PI / 12.0, step, 1e-12);

        // Un desplazamiento de +15° de longitud adelanta el tiempo solar una hora
        EvapotranspirationModel shifted = new EvapotranspirationModel(0.0, SUMMER_SOLSTICE, 15.0);
        assertEquals(model.solarHourAngle(13), shifted.solarHourAngle(12), 1e-3);
    }

    @Test
    @DisplayName("La presión atmosférica disminuye con la altitud")
    void constructor_shouldDeriveAtmosphericPressureFromAltitude() {
        EvapotranspirationModel seaLevel = new EvapotranspirationModel(0.0, SUMMER_SOLSTICE, 0.0);
        EvapotranspirationModel mountain = new EvapotranspirationModel(2000.0, SUMMER_SOLSTICE, 0.0);

        assertEquals(101.3, seaLevel.getAtmosphericPressure(), 1e-9);
        assertTrue(mountain.getAtmosphericPressure() < seaLevel.getAtmosphericPressure());
        assertEquals(0.000665 * mountain.getAtmosphericPressure(), mountain.getPsychrometricConstant(), 1e-12);
    }
}
