package groundtemp.domain.surface;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SurfaceMaterialTest {

    private SurfaceMaterial grass;

    @BeforeEach
    void setUp() {
        grass = SurfaceMaterial.builder()
                .name("Grass")
                .albedo(0.25).emissivity(0.95)
                .volumetricHeatCapacity(1.8e6).thermalConductivity(0.6).thickness(0.3)
                .evapotranspirationCoefficient(1.0)
                .build();
    }

    @Test
    @DisplayName("Coeficientes derivados: conductancia y almacenamiento horario")
    void derivedCoefficients_shouldUseThickness() {
        assertEquals(2.0, grass.conductance(), 1e-12);
        assertEquals(150.0, grass.hourlyStorageCoefficient(), 1e-9);
        assertFalse(grass.hasFixedTemperature());
    }

    @Test
    @DisplayName("Validación: Un campo NaN identifica material y propiedad")
    void validate_whenPropertyIsNaN_shouldReportIt() {
        SurfaceMaterial broken = grass.withEmissivity(Double.NaN);

        MissingMaterialPropertyException e = assertThrows(MissingMaterialPropertyException.class, broken::validate);
        assertEquals("Grass", e.getMaterialName());
        assertEquals("em", e.getProperty());
    }

    @Test
    @DisplayName("Validación: Espesor nulo se rechaza")
    void validate_whenThicknessIsZero_shouldThrow() {
        MissingMaterialPropertyException e = assertThrows(MissingMaterialPropertyException.class,
                () -> grass.withThickness(0.0).validate());
        assertEquals("ep", e.getProperty());
    }

    @Test
    @DisplayName("Temperatura impuesta: Sólo se exige FixedTemp")
    void validate_withFixedTemperature_shouldIgnoreThermalProperties() {
        SurfaceMaterial water = SurfaceMaterial.builder()
                .name("Water")
                .albedo(Double.NaN).emissivity(Double.NaN)
                .volumetricHeatCapacity(Double.NaN).thermalConductivity(Double.NaN).thickness(Double.NaN)
                .evapotranspirationCoefficient(Double.NaN)
                .fixedTemperature(22.0)
                .build();

        assertTrue(water.hasFixedTemperature());
        assertSame(water, water.validate());
        assertThrows(MissingMaterialPropertyException.class, () -> water.withFixedTemperature(Double.NaN).validate());
    }
}
