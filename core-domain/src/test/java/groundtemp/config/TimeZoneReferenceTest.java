package groundtemp.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimeZoneReferenceTest {

    @Test
    @DisplayName("Meridianos: 15 grados por hora de desfase")
    void referenceMeridian_shouldBeFifteenDegreesPerHour() {
        assertEquals(0.0, TimeZoneReference.UTC_0.meridianFor(-0.4));
        assertEquals(15.0, TimeZoneReference.UTC_PLUS_1.meridianFor(2.3));
        assertEquals(-75.0, TimeZoneReference.UTC_MINUS_5.meridianFor(-73.9));
        assertEquals(150.0, TimeZoneReference.UTC_PLUS_10.meridianFor(151.2));
    }

    @Test
    @DisplayName("Antimeridiano: UTC±12 se refleja al Oeste de Greenwich")
    void meridianFor_nearAntimeridian_shouldFollowSampleHemisphere() {
        assertEquals(180.0, TimeZoneReference.UTC_12.meridianFor(174.8));
        assertEquals(-180.0, TimeZoneReference.UTC_12.meridianFor(-178.1));
    }

    @Test
    @DisplayName("Índice de la lista de husos")
    void fromIndex_shouldFollowDeclarationOrder() {
        assertEquals(TimeZoneReference.UTC_0, TimeZoneReference.fromIndex(0));
        assertEquals(TimeZoneReference.UTC_PLUS_1, TimeZoneReference.fromIndex(23));
        assertThrows(IllegalArgumentException.class, () -> TimeZoneReference.fromIndex(24));
    }
}
