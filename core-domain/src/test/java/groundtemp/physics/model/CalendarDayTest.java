package groundtemp.physics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CalendarDayTest {

    @Test
    @DisplayName("Ordinal anual sobre calendario no bisiesto")
    void dayOfYear_shouldCountFromFirstOfJanuary() {
        assertEquals(1, CalendarDay.dayOfYear(1, 1));
        assertEquals(60, CalendarDay.dayOfYear(3, 1));
        assertEquals(202, CalendarDay.dayOfYear(7, 21));
        assertEquals(365, CalendarDay.dayOfYear(12, 31));
    }

    @Test
    @DisplayName("Fechas inexistentes se rechazan")
    void dayOfYear_whenDateDoesNotExist_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> CalendarDay.dayOfYear(2, 29));
        assertThrows(IllegalArgumentException.class, () -> CalendarDay.dayOfYear(13, 1));
        assertThrows(IllegalArgumentException.class, () -> CalendarDay.dayOfYear(4, 31));
    }
}
