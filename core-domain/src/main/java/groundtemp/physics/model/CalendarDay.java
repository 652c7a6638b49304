package groundtemp.physics.model;

/**
 * Conversión del día objetivo a ordinal anual sobre un calendario no bisiesto.
 */
public final class CalendarDay {

    private static final int[] DAYS_IN_MONTH = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    private CalendarDay() {}

    /**
     * @param month Mes (1-12).
     * @param day   Día del mes.
     * @return Ordinal del día en el año (1 = 1 de enero).
     * @throws IllegalArgumentException si la fecha no existe en un año no bisiesto.
     */
    public static int dayOfYear(int month, int day) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Mes fuera de rango: " + month);
        }
        if (day < 1 || day > DAYS_IN_MONTH[month - 1]) {
            throw new IllegalArgumentException("El día " + day + " no existe en el mes " + month);
        }
        int ordinal = day;
        for (int m = 0; m < month - 1; m++) {
            ordinal += DAYS_IN_MONTH[m];
        }
        return ordinal;
    }
}
