package groundtemp.physics.solver;

/**
 * Ecuación de balance de energía superficial reducida a la forma A + B·T + C·T⁴ = 0.
 *
 * @param a Término independiente (radiación absorbida, cielo, aire, terreno, inercia y evaporación) [W/m²].
 * @param b Coeficiente lineal (convección + conducción + almacenamiento) [W/m²·K].
 * @param c Coeficiente radiativo em·σ [W/m²·K⁴].
 */
public record EnergyBalanceEquation(double a, double b, double c) {

    public double residual(double temperature) {
        double t2 = temperature * temperature;
        return a + b * temperature + c * t2 * t2;
    }

    public double derivative(double temperature) {
        return b + 4.0 * c * temperature * temperature * temperature;
    }

    public boolean isFinite() {
        return Double.isFinite(a) && Double.isFinite(b) && Double.isFinite(c);
    }
}
