package groundtemp.physics.solver;

import lombok.extern.slf4j.Slf4j;

/**
 * Biblioteca estática para resolver la ecuación cuártica del balance de energía.
 * <p>
 * Con B y C positivos la función es estrictamente creciente para T &gt; 0, de modo que
 * la raíz positiva es única. Se usa Newton-Raphson desde la semilla (convergencia cuadrática)
 * y, si el paso diverge, bisección sobre un intervalo amplio como red de seguridad.
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class QuarticRootSolver {

    private static final int MAX_ITERATIONS = 50;
    private static final int MAX_BISECTIONS = 200;
    private static final double TOLERANCE = 1e-9;        // Residuo objetivo [W/m²]
    private static final double STEP_TOLERANCE = 1e-12;  // Paso mínimo [K]
    private static final double RESIDUAL_LIMIT = 1e-6;   // Residuo máximo aceptado

    private static final double DEFAULT_GUESS = 300.0;
    private static final double BRACKET_LOW = 1.0;
    private static final double BRACKET_HIGH = 1000.0;
    private static final double PHYSICAL_LOW = 200.0;
    private static final double PHYSICAL_HIGH = 340.0;

    private QuarticRootSolver() {}

    /**
     * Encuentra la temperatura T [K] que anula la ecuación.
     *
     * @param equation     Coeficientes del balance.
     * @param initialGuess Semilla [K]. Si no es positiva se usa 300 K.
     * @return La raíz positiva, con residuo inferior a 1e-6.
     * @throws RootFindingException si los coeficientes no son finitos o no existe raíz positiva.
     */
    public static double solve(EnergyBalanceEquation equation, double initialGuess) {
        if (!equation.isFinite()) {
            throw new RootFindingException("Coeficientes no finitos: " + equation);
        }

        // Caso lineal (emisividad nula)
        if (equation.c() == 0.0) {
            if (equation.b() == 0.0) {
                throw new RootFindingException("Ecuación degenerada: " + equation);
            }
            return accept(equation, -equation.a() / equation.b());
        }

        double t = (initialGuess > 0 && Double.isFinite(initialGuess)) ? initialGuess : DEFAULT_GUESS;

        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double f = equation.residual(t);
            if (Math.abs(f) < TOLERANCE) {
                return accept(equation, t);
            }

            double df = equation.derivative(t);
            if (Math.abs(df) < 1e-12) break; // Derivada plana

            double next = t - f / df;
            if (!Double.isFinite(next)) break;

            // Mantener la iteración en la rama positiva
            if (next <= 0) {
                next = t / 2.0;
            }
            if (Math.abs(next - t) < STEP_TOLERANCE) {
                return accept(equation, next);
            }
            t = next;
        }

        log.debug("Newton-Raphson no convergió para {}, se recurre a bisección.", equation);
        return accept(equation, bisect(equation));
    }

    private static double bisect(EnergyBalanceEquation equation) {
        double low = BRACKET_LOW;
        double high = BRACKET_HIGH;
        double fLow = equation.residual(low);
        double fHigh = equation.residual(high);
        if (Math.signum(fLow) == Math.signum(fHigh)) {
            throw new RootFindingException("No hay cambio de signo en [" + low + ", " + high + "] K para " + equation);
        }

        double mid = 0.5 * (low + high);
        for (int i = 0; i < MAX_BISECTIONS; i++) {
            mid = 0.5 * (low + high);
            double fMid = equation.residual(mid);
            if (Math.abs(fMid) < TOLERANCE || (high - low) < STEP_TOLERANCE) {
                return mid;
            }
            if (Math.signum(fMid) == Math.signum(fLow)) {
                low = mid;
                fLow = fMid;
            } else {
                high = mid;
            }
        }
        return mid;
    }

    private static double accept(EnergyBalanceEquation equation, double root) {
        if (!Double.isFinite(root) || root <= 0) {
            throw new RootFindingException("Raíz no física (" + root + " K) para " + equation);
        }
        double residual = Math.abs(equation.residual(root));
        if (residual >= RESIDUAL_LIMIT) {
            throw new RootFindingException("Residuo " + residual + " demasiado alto en T=" + root + " K para " + equation);
        }
        if (root < PHYSICAL_LOW || root > PHYSICAL_HIGH) {
            log.debug("Raíz fuera de la banda física habitual: {} K", root);
        }
        return root;
    }
}
