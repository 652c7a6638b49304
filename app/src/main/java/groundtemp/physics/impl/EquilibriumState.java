package groundtemp.physics.impl;

/**
 * Estados de la máquina de estados del ciclo diario de un grupo.
 * <p>
 * {@link Iterating} es el único estado no terminal; {@link ThermalEquilibriumSolver#advance}
 * es la función de transición. Los historiales se guardan en Kelvin sin redondear.
 */
public interface EquilibriumState {

    /**
     * Ciclos de 24 horas completados al llegar a este estado.
     */
    int cycle();

    boolean isTerminal();

    /**
     * Ciclo en curso.
     *
     * @param cycle           Ciclos completados.
     * @param seedTemperature Temperatura de la hora 24 del ciclo anterior [K].
     * @param history         Soluciones horarias del último ciclo [K].
     */
    record Iterating(int cycle, double seedTemperature, double[] history) implements EquilibriumState {
        public Iterating {
            history = history.clone();
        }

        @Override
        public double[] history() {
            return history.clone();
        }

        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    /**
     * Equilibrio alcanzado: la última hora difiere de la semilla menos que el umbral.
     */
    record Converged(int cycle, double[] history, double error) implements EquilibriumState {
        public Converged {
            history = history.clone();
        }

        @Override
        public double[] history() {
            return history.clone();
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * Tope de ciclos alcanzado sin equilibrio. La serie del último ciclo sigue siendo utilizable.
     */
    record Unconverged(int cycle, double[] history, double error) implements EquilibriumState {
        public Unconverged {
            history = history.clone();
        }

        @Override
        public double[] history() {
            return history.clone();
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
