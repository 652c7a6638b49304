package groundtemp.physics.impl;

import groundtemp.config.ThermalConfig;
import groundtemp.domain.simulation.SolvedSeries;
import groundtemp.domain.simulation.ThermalProblem;
import groundtemp.domain.surface.SurfaceMaterial;
import groundtemp.domain.weather.DailyWeatherProfile;
import groundtemp.physics.i.ISurfaceTemperatureSolver;
import groundtemp.physics.solver.EnergyBalanceEquation;
import groundtemp.physics.solver.QuarticRootSolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Solver del equilibrio térmico diario de una superficie.
 * <p>
 * Para cada hora resuelve el balance
 * <pre>
 *   -[0.8·Gh·s·(1-alb) + 0.2·Gh·(1-alb)] + em·σ·(T⁴ - Tsky⁴) + hc·(T - Tair)
 *   + (λ/ep)·(T - Tint) + (Cv·ep/3600)·(T - Tprev) + ET0·kc = 0
 * </pre>
 * y repite el día completo, usando la última hora como semilla de la siguiente pasada,
 * hasta que el ciclo se cierra (|T(23) - T0| &lt; umbral) o se agotan los ciclos.
 * <p>
 * Stateless y Thread-Safe: toda la información del ciclo viaja en {@link EquilibriumState}.
 */
@Slf4j
@Getter
public class ThermalEquilibriumSolver implements ISurfaceTemperatureSolver {

    public static final double STEFAN_BOLTZMANN = 5.67e-8;
    public static final double KELVIN_OFFSET = 273.15;

    private static final int HOURS = DailyWeatherProfile.HOURS_PER_DAY;
    private static final double DIRECT_FRACTION = 0.8;
    private static final double DIFFUSE_FRACTION = 0.2;
    private static final double SUNLIT_WARMING_THRESHOLD = 0.4;
    private static final double WARMING_STEP = 1.0;
    private static final double COOLING_STEP = 0.5;

    private final double convectiveCoefficient;
    private final double convergenceThreshold;
    private final int maxCycles;
    private final int minCyclesBeforeCheck;
    private final double initialSeedTemperature;

    public ThermalEquilibriumSolver(ThermalConfig config) {
        this.convectiveCoefficient = config.getConvectiveCoefficient();
        this.convergenceThreshold = config.getConvergenceThreshold();
        this.maxCycles = config.getMaxCycles();
        this.minCyclesBeforeCheck = config.getMinCyclesBeforeCheck();
        this.initialSeedTemperature = config.getInitialSurfaceTemperature() + KELVIN_OFFSET;
    }

    @Override
    public String getName() {
        return "SurfaceEnergyBalance_NewtonCycle";
    }

    @Override
    public String getDescription() {
        return "Balance de energía superficial horario resuelto por Newton-Raphson, iterado por ciclos diarios hasta el equilibrio.";
    }

    @Override
    public SolvedSeries solve(ThermalProblem problem) {
        SurfaceMaterial material = problem.material();
        if (material.hasFixedTemperature()) {
            double[] fixed = new double[HOURS];
            Arrays.fill(fixed, material.fixedTemperature());
            return SolvedSeries.of(problem.key(), fixed, true, 0, 0.0);
        }

        EquilibriumState state = initialState();
        while (!state.isTerminal()) {
            state = advance(problem, (EquilibriumState.Iterating) state);
        }

        if (state instanceof EquilibriumState.Converged converged) {
            log.debug("Equilibrio alcanzado tras {} ciclos para {}", converged.cycle(), problem.key());
            return toSeries(problem, converged.history(), true, converged.cycle(), converged.error());
        }

        EquilibriumState.Unconverged unconverged = (EquilibriumState.Unconverged) state;
        log.warn("Equilibrio no alcanzado tras {} ciclos (error {} °C) para el grupo {} (punto {})",
                unconverged.cycle(), unconverged.error(), problem.key(), problem.representativeId());
        return toSeries(problem, unconverged.history(), false, unconverged.cycle(), unconverged.error());
    }

    public EquilibriumState.Iterating initialState() {
        return new EquilibriumState.Iterating(0, initialSeedTemperature, new double[HOURS]);
    }

    /**
     * Función de transición: ejecuta una pasada de 24 horas y decide el estado siguiente.
     */
    public EquilibriumState advance(ThermalProblem problem, EquilibriumState.Iterating state) {
        double seed = state.seedTemperature();
        double[] history = runCycle(problem, seed);
        int completed = state.cycle() + 1;
        double error = Math.abs(history[HOURS - 1] - seed);

        if (completed >= minCyclesBeforeCheck && error < convergenceThreshold) {
            return new EquilibriumState.Converged(completed, history, error);
        }
        if (completed >= maxCycles) {
            return new EquilibriumState.Unconverged(completed, history, error);
        }
        return new EquilibriumState.Iterating(completed, history[HOURS - 1], history);
    }

    /**
     * Una pasada completa de 24 horas partiendo de la temperatura semilla.
     *
     * @return Temperaturas horarias [K].
     */
    public double[] runCycle(ThermalProblem problem, double seedTemperature) {
        double[] history = new double[HOURS];
        double previous = seedTemperature;
        for (int h = 0; h < HOURS; h++) {
            EnergyBalanceEquation equation = equationFor(problem, h, previous);
            double guess = initialGuess(problem, h, previous);
            history[h] = QuarticRootSolver.solve(equation, guess);
            previous = history[h];
        }
        return history;
    }

    /**
     * Ensambla los coeficientes A, B y C de la hora indicada.
     *
     * @param previousTemperature Temperatura superficial de la hora anterior [K].
     */
    public EnergyBalanceEquation equationFor(ThermalProblem problem, int hour, double previousTemperature) {
        SurfaceMaterial m = problem.material();
        DailyWeatherProfile weather = problem.weather();

        double conductance = m.conductance();
        double storage = m.hourlyStorageCoefficient();
        double radiative = m.emissivity() * STEFAN_BOLTZMANN;

        double gh = weather.getSolarRadiationAt(hour);
        double absorbed = DIRECT_FRACTION * gh * problem.getSunlitFractionAt(hour) * (1.0 - m.albedo())
                + DIFFUSE_FRACTION * gh * (1.0 - m.albedo());
        double tsky = weather.getSkyTemperatureAt(hour);

        double a = -absorbed
                - radiative * tsky * tsky * tsky * tsky
                - convectiveCoefficient * weather.getAirTemperatureAt(hour)
                - conductance * problem.getGroundTemperatureAt(hour)
                - storage * previousTemperature
                + problem.getLatentHeatFluxAt(hour) * m.evapotranspirationCoefficient();
        double b = convectiveCoefficient + conductance + storage;

        return new EnergyBalanceEquation(a, b, radiative);
    }

    private double initialGuess(ThermalProblem problem, int hour, double previous) {
        if (hour == 0) {
            return previous - COOLING_STEP;
        }
        return problem.getSunlitFractionAt(hour) > SUNLIT_WARMING_THRESHOLD
                ? previous + WARMING_STEP
                : previous - COOLING_STEP;
    }

    private SolvedSeries toSeries(ThermalProblem problem, double[] historyKelvin, boolean converged, int cycles, double error) {
        double[] celsius = new double[HOURS];
        for (int h = 0; h < HOURS; h++) {
            celsius[h] = SolvedSeries.round2(historyKelvin[h] - KELVIN_OFFSET);
        }
        return SolvedSeries.of(problem.key(), celsius, converged, cycles, error);
    }
}
