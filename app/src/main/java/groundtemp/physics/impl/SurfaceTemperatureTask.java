package groundtemp.physics.impl;

import groundtemp.domain.simulation.EquivalenceGroup;
import groundtemp.domain.simulation.SolvedSeries;
import groundtemp.domain.simulation.ThermalProblem;
import groundtemp.domain.surface.EquivalenceKey;
import groundtemp.domain.surface.PointSample;
import groundtemp.domain.surface.SurfaceMaterial;
import groundtemp.domain.weather.DailyWeatherProfile;
import groundtemp.physics.i.ISurfaceTemperatureSolver;
import groundtemp.physics.model.EvapotranspirationModel;
import groundtemp.physics.model.GroundDepthTemperatureModel;
import groundtemp.physics.solver.RootFindingException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tarea ejecutable que resuelve un grupo de equivalencia completo.
 * Está diseñada para ser ejecutada en un pool de hilos: sólo lee datos inmutables, escribe en sus
 * propios campos de resultado y publica la serie en el acumulador concurrente compartido.
 * <p>
 * La cancelación se comprueba una sola vez, antes de empezar a resolver.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class SurfaceTemperatureTask implements Callable<SurfaceTemperatureTask> {

    // --- Entradas para la tarea ---
    private final EquivalenceGroup group;
    private final DailyWeatherProfile weather;
    private final int dayOfYear;
    private final GroundDepthTemperatureModel groundModel;
    private final EvapotranspirationModel evapotranspirationModel;
    private final ISurfaceTemperatureSolver solver;
    private final AtomicBoolean cancelled;
    private final Map<EquivalenceKey, SolvedSeries> accumulator;

    // --- Resultados de la tarea ---
    private SolvedSeries solvedSeries;
    private String failureReason;
    private boolean skipped;

    @Override
    public SurfaceTemperatureTask call() {
        if (cancelled.get()) {
            this.skipped = true;
            return this;
        }

        try {
            this.solvedSeries = solver.solve(buildProblem());
            accumulator.put(group.key(), solvedSeries);
        } catch (RootFindingException | ArithmeticException | IllegalArgumentException e) {
            this.failureReason = e.getMessage();
            log.error("Fallo numérico en el grupo {} (punto {}): {}", group.key(), group.representative().id(), e.getMessage());
        }
        return this;
    }

    public boolean isSolved() {
        return solvedSeries != null;
    }

    /**
     * Calcula los forzamientos propios del grupo: terreno en profundidad y evapotranspiración.
     */
    ThermalProblem buildProblem() {
        PointSample representative = group.representative();
        SurfaceMaterial material = representative.material();

        if (material.hasFixedTemperature()) {
            return ThermalProblem.fixed(group.key(), representative.id(), material, weather);
        }

        return ThermalProblem.builder()
                .key(group.key())
                .representativeId(representative.id())
                .material(material)
                .sunlitFraction(representative.sunlitFraction())
                .weather(weather)
                .groundTemperature(groundModel.boundaryTemperature(material, weather, dayOfYear))
                .latentHeatFlux(evapotranspirationModel.hourlyLatentHeatFlux(weather, representative.latitude(), material.albedo()))
                .build();
    }
}
