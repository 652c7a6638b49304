package groundtemp.physics.simulator;

import groundtemp.config.ThermalConfig;
import groundtemp.domain.simulation.EquivalenceGroup;
import groundtemp.domain.simulation.GroupFailure;
import groundtemp.domain.simulation.SolvedSeries;
import groundtemp.domain.surface.EquivalenceKey;
import groundtemp.domain.weather.DailyWeatherProfile;
import groundtemp.physics.i.ISurfaceTemperatureSolver;
import groundtemp.physics.impl.SurfaceTemperatureTask;
import groundtemp.physics.model.EvapotranspirationModel;
import groundtemp.physics.model.GroundDepthTemperatureModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orquestador de la resolución por grupos.
 * <p>
 * Responsabilidades:
 * 1. Lanzar una {@link SurfaceTemperatureTask} por grupo de equivalencia en un pool fijo de hilos.
 * 2. Acumular las series resueltas en un mapa concurrente indexado por clave.
 * 3. Aislar los fallos numéricos de cada grupo y respetar la cancelación entre grupos.
 */
@Slf4j
public class GroundTemperatureBatchProcessor implements AutoCloseable {

    private final ISurfaceTemperatureSolver solver;
    private final ExecutorService threadPool;
    private volatile AtomicBoolean currentRunCancelled = new AtomicBoolean(false);

    public GroundTemperatureBatchProcessor(ThermalConfig config, ISurfaceTemperatureSolver solver) {
        this.solver = solver;
        int processorCount = config.getCpuProcessorCount();
        this.threadPool = Executors.newFixedThreadPool(Math.max(processorCount, 1));
        log.info("GroundTemperatureBatchProcessor inicializado. (Solver: {}, Hilos: {})", solver.getName(), Math.max(processorCount, 1));
    }

    /**
     * Abre una ejecución nueva con su propia marca de cancelación, que pasa a ser la que afecta
     * {@link #cancel()}. Una cancelación anterior no se arrastra.
     */
    public AtomicBoolean startRun() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        this.currentRunCancelled = cancelled;
        return cancelled;
    }

    /**
     * Resuelve todos los grupos en una ejecución nueva.
     *
     * @see #process(List, DailyWeatherProfile, int, GroundDepthTemperatureModel, EvapotranspirationModel, AtomicBoolean)
     */
    public BatchOutcome process(List<EquivalenceGroup> groups,
                                DailyWeatherProfile weather,
                                int dayOfYear,
                                GroundDepthTemperatureModel groundModel,
                                EvapotranspirationModel etModel) {
        return process(groups, weather, dayOfYear, groundModel, etModel, startRun());
    }

    /**
     * Resuelve todos los grupos. Bloquea hasta que terminan todas las tareas.
     *
     * @param groups      Grupos de equivalencia a resolver.
     * @param weather     Perfil meteorológico del día.
     * @param dayOfYear   Ordinal del día objetivo.
     * @param groundModel Modelo de temperatura del terreno.
     * @param etModel     Modelo de evapotranspiración del día.
     * @param cancelled   Marca de la ejecución, obtenida de {@link #startRun()}.
     * @return Series resueltas, fallos y grupos cancelados.
     */
    public BatchOutcome process(List<EquivalenceGroup> groups,
                                DailyWeatherProfile weather,
                                int dayOfYear,
                                GroundDepthTemperatureModel groundModel,
                                EvapotranspirationModel etModel,
                                AtomicBoolean cancelled) {
        Map<EquivalenceKey, SolvedSeries> solved = new ConcurrentHashMap<>();
        List<SurfaceTemperatureTask> tasks = new ArrayList<>(groups.size());
        for (EquivalenceGroup group : groups) {
            tasks.add(new SurfaceTemperatureTask(group, weather, dayOfYear, groundModel, etModel, solver, cancelled, solved));
        }

        List<Future<SurfaceTemperatureTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Cálculo de temperaturas interrumpido.", e);
        }

        List<GroupFailure> failures = new ArrayList<>();
        List<EquivalenceKey> skipped = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            SurfaceTemperatureTask task = awaitTask(futures.get(i), groups.get(i));
            EquivalenceGroup group = groups.get(i);
            if (task.isSkipped()) {
                skipped.add(group.key());
            } else if (!task.isSolved()) {
                failures.add(new GroupFailure(group.key(), group.representative().id(), task.getFailureReason()));
            }
        }

        log.info("Lote terminado: {} grupos resueltos, {} fallidos, {} cancelados.", solved.size(), failures.size(), skipped.size());
        return new BatchOutcome(solved, failures, skipped);
    }

    /**
     * Cancela el lote en curso. Los grupos ya iniciados terminan; los pendientes se omiten.
     */
    public void cancel() {
        log.info("Cancelación solicitada.");
        currentRunCancelled.set(true);
    }

    private SurfaceTemperatureTask awaitTask(Future<SurfaceTemperatureTask> future, EquivalenceGroup group) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Cálculo de temperaturas interrumpido.", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Error inesperado resolviendo el grupo " + group.key(), e.getCause());
        }
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("GroundTemperatureBatchProcessor cerrado.");
    }
}
