package groundtemp.physics.simulator;

import groundtemp.config.ThermalConfig;
import groundtemp.domain.simulation.GroundTemperatureResult;
import groundtemp.domain.simulation.SimplifiedProblem;
import groundtemp.domain.surface.PointSample;
import groundtemp.domain.weather.DailyWeatherProfile;
import groundtemp.domain.weather.WeatherRecord;
import groundtemp.physics.i.ISurfaceTemperatureSolver;
import groundtemp.physics.impl.ThermalEquilibriumSolver;
import groundtemp.physics.model.CalendarDay;
import groundtemp.physics.model.EvapotranspirationModel;
import groundtemp.physics.model.GroundDepthTemperatureModel;
import groundtemp.physics.model.WeatherProfileExtractor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orquesta el cálculo completo de temperaturas superficiales de un día.
 * Facade de alto nivel que prepara los forzamientos comunes y delega la resolución
 * intensiva al {@link GroundTemperatureBatchProcessor}.
 * <p>
 * Flujo: perfil meteorológico → modelos de terreno y evapotranspiración → simplificación →
 * resolución por grupos → reparto a los puntos.
 */
@Slf4j
public class GroundTemperatureSimulator implements AutoCloseable {

    @Getter
    private final ThermalConfig config;
    private final int dayOfYear;

    private final WeatherProfileExtractor weatherExtractor;
    private final GroundDepthTemperatureModel groundModel;
    private final ProblemSimplifier simplifier;
    private final GroundTemperatureBatchProcessor batchProcessor;
    private final ResultBroadcaster broadcaster;

    public GroundTemperatureSimulator(ThermalConfig config) {
        this(config, new ThermalEquilibriumSolver(config.validate()));
    }

    public GroundTemperatureSimulator(ThermalConfig config, ISurfaceTemperatureSolver solver) {
        this.config = config.validate();
        this.dayOfYear = CalendarDay.dayOfYear(config.getMonth(), config.getDay());

        this.weatherExtractor = new WeatherProfileExtractor();
        this.groundModel = new GroundDepthTemperatureModel(config.getBurialDepth());
        this.simplifier = new ProblemSimplifier(config.getNightShadingConvention(), config.getNightSunlitFraction());
        this.batchProcessor = new GroundTemperatureBatchProcessor(config, solver);
        this.broadcaster = new ResultBroadcaster();

        log.info("GroundTemperatureSimulator listo. (Día {}/{}, ordinal {}, huso {})",
                config.getDay(), config.getMonth(), dayOfYear, config.getTimeZone());
    }

    /**
     * Ejecuta el cálculo a partir del registro meteorológico anual.
     *
     * @throws groundtemp.domain.weather.WeatherDataFormatException si el día pedido no está completo.
     */
    public GroundTemperatureResult run(List<WeatherRecord> yearlyRecords, List<PointSample> points) {
        DailyWeatherProfile weather = weatherExtractor.extract(yearlyRecords, config.getMonth(), config.getDay());
        return run(weather, points);
    }

    /**
     * Ejecuta el cálculo con un perfil diario ya extraído.
     */
    public GroundTemperatureResult run(DailyWeatherProfile weather, List<PointSample> points) {
        long startTime = System.currentTimeMillis();
        AtomicBoolean cancelled = batchProcessor.startRun();

        SimplifiedProblem problem = simplifier.simplify(points);
        EvapotranspirationModel etModel = createEvapotranspirationModel(problem.meanLongitude());

        BatchOutcome outcome = batchProcessor.process(problem.groups(), weather, dayOfYear, groundModel, etModel, cancelled);

        GroundTemperatureResult result = broadcaster.broadcast(problem, outcome, System.currentTimeMillis() - startTime);
        log.info("Cálculo finalizado: {} puntos, {} grupos, {} avisos de convergencia. Tiempo de cómputo: {}ms",
                result.points().size(), result.groupCount(), result.warnings().size(), result.computationTimeMs());
        return result;
    }

    /**
     * Cancela los grupos que aún no han empezado a resolverse. Vale también durante la
     * simplificación, antes de lanzar el lote.
     */
    public void cancel() {
        batchProcessor.cancel();
    }

    EvapotranspirationModel createEvapotranspirationModel(double meanLongitude) {
        double meridian = config.getTimeZone().meridianFor(meanLongitude);
        double longitudeOffset = meanLongitude - meridian;
        return new EvapotranspirationModel(config.getAltitude(), dayOfYear, longitudeOffset);
    }

    @Override
    public void close() {
        if (batchProcessor != null) {
            batchProcessor.close();
        }
        log.info("GroundTemperatureSimulator cerrado y recursos liberados.");
    }
}
