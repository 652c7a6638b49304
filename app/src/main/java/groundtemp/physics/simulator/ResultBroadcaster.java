package groundtemp.physics.simulator;

import groundtemp.domain.simulation.GroundTemperatureResult;
import groundtemp.domain.simulation.PointTemperatureResult;
import groundtemp.domain.simulation.SimplifiedProblem;
import groundtemp.domain.simulation.SolvedSeries;
import groundtemp.domain.surface.PointSample;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Reparte cada serie resuelta a todos los puntos originales de su grupo,
 * conservando identificadores y coordenadas para la exportación.
 * Los puntos de grupos fallidos o cancelados no aparecen en la salida.
 */
@Slf4j
public class ResultBroadcaster {

    public GroundTemperatureResult broadcast(SimplifiedProblem problem, BatchOutcome outcome, long computationTimeMs) {
        List<PointTemperatureResult> points = new ArrayList<>(problem.acceptedPoints().size());
        int withoutSeries = 0;

        for (PointSample point : problem.acceptedPoints()) {
            SolvedSeries series = outcome.solved().get(point.equivalenceKey());
            if (series == null) {
                withoutSeries++;
                continue;
            }
            points.add(new PointTemperatureResult(
                    point.id(),
                    point.x(),
                    point.y(),
                    series.temperatures(),
                    series.min(),
                    series.mean(),
                    series.max(),
                    series.converged()));
        }

        if (withoutSeries > 0) {
            log.warn("{} puntos sin serie resuelta (grupo fallido o cancelado).", withoutSeries);
        }

        return GroundTemperatureResult.builder()
                .points(points)
                .warnings(outcome.warnings())
                .failures(outcome.failures())
                .rejections(problem.rejections())
                .skipped(outcome.skipped())
                .groupCount(problem.groups().size())
                .computationTimeMs(computationTimeMs)
                .build();
    }
}
