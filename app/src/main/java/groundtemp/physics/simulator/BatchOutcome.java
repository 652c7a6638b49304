package groundtemp.physics.simulator;

import groundtemp.domain.simulation.ConvergenceWarning;
import groundtemp.domain.simulation.GroupFailure;
import groundtemp.domain.simulation.SolvedSeries;
import groundtemp.domain.surface.EquivalenceKey;

import java.util.List;
import java.util.Map;

/**
 * Resultado agregado de resolver todos los grupos de un lote.
 *
 * @param solved   Series resueltas por clave.
 * @param failures Grupos con fallo numérico.
 * @param skipped  Grupos no iniciados por cancelación.
 */
public record BatchOutcome(
        Map<EquivalenceKey, SolvedSeries> solved,
        List<GroupFailure> failures,
        List<EquivalenceKey> skipped
) {

    public BatchOutcome {
        solved = Map.copyOf(solved);
        failures = List.copyOf(failures);
        skipped = List.copyOf(skipped);
    }

    public List<ConvergenceWarning> warnings() {
        return solved.values().stream()
                .filter(series -> !series.converged())
                .map(series -> new ConvergenceWarning(series.key(), series.cycles(), series.equilibriumError()))
                .toList();
    }
}
