package groundtemp.domain.simulation;

import groundtemp.domain.surface.EquivalenceKey;
import lombok.Builder;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Resultado completo de un cálculo: una entrada por punto resuelto más los informes de
 * avisos, fallos, rechazos y grupos cancelados.
 */
@Builder
public record GroundTemperatureResult(
        List<PointTemperatureResult> points,
        List<ConvergenceWarning> warnings,
        List<GroupFailure> failures,
        List<RejectedPoint> rejections,
        List<EquivalenceKey> skipped,
        int groupCount,
        long computationTimeMs
) {

    public GroundTemperatureResult {
        points = List.copyOf(points);
        warnings = List.copyOf(warnings);
        failures = List.copyOf(failures);
        rejections = List.copyOf(rejections);
        skipped = List.copyOf(skipped);
    }

    public boolean isComplete() {
        return failures.isEmpty() && rejections.isEmpty() && skipped.isEmpty();
    }

    public OptionalDouble meanSurfaceTemperature() {
        return points.stream().mapToDouble(PointTemperatureResult::mean).average();
    }
}
