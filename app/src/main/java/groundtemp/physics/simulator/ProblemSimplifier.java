package groundtemp.physics.simulator;

import groundtemp.domain.simulation.EquivalenceGroup;
import groundtemp.domain.simulation.RejectedPoint;
import groundtemp.domain.simulation.SimplifiedProblem;
import groundtemp.domain.surface.EquivalenceKey;
import groundtemp.domain.surface.MissingMaterialPropertyException;
import groundtemp.domain.surface.NightShadingConvention;
import groundtemp.domain.surface.PointSample;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simplificación del problema: agrupa los puntos que comparten material y secuencia de sombras
 * para resolver cada combinación una única vez.
 * <p>
 * Antes de agrupar, rellena las horas sin fracción soleada según la convención nocturna
 * configurada y descarta los puntos cuyo material no es válido.
 */
@Slf4j
public class ProblemSimplifier {

    private final NightShadingConvention nightShadingConvention;
    private final double nightSunlitFraction;

    public ProblemSimplifier(NightShadingConvention nightShadingConvention, double nightSunlitFraction) {
        this.nightShadingConvention = nightShadingConvention;
        this.nightSunlitFraction = nightSunlitFraction;
    }

    public SimplifiedProblem simplify(List<PointSample> points) {
        List<PointSample> accepted = new ArrayList<>(points.size());
        List<RejectedPoint> rejections = new ArrayList<>();
        Map<EquivalenceKey, List<PointSample>> members = new LinkedHashMap<>();

        for (PointSample point : points) {
            try {
                point.material().validate();
            } catch (MissingMaterialPropertyException e) {
                log.warn("Punto {} excluido: {}", point.id(), e.getMessage());
                rejections.add(new RejectedPoint(point.id(), point.material().name(), e.getMessage()));
                continue;
            }

            PointSample normalized = normalizeShading(point);
            accepted.add(normalized);
            members.computeIfAbsent(normalized.equivalenceKey(), k -> new ArrayList<>()).add(normalized);
        }

        List<EquivalenceGroup> groups = new ArrayList<>(members.size());
        for (Map.Entry<EquivalenceKey, List<PointSample>> entry : members.entrySet()) {
            List<PointSample> groupMembers = entry.getValue();
            groups.add(new EquivalenceGroup(entry.getKey(), groupMembers.get(0), groupMembers));
        }

        log.info("Problema simplificado: {} puntos -> {} grupos ({} rechazados).",
                points.size(), groups.size(), rejections.size());
        return new SimplifiedProblem(accepted, groups, rejections);
    }

    private PointSample normalizeShading(PointSample point) {
        double[] raw = point.sunlitFraction();
        double[] filled = nightShadingConvention.fill(raw, nightSunlitFraction);
        if (Arrays.equals(raw, filled)) {
            return point;
        }
        return new PointSample(point.id(), point.x(), point.y(), point.longitude(), point.latitude(),
                point.material(), filled);
    }
}
