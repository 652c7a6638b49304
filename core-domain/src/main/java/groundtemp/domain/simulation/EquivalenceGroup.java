package groundtemp.domain.simulation;

import groundtemp.domain.surface.EquivalenceKey;
import groundtemp.domain.surface.PointSample;

import java.util.List;

/**
 * Conjunto de puntos que comparten clave de equivalencia.
 *
 * @param key            Clave común.
 * @param representative Primer punto del grupo; aporta material, latitud y sombras al solver.
 * @param members        Todos los puntos del grupo, en el orden de entrada.
 */
public record EquivalenceGroup(EquivalenceKey key, PointSample representative, List<PointSample> members) {

    public EquivalenceGroup {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
