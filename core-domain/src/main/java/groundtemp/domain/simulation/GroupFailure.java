package groundtemp.domain.simulation;

import groundtemp.domain.surface.EquivalenceKey;

/**
 * Fallo numérico local a un grupo; sus puntos quedan fuera del resultado.
 */
public record GroupFailure(EquivalenceKey key, String representativeId, String reason) {
}
