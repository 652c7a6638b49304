package groundtemp.domain.simulation;

import groundtemp.domain.surface.EquivalenceKey;

/**
 * Aviso no fatal: el grupo agotó los ciclos sin alcanzar el umbral de equilibrio.
 * La serie del último ciclo se publica igualmente, marcada como no convergida.
 *
 * @param key       Grupo afectado.
 * @param cycles    Ciclos ejecutados.
 * @param lastError Diferencia |T(23) - T0| del último ciclo, en °C.
 */
public record ConvergenceWarning(EquivalenceKey key, int cycles, double lastError) {
}
