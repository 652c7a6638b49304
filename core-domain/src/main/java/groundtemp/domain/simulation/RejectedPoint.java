package groundtemp.domain.simulation;

/**
 * Punto excluido antes de resolver porque su material es inválido.
 */
public record RejectedPoint(String pointId, String materialName, String reason) {
}
