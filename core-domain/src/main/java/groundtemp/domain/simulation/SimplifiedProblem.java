package groundtemp.domain.simulation;

import groundtemp.domain.surface.PointSample;

import java.util.List;

/**
 * Resultado de agrupar los puntos por clave de equivalencia.
 *
 * @param acceptedPoints Puntos válidos, con las sombras ya normalizadas, en el orden de entrada.
 * @param groups         Grupos distintos, en orden de primera aparición.
 * @param rejections     Puntos descartados por material inválido.
 */
public record SimplifiedProblem(
        List<PointSample> acceptedPoints,
        List<EquivalenceGroup> groups,
        List<RejectedPoint> rejections
) {

    public SimplifiedProblem {
        acceptedPoints = List.copyOf(acceptedPoints);
        groups = List.copyOf(groups);
        rejections = List.copyOf(rejections);
    }

    /**
     * Longitud media de los puntos aceptados (grados Este); 0 si no hay puntos.
     */
    public double meanLongitude() {
        return acceptedPoints.stream()
                .mapToDouble(PointSample::longitude)
                .average()
                .orElse(0.0);
    }
}
