package groundtemp.physics.i;

import groundtemp.domain.simulation.SolvedSeries;
import groundtemp.domain.simulation.ThermalProblem;

/**
 * Resuelve la temperatura superficial diaria de un grupo de equivalencia.
 * <p>
 * Las implementaciones deben ser puras: el mismo problema produce siempre la misma serie,
 * y pueden invocarse concurrentemente desde varios hilos.
 */
public interface ISurfaceTemperatureSolver {

    /**
     * Nombre corto del método, usado en las trazas del procesador por lotes.
     */
    String getName();

    default String getDescription() {
        return "Sin descripción disponible.";
    }

    SolvedSeries solve(ThermalProblem problem);
}
