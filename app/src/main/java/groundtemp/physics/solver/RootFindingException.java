package groundtemp.physics.solver;

/**
 * No se ha podido encontrar una raíz física de la ecuación de balance.
 * Se trata como un fallo local del grupo, nunca del lote completo.
 */
public class RootFindingException extends RuntimeException {

    public RootFindingException(String message) {
        super(message);
    }
}
