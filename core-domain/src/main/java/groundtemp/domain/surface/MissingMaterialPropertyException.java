package groundtemp.domain.surface;

import lombok.Getter;

/**
 * Un material carece de un campo numérico obligatorio o su valor no es un número.
 * El punto afectado se excluye del cálculo sin abortar el lote.
 */
@Getter
public class MissingMaterialPropertyException extends IllegalArgumentException {

    private final String materialName;
    private final String property;

    public MissingMaterialPropertyException(String materialName, String property) {
        this(materialName, property, "valor ausente o no numérico");
    }

    public MissingMaterialPropertyException(String materialName, String property, String detail) {
        super("Material '" + materialName + "': propiedad '" + property + "' inválida (" + detail + ")");
        this.materialName = materialName;
        this.property = property;
    }
}
