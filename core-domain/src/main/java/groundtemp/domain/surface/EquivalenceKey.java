package groundtemp.domain.surface;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Clave de equivalencia: material + secuencia ordenada de 24 fracciones soleadas.
 * <p>
 * Dos puntos con la misma clave reciben exactamente la misma serie resuelta, de modo que
 * el problema sólo se resuelve una vez por clave. La igualdad de las fracciones es bit a bit.
 */
public record EquivalenceKey(String materialName, double[] sunlitFractions) {

    public EquivalenceKey {
        Objects.requireNonNull(materialName, "El nombre del material no puede ser nulo.");
        Objects.requireNonNull(sunlitFractions, "La serie de sombras no puede ser nula.");
        sunlitFractions = sunlitFractions.clone();
    }

    @Override
    public double[] sunlitFractions() {
        return sunlitFractions.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EquivalenceKey that = (EquivalenceKey) o;
        return materialName.equals(that.materialName) && Arrays.equals(sunlitFractions, that.sunlitFractions);
    }

    @Override
    public int hashCode() {
        return 31 * materialName.hashCode() + Arrays.hashCode(sunlitFractions);
    }

    @Override
    public String toString() {
        return materialName + "-" + Arrays.stream(sunlitFractions)
                .mapToObj(Double::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
