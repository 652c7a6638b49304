package groundtemp.domain.surface;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EquivalenceKeyTest {

    @Test
    @DisplayName("Igualdad por contenido de la serie de sombras")
    void equals_shouldCompareSunlitFractionsByContent() {
        EquivalenceKey a = new EquivalenceKey("Asphalt", new double[]{0.0, 0.5, 1.0});
        EquivalenceKey b = new EquivalenceKey("Asphalt", new double[]{0.0, 0.5, 1.0});
        EquivalenceKey otherShade = new EquivalenceKey("Asphalt", new double[]{0.0, 0.5, 0.9});
        EquivalenceKey otherMaterial = new EquivalenceKey("Grass", new double[]{0.0, 0.5, 1.0});

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, otherShade);
        assertNotEquals(a, otherMaterial);

        Map<EquivalenceKey, String> map = new HashMap<>();
        map.put(a, "solved");
        assertEquals("solved", map.get(b));
    }

    @Test
    @DisplayName("Inmutabilidad: Modificar el array de origen no altera la clave")
    void constructor_shouldCopyInput() {
        double[] shade = {1.0, 1.0};
        EquivalenceKey key = new EquivalenceKey("Asphalt", shade);

        shade[0] = 0.0;
        key.sunlitFractions()[1] = 0.0;

        assertArrayEquals(new double[]{1.0, 1.0}, key.sunlitFractions());
        assertEquals("Asphalt-(1.0, 1.0)", key.toString());
    }
}
