package groundtemp.physics.simulator;

import groundtemp.TestFixtures;
import groundtemp.domain.simulation.EquivalenceGroup;
import groundtemp.domain.simulation.SimplifiedProblem;
import groundtemp.domain.surface.NightShadingConvention;
import groundtemp.domain.surface.PointSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProblemSimplifierTest {

    private final ProblemSimplifier simplifier = new ProblemSimplifier(NightShadingConvention.FIXED_VALUE, 0.0);

    @Test
    @DisplayName("Agrupación: Misma clave -> un solo grupo, en orden de primera aparición")
    void simplify_shouldGroupPointsByEquivalenceKey() {
        // ARRANGE
        List<PointSample> points = List.of(
                TestFixtures.point("A", TestFixtures.soil(), TestFixtures.constantShade(1.0)),
                TestFixtures.point("B", TestFixtures.soil(), TestFixtures.constantShade(0.0)),
                TestFixtures.point("C", TestFixtures.soil(), TestFixtures.constantShade(1.0)),
                TestFixtures.point("D", TestFixtures.water(), TestFixtures.constantShade(1.0)));

        // ACT
        SimplifiedProblem problem = simplifier.simplify(points);

        // ASSERT
        assertEquals(4, problem.acceptedPoints().size());
        assertEquals(3, problem.groups().size());

        EquivalenceGroup first = problem.groups().get(0);
        assertEquals("A", first.representative().id(), "El representante es el primer punto del grupo");
        assertEquals(List.of("A", "C"), first.members().stream().map(PointSample::id).toList());
        assertEquals("B", problem.groups().get(1).representative().id());
        assertEquals("D", problem.groups().get(2).representative().id());
        assertTrue(problem.rejections().isEmpty());
    }

    @Test
    @DisplayName("Material inválido: El punto se rechaza y el resto continúa")
    void simplify_whenMaterialIsIncomplete_shouldRejectPoint() {
        List<PointSample> points = List.of(
                TestFixtures.point("OK", TestFixtures.soil(), TestFixtures.constantShade(1.0)),
                TestFixtures.point("BAD", TestFixtures.soil().withName("Broken").withThermalConductivity(Double.NaN),
                        TestFixtures.constantShade(1.0)));

        SimplifiedProblem problem = simplifier.simplify(points);

        assertEquals(1, problem.acceptedPoints().size());
        assertEquals(1, problem.groups().size());
        assertEquals(1, problem.rejections().size());
        assertEquals("BAD", problem.rejections().get(0).pointId());
        assertEquals("Broken", problem.rejections().get(0).materialName());
        assertTrue(problem.rejections().get(0).reason().contains("lambd"));
    }

    @Test
    @DisplayName("Horas nocturnas: Los huecos se rellenan antes de construir la clave")
    void simplify_shouldFillMissingSunlitFractionsBeforeGrouping() {
        double[] withGaps = TestFixtures.constantShade(1.0);
        withGaps[0] = Double.NaN;
        withGaps[23] = Double.NaN;
        double[] explicit = TestFixtures.constantShade(1.0);
        explicit[0] = 0.0;
        explicit[23] = 0.0;

        SimplifiedProblem problem = simplifier.simplify(List.of(
                TestFixtures.point("GAPS", TestFixtures.soil(), withGaps),
                TestFixtures.point("EXPLICIT", TestFixtures.soil(), explicit)));

        assertEquals(1, problem.groups().size(), "Ambos puntos deben compartir clave tras el relleno");
        assertEquals(0.0, problem.acceptedPoints().get(0).getSunlitFractionAt(0));
    }

    @Test
    @DisplayName("Horas nocturnas: LAST_OBSERVED repite la última fracción conocida")
    void simplify_withLastObservedConvention_shouldCarryValues() {
        ProblemSimplifier carrying = new ProblemSimplifier(NightShadingConvention.LAST_OBSERVED, 0.0);
        double[] withGaps = TestFixtures.constantShade(0.5);
        withGaps[23] = Double.NaN;

        SimplifiedProblem problem = carrying.simplify(List.of(TestFixtures.point("P", TestFixtures.soil(), withGaps)));

        assertEquals(0.5, problem.groups().get(0).key().sunlitFractions()[23]);
    }

    @Test
    @DisplayName("Entrada vacía: Sin grupos ni rechazos")
    void simplify_withNoPoints_shouldReturnEmptyProblem() {
        SimplifiedProblem problem = simplifier.simplify(List.of());

        assertTrue(problem.groups().isEmpty());
        assertEquals(0.0, problem.meanLongitude());
    }
}
