package groundtemp.physics.simulator;

import groundtemp.TestFixtures;
import groundtemp.domain.simulation.GroundTemperatureResult;
import groundtemp.domain.simulation.GroupFailure;
import groundtemp.domain.simulation.PointTemperatureResult;
import groundtemp.domain.simulation.SimplifiedProblem;
import groundtemp.domain.simulation.SolvedSeries;
import groundtemp.domain.surface.EquivalenceKey;
import groundtemp.domain.surface.NightShadingConvention;
import groundtemp.domain.surface.PointSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultBroadcasterTest {

    private ResultBroadcaster broadcaster;
    private SimplifiedProblem problem;

    @BeforeEach
    void setUp() {
        broadcaster = new ResultBroadcaster();
        List<PointSample> points = List.of(
                TestFixtures.point("A", TestFixtures.soil(), TestFixtures.constantShade(1.0)),
                TestFixtures.point("B", TestFixtures.soil(), TestFixtures.constantShade(0.0)),
                TestFixtures.point("C", TestFixtures.soil(), TestFixtures.constantShade(1.0)),
                TestFixtures.point("BAD", TestFixtures.soil().withName("Broken").withEmissivity(Double.NaN),
                        TestFixtures.constantShade(1.0)));
        problem = new ProblemSimplifier(NightShadingConvention.FIXED_VALUE, 0.0).simplify(points);
    }

    private static SolvedSeries series(EquivalenceKey key, double base) {
        double[] temps = new double[24];
        for (int h = 0; h < 24; h++) {
            temps[h] = base + h * 0.25;
        }
        return SolvedSeries.of(key, temps, true, 2, 0.05);
    }

    @Test
    @DisplayName("Reparto: Puntos con la misma clave reciben series idénticas bit a bit")
    void broadcast_shouldGiveIdenticalSeriesToEquivalentPoints() {
        // ARRANGE
        Map<EquivalenceKey, SolvedSeries> solved = new HashMap<>();
        problem.groups().forEach(g -> solved.put(g.key(), series(g.key(), g.representative().id().equals("A") ? 30.0 : 20.0)));
        BatchOutcome outcome = new BatchOutcome(solved, List.of(), List.of());

        // ACT
        GroundTemperatureResult result = broadcaster.broadcast(problem, outcome, 42L);

        // ASSERT
        assertEquals(List.of("A", "B", "C"), result.points().stream().map(PointTemperatureResult::id).toList(),
                "El orden de salida es el de entrada");
        PointTemperatureResult a = result.points().get(0);
        PointTemperatureResult c = result.points().get(2);
        assertArrayEquals(a.temperatures(), c.temperatures());
        assertEquals(a.mean(), c.mean());
        assertNotEquals(a.mean(), result.points().get(1).mean());

        assertEquals(2, result.groupCount());
        assertEquals(1, result.rejections().size());
        assertEquals(42L, result.computationTimeMs());
        assertFalse(result.isComplete(), "Hay un punto rechazado");
    }

    @Test
    @DisplayName("Fallo de grupo: Sus puntos no aparecen en la salida")
    void broadcast_whenGroupFailed_shouldOmitItsPoints() {
        EquivalenceKey sunlitKey = problem.groups().get(0).key();
        EquivalenceKey shadedKey = problem.groups().get(1).key();
        BatchOutcome outcome = new BatchOutcome(
                Map.of(shadedKey, series(shadedKey, 18.0)),
                List.of(new GroupFailure(sunlitKey, "A", "Sin raíz positiva")),
                List.of());

        GroundTemperatureResult result = broadcaster.broadcast(problem, outcome, 0L);

        assertEquals(1, result.points().size());
        assertEquals("B", result.points().get(0).id());
        assertEquals(1, result.failures().size());
        assertEquals(18.0, result.points().get(0).min());
    }
}
