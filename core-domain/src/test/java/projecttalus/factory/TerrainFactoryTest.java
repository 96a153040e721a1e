package projecttalus.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projecttalus.domain.terrain.TerrainPoint;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.domain.terrain.WaterTable;
import projecttalus.exception.ParameterException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TerrainFactoryTest {

    @Test
    @DisplayName("Talud simple: coronación a la izquierda y pie a H/tan(β)")
    void simpleSlope() {
        TerrainProfile terrain = TerrainFactory.simpleSlope(8.0, 45.0, 10.0, 5.0);

        List<TerrainPoint> points = terrain.getPoints();
        assertEquals(4, points.size());
        assertEquals(TerrainPoint.of(0, 8), points.get(0));
        assertEquals(TerrainPoint.of(10, 8), points.get(1));
        assertEquals(18.0, points.get(2).x(), 1e-9);
        assertEquals(0.0, points.get(2).y());
        assertEquals(23.0, points.get(3).x(), 1e-9);
        assertTrue(terrain.descendsTowardPositiveX());
    }

    @Test
    @DisplayName("Parámetros de talud fuera de rango")
    void simpleSlope_shouldValidate() {
        assertThrows(ParameterException.class, () -> TerrainFactory.simpleSlope(0, 35, 10, 10));
        assertThrows(ParameterException.class, () -> TerrainFactory.simpleSlope(8, 90, 10, 10));
        assertThrows(ParameterException.class, () -> TerrainFactory.simpleSlope(8, 35, 0, 10));
    }

    @Test
    @DisplayName("El nivel freático horizontal cubre todo el perfil")
    void horizontalWaterTable() {
        TerrainProfile terrain = TerrainFactory.simpleSlope(8.0, 35.0, 16.0, 16.0);

        WaterTable water = TerrainFactory.horizontalWaterTable(terrain, 3.0);

        assertEquals(terrain.getMinX(), water.surface().getMinX());
        assertEquals(terrain.getMaxX(), water.surface().getMaxX());
        assertEquals(3.0 * 9.81, water.porePressureAt(20.0, 0.0), 1e-9);
    }
}
