package projecttalus.domain.terrain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projecttalus.exception.ParameterException;

import static org.junit.jupiter.api.Assertions.*;

class WaterTableTest {

    private final WaterTable waterTable = new WaterTable(TerrainProfile.of(0, 6, 40, 0));

    @Test
    @DisplayName("La presión de poros es la columna de agua sobre la base por γw")
    void porePressureAt_belowWaterTable() {
        // En x = 20 el nivel está a 3 m; base a 1 m -> 2 m de columna
        assertEquals(2.0 * 9.81, waterTable.porePressureAt(20.0, 1.0), 1e-9);
    }

    @Test
    @DisplayName("Sobre el nivel freático la presión de poros es nula")
    void porePressureAt_aboveWaterTable() {
        assertEquals(0.0, waterTable.porePressureAt(20.0, 5.0));
    }

    @Test
    @DisplayName("Fuera del rango del nivel freático el suelo se considera seco")
    void porePressureAt_outsideRange() {
        assertEquals(0.0, waterTable.porePressureAt(45.0, -10.0));
        assertEquals(0.0, waterTable.porePressureAt(-1.0, -10.0));
    }

    @Test
    @DisplayName("Peso específico del agua configurable y validado")
    void waterUnitWeight() {
        WaterTable seaWater = new WaterTable(TerrainProfile.of(0, 6, 40, 6), 10.05);
        assertEquals(10.05, seaWater.porePressureAt(10, 5), 1e-9);
        assertEquals(WaterTable.DEFAULT_WATER_UNIT_WEIGHT, waterTable.waterUnitWeight());
        assertThrows(ParameterException.class, () -> new WaterTable(TerrainProfile.of(0, 1, 1, 1), 0.0));
    }
}
