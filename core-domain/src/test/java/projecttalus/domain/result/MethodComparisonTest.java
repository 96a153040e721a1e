package projecttalus.domain.result;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MethodComparisonTest {

    @Test
    @DisplayName("Una diferencia típica de Bishop (+6 %) está dentro del margen")
    void withinExpectedMargin() {
        MethodComparison comparison = MethodComparison.of(2.138, 2.269, -0.02, 0.20);

        assertEquals(0.131, comparison.absoluteDifference(), 1e-9);
        assertEquals(6.127, comparison.relativeDifferencePercent(), 1e-2);
        assertTrue(comparison.withinExpectedMargin());
    }

    @Test
    @DisplayName("Una discrepancia grande se señala fuera de margen")
    void outsideExpectedMargin() {
        assertFalse(MethodComparison.of(4.88, 6.78, -0.02, 0.20).withinExpectedMargin());
        assertFalse(MethodComparison.of(2.0, 1.9, -0.02, 0.20).withinExpectedMargin());
    }
}
