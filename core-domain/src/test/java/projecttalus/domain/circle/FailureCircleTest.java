package projecttalus.domain.circle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projecttalus.exception.ParameterException;

import static org.junit.jupiter.api.Assertions.*;

class FailureCircleTest {

    @Test
    @DisplayName("El arco inferior es yc - √(r² - (x - xc)²)")
    void lowerArcAt() {
        FailureCircle circle = FailureCircle.of(10, 20, 5);

        assertEquals(15.0, circle.lowerArcAt(10).getAsDouble(), 1e-12);
        assertEquals(16.0, circle.lowerArcAt(13).getAsDouble(), 1e-12);
        assertEquals(20.0, circle.lowerArcAt(15).getAsDouble(), 1e-12);
        assertTrue(circle.lowerArcAt(15.01).isEmpty());
    }

    @Test
    @DisplayName("Los círculos son valores: with* crea un reemplazo")
    void withers_shouldCreateNewInstances() {
        FailureCircle circle = FailureCircle.of(10, 20, 5);

        FailureCircle moved = circle.withCenterX(12).withRadius(6);

        assertEquals(FailureCircle.of(10, 20, 5), circle);
        assertEquals(FailureCircle.of(12, 20, 6), moved);
    }

    @Test
    @DisplayName("El radio debe ser positivo y el centro finito")
    void constructor_shouldValidate() {
        assertThrows(ParameterException.class, () -> FailureCircle.of(0, 0, 0));
        assertThrows(ParameterException.class, () -> FailureCircle.of(0, 0, -2));
        assertThrows(ParameterException.class, () -> FailureCircle.of(Double.NaN, 0, 2));
        assertThrows(ParameterException.class, () -> FailureCircle.of(0, 0, Double.POSITIVE_INFINITY));
    }
}
