package projecttalus.domain.circle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projecttalus.exception.ParameterException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SearchBoundsTest {

    private final SearchBounds bounds = new SearchBounds(10, 30, 12, 20, 6, 24);

    @Test
    @DisplayName("Un círculo dentro de los límites no tiene violaciones")
    void contains() {
        assertThat(bounds.contains(FailureCircle.of(20, 15, 10))).isTrue();
        assertThat(bounds.violationsOf(FailureCircle.of(10, 20, 24))).isEmpty();
    }

    @Test
    @DisplayName("Cada límite incumplido se informa por separado")
    void violationsOf_shouldListEveryBound() {
        List<BoundViolation> violations = bounds.violationsOf(FailureCircle.of(5, 25, 3));

        assertThat(violations).containsExactly(
                BoundViolation.CENTER_X_MIN, BoundViolation.CENTER_Y_MAX, BoundViolation.RADIUS_MIN);
    }

    @Test
    @DisplayName("clamp acota cada dimensión de forma independiente")
    void clamp() {
        FailureCircle clamped = bounds.clamp(FailureCircle.of(40, 15, 2));

        assertThat(clamped).isEqualTo(FailureCircle.of(30, 15, 6));
        assertThat(bounds.contains(clamped)).isTrue();
    }

    @Test
    @DisplayName("La ventana de refinamiento se recorta a los límites")
    void window() {
        SearchBounds window = bounds.window(FailureCircle.of(29, 13, 10), 2, 2, 1);

        assertThat(window.centerXMin()).isEqualTo(27.0);
        assertThat(window.centerXMax()).isEqualTo(30.0);
        assertThat(window.centerYMin()).isEqualTo(12.0);
        assertThat(window.centerYMax()).isEqualTo(15.0);
        assertThat(window.radiusMin()).isEqualTo(9.0);
        assertThat(window.radiusMax()).isEqualTo(11.0);
    }

    @Test
    @DisplayName("Rangos invertidos o radio mínimo no positivo son errores de parámetro")
    void constructor_shouldValidate() {
        assertThrows(ParameterException.class, () -> new SearchBounds(30, 10, 12, 20, 6, 24));
        assertThrows(ParameterException.class, () -> new SearchBounds(10, 30, 12, 20, 0, 24));
        assertThrows(ParameterException.class, () -> new SearchBounds(10, 30, 12, Double.NaN, 6, 24));
    }
}
