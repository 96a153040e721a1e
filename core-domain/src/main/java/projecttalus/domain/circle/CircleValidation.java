package projecttalus.domain.circle;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resultado de validar un círculo contra {@link SearchBounds}.
 * <p>
 * El círculo corregido es un {@link Optional} explícito: sin corrección
 * automática siempre está vacío, aunque ningún límite se haya incumplido.
 *
 * @param valid           {@code true} si el círculo original cumple todos los límites.
 * @param violations      Límites incumplidos por el círculo original.
 * @param correctedCircle Círculo acotado (solo con corrección automática).
 */
public record CircleValidation(
        boolean valid,
        List<BoundViolation> violations,
        Optional<FailureCircle> correctedCircle
) {
    public CircleValidation {
        violations = List.copyOf(Objects.requireNonNull(violations, "violations"));
        Objects.requireNonNull(correctedCircle, "correctedCircle debe ser Optional.empty(), no null.");
        if (valid != violations.isEmpty()) {
            throw new IllegalArgumentException("Un círculo es válido si y solo si no incumple ningún límite.");
        }
    }
}
