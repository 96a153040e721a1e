package projecttalus.physics.constraint;

import lombok.extern.slf4j.Slf4j;
import projecttalus.config.ConstraintConfig;
import projecttalus.domain.circle.BoundViolation;
import projecttalus.domain.circle.CircleValidation;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;
import projecttalus.domain.terrain.SlopeDescriptor;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.exception.ParameterException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Deriva el espacio admisible de círculos a partir de la geometría del talud
 * y valida (y opcionalmente corrige) círculos concretos contra él.
 * <p>
 * Biblioteca estática, Stateless y Thread-Safe.
 */
@Slf4j
public final class CircleConstraintCalculator {

    private CircleConstraintCalculator() {
    }

    public static SearchBounds computeBounds(TerrainProfile terrain) {
        return computeBounds(terrain, ConstraintConfig.defaults());
    }

    /**
     * Límites en múltiplos de la altura H del talud:
     * xc ∈ [paramento_min - m·H, paramento_max + m·H], yc ∈ [yMax + a·H, yMax + b·H], r ∈ [c·H, d·H].
     *
     * @throws ParameterException si el terreno es plano (H = 0) o la configuración es inválida.
     */
    public static SearchBounds computeBounds(TerrainProfile terrain, ConstraintConfig config) {
        Objects.requireNonNull(terrain, "El terreno no puede ser nulo.");
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        config.validate();

        SlopeDescriptor slope = SlopeDescriptor.fromTerrain(terrain);
        double height = slope.height();
        if (!(height > 0)) {
            throw new ParameterException("height", height, "Terreno plano: no hay talud sobre el que acotar círculos");
        }

        SearchBounds bounds = SearchBounds.builder()
                .centerXMin(slope.faceMinX() - config.centerXMarginFactor() * height)
                .centerXMax(slope.faceMaxX() + config.centerXMarginFactor() * height)
                .centerYMin(slope.crestElevation() + config.centerYMinFactor() * height)
                .centerYMax(slope.crestElevation() + config.centerYMaxFactor() * height)
                .radiusMin(config.radiusMinFactor() * height)
                .radiusMax(config.radiusMaxFactor() * height)
                .build();
        log.debug("Límites para talud H = {} m (coronación x = {}, pie x = {}): {}",
                height, slope.crestX(), slope.toeX(), bounds);
        return bounds;
    }

    /**
     * Valida un círculo contra los límites.
     *
     * @param autoCorrect Si es {@code false} el círculo corregido siempre está vacío; si es
     *                    {@code true} siempre está presente (el mismo círculo si ya era válido).
     */
    public static CircleValidation validateAndCorrect(FailureCircle circle, SearchBounds bounds, boolean autoCorrect) {
        Objects.requireNonNull(circle, "El círculo no puede ser nulo.");
        Objects.requireNonNull(bounds, "Los límites no pueden ser nulos.");

        List<BoundViolation> violations = bounds.violationsOf(circle);
        boolean valid = violations.isEmpty();
        if (!autoCorrect) {
            return new CircleValidation(valid, violations, Optional.empty());
        }
        FailureCircle corrected = valid ? circle : bounds.clamp(circle);
        if (!valid) {
            log.debug("Círculo {} corregido a {} ({})", circle, corrected, violations);
        }
        return new CircleValidation(valid, violations, Optional.of(corrected));
    }

    /**
     * Comprueba que la masa deslizante queda contenida en el perfil: en ambos
     * extremos del terreno el arco inferior debe quedar por encima del suelo
     * (o no existir), de modo que la superficie de deslizamiento emerge
     * dentro del perfil y no se corta artificialmente en sus bordes.
     */
    public static boolean emergesWithinTerrain(FailureCircle circle, TerrainProfile terrain) {
        return arcAboveGroundAt(circle, terrain, terrain.getMinX())
                && arcAboveGroundAt(circle, terrain, terrain.getMaxX());
    }

    private static boolean arcAboveGroundAt(FailureCircle circle, TerrainProfile terrain, double x) {
        OptionalDouble arc = circle.lowerArcAt(x);
        return arc.isEmpty() || arc.getAsDouble() >= terrain.elevationAt(x);
    }
}
