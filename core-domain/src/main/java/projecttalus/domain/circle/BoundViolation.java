package projecttalus.domain.circle;

/**
 * Límite de {@link SearchBounds} incumplido por un círculo.
 */
public enum BoundViolation {
    CENTER_X_MIN,
    CENTER_X_MAX,
    CENTER_Y_MIN,
    CENTER_Y_MAX,
    RADIUS_MIN,
    RADIUS_MAX
}
