package projecttalus.domain.circle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import projecttalus.exception.ParameterException;

import java.util.ArrayList;
import java.util.List;

/**
 * Espacio admisible de círculos: rango del centro y del radio.
 * Se deriva una vez por configuración de terreno y lo consumen tanto la
 * validación de círculos manuales como la búsqueda automática.
 */
@Builder
public record SearchBounds(
        double centerXMin,
        double centerXMax,
        double centerYMin,
        double centerYMax,
        double radiusMin,
        double radiusMax
) {

    @JsonCreator
    public SearchBounds(@JsonProperty("centerXMin") double centerXMin,
                        @JsonProperty("centerXMax") double centerXMax,
                        @JsonProperty("centerYMin") double centerYMin,
                        @JsonProperty("centerYMax") double centerYMax,
                        @JsonProperty("radiusMin") double radiusMin,
                        @JsonProperty("radiusMax") double radiusMax) {
        requireRange("centerX", centerXMin, centerXMax);
        requireRange("centerY", centerYMin, centerYMax);
        requireRange("radius", radiusMin, radiusMax);
        if (!(radiusMin > 0)) {
            throw new ParameterException("radiusMin", radiusMin, "El radio mínimo debe ser > 0");
        }
        this.centerXMin = centerXMin;
        this.centerXMax = centerXMax;
        this.centerYMin = centerYMin;
        this.centerYMax = centerYMax;
        this.radiusMin = radiusMin;
        this.radiusMax = radiusMax;
    }

    private static void requireRange(String name, double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min > max) {
            throw new ParameterException(String.format("Rango inválido para %s: [%s, %s]", name, min, max));
        }
    }

    /**
     * Lista de límites que el círculo incumple (vacía si es admisible).
     */
    public List<BoundViolation> violationsOf(FailureCircle circle) {
        List<BoundViolation> violations = new ArrayList<>();
        if (circle.centerX() < centerXMin) violations.add(BoundViolation.CENTER_X_MIN);
        if (circle.centerX() > centerXMax) violations.add(BoundViolation.CENTER_X_MAX);
        if (circle.centerY() < centerYMin) violations.add(BoundViolation.CENTER_Y_MIN);
        if (circle.centerY() > centerYMax) violations.add(BoundViolation.CENTER_Y_MAX);
        if (circle.radius() < radiusMin) violations.add(BoundViolation.RADIUS_MIN);
        if (circle.radius() > radiusMax) violations.add(BoundViolation.RADIUS_MAX);
        return violations;
    }

    public boolean contains(FailureCircle circle) {
        return violationsOf(circle).isEmpty();
    }

    /**
     * Acota cada dimensión del círculo de forma independiente a su límite más cercano.
     */
    public FailureCircle clamp(FailureCircle circle) {
        return new FailureCircle(
                clamp(circle.centerX(), centerXMin, centerXMax),
                clamp(circle.centerY(), centerYMin, centerYMax),
                clamp(circle.radius(), radiusMin, radiusMax));
    }

    public double centerXSpan() {
        return centerXMax - centerXMin;
    }

    public double centerYSpan() {
        return centerYMax - centerYMin;
    }

    public double radiusSpan() {
        return radiusMax - radiusMin;
    }

    /**
     * Sub-ventana centrada en un círculo, recortada a estos límites.
     *
     * @param center     Centro de la ventana.
     * @param halfWidthX Semiancho en xc.
     * @param halfWidthY Semiancho en yc.
     * @param halfWidthR Semiancho en r.
     */
    public SearchBounds window(FailureCircle center, double halfWidthX, double halfWidthY, double halfWidthR) {
        return new SearchBounds(
                Math.max(centerXMin, center.centerX() - halfWidthX),
                Math.min(centerXMax, center.centerX() + halfWidthX),
                Math.max(centerYMin, center.centerY() - halfWidthY),
                Math.min(centerYMax, center.centerY() + halfWidthY),
                Math.max(radiusMin, center.radius() - halfWidthR),
                Math.min(radiusMax, center.radius() + halfWidthR));
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
