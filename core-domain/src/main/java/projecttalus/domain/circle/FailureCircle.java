package projecttalus.domain.circle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.With;
import projecttalus.exception.ParameterException;

import java.util.OptionalDouble;

/**
 * Círculo de falla candidato. Objeto de valor: durante la búsqueda se crean
 * y descartan miles de instancias, nunca se modifican, solo se reemplazan.
 *
 * @param centerX Abscisa del centro xc [m].
 * @param centerY Ordenada del centro yc [m].
 * @param radius  Radio r [m] (> 0).
 */
@With
public record FailureCircle(double centerX, double centerY, double radius) {

    @JsonCreator
    public FailureCircle(@JsonProperty("centerX") double centerX,
                         @JsonProperty("centerY") double centerY,
                         @JsonProperty("radius") double radius) {
        if (!Double.isFinite(centerX) || !Double.isFinite(centerY)) {
            throw new ParameterException(String.format("Centro del círculo no finito: (%s, %s)", centerX, centerY));
        }
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new ParameterException("radius", radius, "El radio debe ser > 0");
        }
        this.centerX = centerX;
        this.centerY = centerY;
        this.radius = radius;
    }

    public static FailureCircle of(double centerX, double centerY, double radius) {
        return new FailureCircle(centerX, centerY, radius);
    }

    public double minX() {
        return centerX - radius;
    }

    public double maxX() {
        return centerX + radius;
    }

    /**
     * Cota del arco inferior (la superficie de deslizamiento) en una abscisa.
     *
     * @param x Abscisa [m].
     * @return yc - √(r² - (x - xc)²), o vacío si x queda fuera del círculo.
     */
    public OptionalDouble lowerArcAt(double x) {
        double dx = x - centerX;
        double discriminant = radius * radius - dx * dx;
        if (discriminant < 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(centerY - Math.sqrt(discriminant));
    }

    @Override
    public String toString() {
        return String.format("FailureCircle[xc=%.3f, yc=%.3f, r=%.3f]", centerX, centerY, radius);
    }
}
