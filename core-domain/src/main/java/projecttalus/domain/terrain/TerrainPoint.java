package projecttalus.domain.terrain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import projecttalus.exception.ParameterException;

/**
 * Vértice de un perfil 2D (terreno o nivel freático).
 *
 * @param x Abscisa horizontal [m].
 * @param y Elevación [m].
 */
public record TerrainPoint(double x, double y) {

    @JsonCreator
    public TerrainPoint(@JsonProperty("x") double x, @JsonProperty("y") double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new ParameterException(String.format("Punto de perfil no finito: (%s, %s)", x, y));
        }
        this.x = x;
        this.y = y;
    }

    public static TerrainPoint of(double x, double y) {
        return new TerrainPoint(x, y);
    }
}
