package projecttalus.domain.terrain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.With;
import projecttalus.exception.ParameterException;

/**
 * Estrato de suelo con sus parámetros geotécnicos efectivos.
 *
 * @param name                 Nombre descriptivo del estrato.
 * @param cohesion             Cohesión efectiva c' [kPa] (≥ 0).
 * @param frictionAngleDegrees Ángulo de fricción interna φ' [°] (0 a 45).
 * @param unitWeight           Peso específico γ [kN/m³] (> 0).
 * @param bottomElevation      Cota del muro del estrato [m]. {@code Double.NEGATIVE_INFINITY}
 *                             para un estrato sin límite inferior.
 */
@With
public record SoilLayer(
        String name,
        double cohesion,
        double frictionAngleDegrees,
        double unitWeight,
        double bottomElevation
) {
    public static final double MAX_FRICTION_ANGLE_DEGREES = 45.0;

    @JsonCreator
    public SoilLayer(@JsonProperty("name") String name,
                     @JsonProperty("cohesion") double cohesion,
                     @JsonProperty("frictionAngleDegrees") double frictionAngleDegrees,
                     @JsonProperty("unitWeight") double unitWeight,
                     @JsonProperty("bottomElevation") Double bottomElevation) {
        this(name, cohesion, frictionAngleDegrees, unitWeight,
                bottomElevation == null ? Double.NEGATIVE_INFINITY : bottomElevation.doubleValue());
    }

    public SoilLayer {
        if (name == null || name.isBlank()) {
            name = "Estrato";
        }
        if (!(cohesion >= 0) || Double.isInfinite(cohesion)) {
            throw new ParameterException("cohesion", cohesion, "La cohesión debe ser ≥ 0");
        }
        if (!(frictionAngleDegrees >= 0 && frictionAngleDegrees <= MAX_FRICTION_ANGLE_DEGREES)) {
            throw new ParameterException("frictionAngleDegrees", frictionAngleDegrees,
                    "El ángulo de fricción debe estar entre 0° y 45°");
        }
        if (!(unitWeight > 0) || Double.isInfinite(unitWeight)) {
            throw new ParameterException("unitWeight", unitWeight, "El peso específico debe ser > 0");
        }
        if (cohesion == 0 && frictionAngleDegrees == 0) {
            throw new ParameterException("El estrato '" + name + "' no tiene resistencia al corte (c' = 0 y φ' = 0)");
        }
        if (Double.isNaN(bottomElevation) || bottomElevation == Double.POSITIVE_INFINITY) {
            throw new ParameterException("bottomElevation", bottomElevation, "Cota de muro inválida");
        }
    }

    /**
     * Estrato homogéneo sin límite inferior.
     */
    public static SoilLayer homogeneous(double cohesion, double frictionAngleDegrees, double unitWeight) {
        return new SoilLayer("Homogéneo", cohesion, frictionAngleDegrees, unitWeight, Double.NEGATIVE_INFINITY);
    }

    /**
     * Estrato con nombre y cota de muro, para columnas multicapa.
     */
    public static SoilLayer bounded(String name, double cohesion, double frictionAngleDegrees,
                                    double unitWeight, double bottomElevation) {
        return new SoilLayer(name, cohesion, frictionAngleDegrees, unitWeight, bottomElevation);
    }

    @JsonIgnore
    public double getTanFriction() {
        return Math.tan(Math.toRadians(frictionAngleDegrees));
    }

    @JsonIgnore
    public boolean isUnbounded() {
        return bottomElevation == Double.NEGATIVE_INFINITY;
    }
}
