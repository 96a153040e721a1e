package projecttalus.domain.slice;

import projecttalus.exception.ParameterException;

/**
 * Dovela vertical entre dos abscisas consecutivas, con su base sobre el arco
 * inferior del círculo de falla.
 *
 * @param index                Índice de la columna dentro de las N solicitadas (no se renumera al descartar).
 * @param xLeft                Abscisa izquierda [m].
 * @param xRight               Abscisa derecha [m].
 * @param width                Ancho Δx [m].
 * @param xCenter              Abscisa central [m].
 * @param yBase                Cota de la base en el centro [m].
 * @param ySurface             Cota del terreno en el centro [m].
 * @param height               Altura ySurface - yBase [m].
 * @param alpha                Inclinación de la base [rad], positiva en el sentido del deslizamiento.
 * @param arcLength            Longitud de arco de la base ΔL [m].
 * @param weight               Peso W [kN/m].
 * @param porePressure         Presión de poros en la base u [kPa].
 * @param cohesion             Cohesión efectiva c' en la base [kPa].
 * @param frictionAngleDegrees Ángulo de fricción φ' en la base [°].
 */
public record Slice(
        int index,
        double xLeft,
        double xRight,
        double width,
        double xCenter,
        double yBase,
        double ySurface,
        double height,
        double alpha,
        double arcLength,
        double weight,
        double porePressure,
        double cohesion,
        double frictionAngleDegrees
) {
    public Slice {
        if (!(width > 0)) {
            throw new ParameterException("width", width, "El ancho de la dovela debe ser > 0");
        }
        if (!(height > 0)) {
            throw new ParameterException("height", height, "La altura de la dovela debe ser > 0");
        }
        if (!(arcLength > 0) || Double.isInfinite(arcLength)) {
            throw new ParameterException("arcLength", arcLength, "La longitud de arco debe ser > 0");
        }
        if (!(weight >= 0) || Double.isInfinite(weight)) {
            throw new ParameterException("weight", weight, "El peso de la dovela debe ser ≥ 0");
        }
        if (!(porePressure >= 0)) {
            throw new ParameterException("porePressure", porePressure, "La presión de poros debe ser ≥ 0");
        }
        if (!Double.isFinite(alpha)) {
            throw new ParameterException("alpha", alpha, "Inclinación de base no finita");
        }
    }

    public double sinAlpha() {
        return Math.sin(alpha);
    }

    public double cosAlpha() {
        return Math.cos(alpha);
    }

    public double alphaDegrees() {
        return Math.toDegrees(alpha);
    }

    public double tanFriction() {
        return Math.tan(Math.toRadians(frictionAngleDegrees));
    }

    /**
     * Componente actuante W·sin(α).
     */
    public double drivingForce() {
        return weight * sinAlpha();
    }

    /**
     * Normal efectiva de Fellenius W·cos(α) - u·ΔL, sin truncar.
     */
    public double effectiveNormal() {
        return weight * cosAlpha() - porePressure * arcLength;
    }

    public boolean inTension() {
        return effectiveNormal() < 0;
    }
}
