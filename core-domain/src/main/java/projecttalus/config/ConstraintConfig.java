package projecttalus.config;

import lombok.Builder;
import lombok.With;
import projecttalus.exception.ParameterException;

/**
 * Factores, expresados en múltiplos de la altura H del talud, que definen el
 * espacio admisible de círculos de falla.
 *
 * @param centerXMarginFactor Margen horizontal del centro a cada lado del paramento.
 * @param centerYMinFactor    Altura mínima del centro sobre la coronación.
 * @param centerYMaxFactor    Altura máxima del centro sobre la coronación.
 * @param radiusMinFactor     Radio mínimo.
 * @param radiusMaxFactor     Radio máximo.
 */
@Builder
@With
public record ConstraintConfig(
        double centerXMarginFactor,
        double centerYMinFactor,
        double centerYMaxFactor,
        double radiusMinFactor,
        double radiusMaxFactor
) {
    public static ConstraintConfig defaults() {
        return ConstraintConfig.builder()
                .centerXMarginFactor(0.6)
                .centerYMinFactor(0.3)
                .centerYMaxFactor(1.5)
                .radiusMinFactor(0.8)
                .radiusMaxFactor(3.0)
                .build();
    }

    public void validate() {
        if (!(centerXMarginFactor >= 0)) {
            throw new ParameterException("centerXMarginFactor", centerXMarginFactor, "El margen debe ser ≥ 0");
        }
        if (!(centerYMinFactor <= centerYMaxFactor)) {
            throw new ParameterException("centerYMinFactor", centerYMinFactor,
                    "El factor mínimo de yc no puede superar al máximo");
        }
        if (!(radiusMinFactor > 0 && radiusMinFactor <= radiusMaxFactor)) {
            throw new ParameterException("radiusMinFactor", radiusMinFactor,
                    "El factor de radio mínimo debe ser > 0 y no superar al máximo");
        }
    }
}
