package projecttalus.exception;

import lombok.Getter;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisStatus;

/**
 * Ninguna dovela aporta resistencia al corte: c' = 0 y la normal efectiva
 * es nula o negativa en todas ellas (por ejemplo, bajo un nivel freático
 * muy alto). El Fs sería cero, que no es un resultado físico admisible.
 */
@Getter
public class NoShearResistanceException extends StabilityException {

    private final AnalysisMethod method;
    private final double resistingSum;
    private final int sliceCount;

    public NoShearResistanceException(AnalysisMethod method, double resistingSum, int sliceCount) {
        super(AnalysisStatus.NO_SHEAR_RESISTANCE, String.format(
                "%s: Σ fuerzas resistentes = %.3f kN ≤ 0 en %d dovelas; no hay resistencia al corte",
                method.getDisplayName(), resistingSum, sliceCount));
        this.method = method;
        this.resistingSum = resistingSum;
        this.sliceCount = sliceCount;
    }
}
