package projecttalus.exception;

import lombok.Getter;
import projecttalus.domain.result.AnalysisStatus;

/**
 * Bishop: el factor mα de una dovela se anula o cambia de signo para el Fs
 * supuesto. La orientación de la base es incompatible con el método.
 */
@Getter
public class InvalidGeometryException extends StabilityException {

    private final int sliceIndex;
    private final double mAlpha;
    private final double factorOfSafetyGuess;

    public InvalidGeometryException(int sliceIndex, double mAlpha, double alphaDegrees, double factorOfSafetyGuess) {
        super(AnalysisStatus.INVALID_GEOMETRY, String.format(
                "mα = %.4f ≤ 0 en la dovela %d (α = %.1f°, Fs supuesto = %.3f)",
                mAlpha, sliceIndex, alphaDegrees, factorOfSafetyGuess));
        this.sliceIndex = sliceIndex;
        this.mAlpha = mAlpha;
        this.factorOfSafetyGuess = factorOfSafetyGuess;
    }
}
