package projecttalus.exception;

import lombok.Getter;
import projecttalus.domain.result.AnalysisStatus;

/**
 * La suma de fuerzas actuantes Σ W·sin(α) no es positiva: el círculo no es
 * una superficie de deslizamiento legítima para este terreno.
 */
@Getter
public class InvalidSlipSurfaceException extends StabilityException {

    private final double drivingSum;

    public InvalidSlipSurfaceException(double drivingSum) {
        super(AnalysisStatus.INVALID_SLIP_SURFACE,
                String.format("Σ W·sin(α) = %.3f kN ≤ 0: el círculo no es una superficie de deslizamiento válida", drivingSum));
        this.drivingSum = drivingSum;
    }
}
