package projecttalus.exception;

import lombok.Getter;
import projecttalus.domain.result.AnalysisStatus;

/**
 * Bishop superó el presupuesto de iteraciones sin alcanzar la tolerancia.
 * Conserva el último Fs y el residuo para diagnóstico.
 */
@Getter
public class ConvergenceException extends StabilityException {

    private final double lastFactorOfSafety;
    private final double residual;
    private final int iterations;

    public ConvergenceException(double lastFactorOfSafety, double residual, int iterations) {
        super(AnalysisStatus.CONVERGENCE_ERROR, String.format(
                "Bishop no convergió en %d iteraciones (último Fs = %.4f, residuo = %.6f)",
                iterations, lastFactorOfSafety, residual));
        this.lastFactorOfSafety = lastFactorOfSafety;
        this.residual = residual;
        this.iterations = iterations;
    }
}
