package projecttalus.physics.search;

import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;

import java.util.Comparator;

/**
 * Par círculo / resultado producido por una tarea de evaluación.
 */
public record CandidateEvaluation(FailureCircle circle, AnalysisResult result) {

    /**
     * Orden por Fs creciente; a igual Fs decide la posición del círculo, para que
     * el mejor candidato no dependa del orden en que terminan los hilos.
     */
    static final Comparator<CandidateEvaluation> BY_FACTOR_OF_SAFETY =
            Comparator.comparingDouble(CandidateEvaluation::factorOfSafety)
                    .thenComparingDouble(e -> e.circle().centerX())
                    .thenComparingDouble(e -> e.circle().centerY())
                    .thenComparingDouble(e -> e.circle().radius());

    public boolean isValid() {
        return result.isSuccess();
    }

    public boolean isCancelled() {
        return result.getStatus() == AnalysisStatus.CANCELLED;
    }

    /**
     * Fs del candidato, o +∞ si fue rechazado.
     */
    public double factorOfSafety() {
        return result.getFactorOfSafety().orElse(Double.POSITIVE_INFINITY);
    }
}
