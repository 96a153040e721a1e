package projecttalus.physics.search;

import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.result.AnalysisResult;

/**
 * Evalúa un círculo candidato. Las implementaciones deben poder invocarse
 * desde varios hilos a la vez y devolver un resultado fallido (no lanzar)
 * cuando el círculo no admite solución.
 */
@FunctionalInterface
public interface CandidateEvaluator {
    AnalysisResult evaluate(FailureCircle circle);
}
