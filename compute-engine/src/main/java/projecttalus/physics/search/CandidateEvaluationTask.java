package projecttalus.physics.search;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;
import projecttalus.exception.StabilityException;

import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

/**
 * Tarea que evalúa un único círculo candidato en el pool de la búsqueda y
 * ofrece el resultado al registro compartido del mejor candidato.
 * La cancelación se comprueba antes de evaluar.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class CandidateEvaluationTask implements Callable<CandidateEvaluation> {

    private final FailureCircle circle;
    private final CandidateEvaluator evaluator;
    private final AnalysisMethod method;
    private final BooleanSupplier cancellation;
    private final BestCandidateTracker tracker;

    @Override
    public CandidateEvaluation call() {
        if (cancellation.getAsBoolean()) {
            return new CandidateEvaluation(circle,
                    AnalysisResult.failure(method, AnalysisStatus.CANCELLED, "Búsqueda cancelada antes de evaluar"));
        }
        AnalysisResult result;
        try {
            result = evaluator.evaluate(circle);
        } catch (StabilityException e) {
            result = AnalysisResult.failure(method, e);
        }
        CandidateEvaluation evaluation = new CandidateEvaluation(circle, result);
        if (evaluation.isValid()) {
            tracker.offer(evaluation);
        } else {
            log.trace("{} rechazado: {}", circle, result.getStatus());
        }
        return evaluation;
    }
}
