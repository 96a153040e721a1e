package projecttalus.physics.search;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projecttalus.config.SearchConfig;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;
import projecttalus.domain.result.AnalysisStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Estado mutable de una ejecución de búsqueda: contadores, mejor candidato,
 * generador aleatorio y cancelación.
 * <p>
 * Contadores y generador aleatorio solo los toca el hilo que lanza la búsqueda.
 * Los hilos del pool acceden al {@link BestCandidateTracker} y a
 * {@link #isCancelled()}, que invoca el {@code BooleanSupplier} del llamador y
 * escribe el indicador volátil {@code cancelled}: ese proveedor debe ser
 * thread-safe.
 */
@Slf4j
@Getter
class SearchRun {

    private final SearchConfig config;
    private final SearchBounds bounds;
    private final CandidateEvaluator evaluator;
    private final ExecutorService threadPool;
    private final BooleanSupplier cancellation;
    private final SearchProgressListener listener;

    private final BestCandidateTracker tracker = new BestCandidateTracker();
    private final Map<AnalysisStatus, Integer> rejectedByStatus = new EnumMap<>(AnalysisStatus.class);
    private final Random random;

    private int evaluatedCount;
    private int completedRounds;
    private volatile boolean cancelled;

    SearchRun(SearchConfig config, SearchBounds bounds, CandidateEvaluator evaluator, ExecutorService threadPool,
              BooleanSupplier cancellation, SearchProgressListener listener) {
        this.config = config;
        this.bounds = bounds;
        this.evaluator = evaluator;
        this.threadPool = threadPool;
        this.cancellation = cancellation;
        this.listener = listener;
        this.random = new Random(config.getSeed());
    }

    /**
     * Evalúa un lote en paralelo. La lista devuelta está alineada con la de entrada;
     * los candidatos no evaluados por cancelación llevan estado {@code CANCELLED}.
     */
    List<CandidateEvaluation> evaluate(List<FailureCircle> circles) {
        List<CandidateEvaluationTask> tasks = new ArrayList<>(circles.size());
        for (FailureCircle circle : circles) {
            tasks.add(new CandidateEvaluationTask(circle, evaluator, config.getMethod(), this::isCancelled, tracker));
        }

        List<Future<CandidateEvaluation>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Búsqueda de círculo crítico interrumpida.", e);
        }

        List<CandidateEvaluation> evaluations = new ArrayList<>(circles.size());
        for (int i = 0; i < futures.size(); i++) {
            CandidateEvaluation evaluation;
            try {
                evaluation = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Búsqueda de círculo crítico interrumpida.", e);
            } catch (ExecutionException e) {
                throw new RuntimeException("Error evaluando el candidato " + circles.get(i), e.getCause());
            }
            evaluations.add(evaluation);
            if (evaluation.isCancelled()) {
                cancelled = true;
                continue;
            }
            evaluatedCount++;
            if (!evaluation.isValid()) {
                rejectedByStatus.merge(evaluation.result().getStatus(), 1, Integer::sum);
            }
        }
        listener.onBatchCompleted(evaluatedCount, bestFactorOfSafety());
        return evaluations;
    }

    boolean isCancelled() {
        if (!cancelled && cancellation.getAsBoolean()) {
            log.info("Cancelación solicitada desde el hilo {}", Thread.currentThread().getName());
            cancelled = true;
        }
        return cancelled;
    }

    void roundCompleted() {
        completedRounds++;
    }

    OptionalDouble bestFactorOfSafety() {
        return tracker.get()
                .map(best -> OptionalDouble.of(best.factorOfSafety()))
                .orElse(OptionalDouble.empty());
    }

    /**
     * Círculo uniforme dentro de unos límites, sorteado en el hilo llamante.
     */
    FailureCircle randomCircle(SearchBounds within) {
        return new FailureCircle(
                within.centerXMin() + random.nextDouble() * within.centerXSpan(),
                within.centerYMin() + random.nextDouble() * within.centerYSpan(),
                within.radiusMin() + random.nextDouble() * within.radiusSpan());
    }
}
