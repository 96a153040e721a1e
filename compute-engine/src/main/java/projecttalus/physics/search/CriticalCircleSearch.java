package projecttalus.physics.search;

import lombok.extern.slf4j.Slf4j;
import projecttalus.config.SearchConfig;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;
import projecttalus.domain.search.SearchResult;
import projecttalus.domain.search.SearchStatus;
import projecttalus.domain.terrain.SoilProfile;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.domain.terrain.WaterTable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

/**
 * Orquestador de la búsqueda del círculo crítico (mínimo Fs).
 * <p>
 * Responsabilidades:
 * 1. Evaluar primero los círculos sugeridos, acotados a los límites.
 * 2. Ejecutar la estrategia configurada (rejilla, aleatoria, genética o híbrida).
 * 3. Repartir las evaluaciones en un pool fijo de hilos y consolidar el resultado.
 * <p>
 * Los sorteos aleatorios se hacen en el hilo llamante, por lo que con la
 * misma semilla la búsqueda es reproducible con cualquier número de hilos.
 * La instancia puede reutilizarse para varias búsquedas hasta cerrarla.
 */
@Slf4j
public class CriticalCircleSearch implements AutoCloseable {

    private final SearchConfig config;
    private final ExecutorService threadPool;

    public CriticalCircleSearch(SearchConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        config.validate();
        this.threadPool = Executors.newFixedThreadPool(config.getThreadCount());
        log.info("CriticalCircleSearch inicializado. (Estrategia: {}, Método: {}, Hilos: {})",
                config.getStrategy(), config.getMethod(), config.getThreadCount());
    }

    public SearchResult search(TerrainProfile terrain, SoilProfile soil, WaterTable waterTable, SearchBounds bounds) {
        return search(terrain, soil, waterTable, bounds, () -> false, SearchProgressListener.NONE);
    }

    public SearchResult search(TerrainProfile terrain, SoilProfile soil, WaterTable waterTable, SearchBounds bounds,
                               BooleanSupplier cancellation, SearchProgressListener listener) {
        return search(new SlopeCandidateEvaluator(terrain, soil, waterTable, config), bounds, cancellation, listener);
    }

    /**
     * Búsqueda con un evaluador arbitrario.
     *
     * @param cancellation Se consulta antes de cada evaluación, desde los hilos del pool, por lo que
     *                     debe ser thread-safe; al devolver {@code true} la búsqueda termina con estado
     *                     {@code CANCELLED} conservando el mejor candidato.
     */
    public SearchResult search(CandidateEvaluator evaluator, SearchBounds bounds,
                               BooleanSupplier cancellation, SearchProgressListener listener) {
        Objects.requireNonNull(evaluator, "El evaluador no puede ser nulo.");
        Objects.requireNonNull(bounds, "Los límites no pueden ser nulos.");
        long startTime = System.currentTimeMillis();

        SearchRun run = new SearchRun(config, bounds, evaluator, threadPool,
                cancellation == null ? () -> false : cancellation,
                listener == null ? SearchProgressListener.NONE : listener);
        log.info("Iniciando búsqueda {} en {}", config.getStrategy(), bounds);

        List<FailureCircle> hints = new ArrayList<>();
        for (FailureCircle hint : config.getHints()) {
            hints.add(bounds.clamp(hint));
        }
        if (!hints.isEmpty()) {
            run.evaluate(hints);
        }

        if (!run.isCancelled()) {
            switch (config.getStrategy()) {
                case GRID -> GridSearch.run(run);
                case RANDOM -> RandomSearch.run(run);
                case GENETIC -> GeneticSearch.run(run, hints);
                case HYBRID -> runHybrid(run, hints);
            }
        }

        SearchResult result = buildResult(run, Duration.ofMillis(System.currentTimeMillis() - startTime));
        log.info("Búsqueda {} finalizada: {} (Fs = {}, {} evaluados, {} rechazados, {} ms)",
                config.getStrategy(), result.getStatus(), result.getBestFactorOfSafety(),
                result.getEvaluatedCount(), result.getRejectedCount(), result.getElapsed().toMillis());
        return result;
    }

    private static void runHybrid(SearchRun run, List<FailureCircle> hints) {
        GridSearch.runCoarse(run);
        if (run.isCancelled()) {
            return;
        }
        List<FailureCircle> seeds = new ArrayList<>();
        run.getTracker().get().ifPresent(best -> seeds.add(best.circle()));
        seeds.addAll(hints);
        GeneticSearch.run(run, seeds);
    }

    private SearchResult buildResult(SearchRun run, Duration elapsed) {
        Optional<CandidateEvaluation> best = run.getTracker().get();
        SearchStatus status;
        if (run.isCancelled()) {
            status = SearchStatus.CANCELLED;
        } else if (best.isPresent()) {
            status = SearchStatus.FOUND;
        } else {
            status = SearchStatus.NO_VALID_CIRCLE;
        }
        return SearchResult.builder()
                .status(status)
                .strategy(config.getStrategy())
                .bounds(run.getBounds())
                .bestCircle(best.map(CandidateEvaluation::circle).orElse(null))
                .bestResult(best.map(CandidateEvaluation::result).orElse(null))
                .evaluatedCount(run.getEvaluatedCount())
                .rejectedByStatus(run.getRejectedByStatus())
                .completedRounds(run.getCompletedRounds())
                .elapsed(elapsed)
                .build();
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("CriticalCircleSearch cerrado.");
    }
}
