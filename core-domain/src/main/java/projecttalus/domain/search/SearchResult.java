package projecttalus.domain.search;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Resultado de una búsqueda de círculo crítico.
 * <p>
 * Una búsqueda cancelada conserva el mejor candidato encontrado hasta ese momento.
 */
@Value
@Builder
public class SearchResult {

    SearchStatus status;
    SearchStrategy strategy;
    SearchBounds bounds;

    FailureCircle bestCircle;
    AnalysisResult bestResult;

    /**
     * Candidatos evaluados (válidos y rechazados).
     */
    int evaluatedCount;

    /**
     * Candidatos rechazados, por estado de fallo.
     */
    @Singular("rejected")
    Map<AnalysisStatus, Integer> rejectedByStatus;

    /**
     * Pasadas de refinamiento o generaciones completadas.
     */
    int completedRounds;

    Duration elapsed;

    public Optional<FailureCircle> getBestCircle() {
        return Optional.ofNullable(bestCircle);
    }

    public Optional<AnalysisResult> getBestResult() {
        return Optional.ofNullable(bestResult);
    }

    public OptionalDouble getBestFactorOfSafety() {
        return bestResult == null ? OptionalDouble.empty() : bestResult.getFactorOfSafety();
    }

    public int getRejectedCount() {
        return rejectedByStatus.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getValidCount() {
        return evaluatedCount - getRejectedCount();
    }
}
