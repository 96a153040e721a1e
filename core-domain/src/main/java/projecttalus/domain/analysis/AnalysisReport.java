package projecttalus.domain.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.MethodComparison;
import projecttalus.domain.slice.SliceSet;
import projecttalus.domain.terrain.TerrainPoint;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Respuesta de un análisis: un resultado por método solicitado, la
 * comparación entre métodos cuando ambos tienen solución y las dovelas
 * usadas (vacías si la discretización falló).
 * <p>
 * Las recomendaciones solo se generan cuando se ejecutaron ambos métodos y
 * Fellenius tiene solución.
 */
@Value
@Builder
public class AnalysisReport {

    FailureCircle circle;

    @Singular
    Map<AnalysisMethod, AnalysisResult> results;

    MethodComparison comparison;

    SliceSet sliceSet;

    /**
     * Cortes del círculo completo con el terreno, ordenados por abscisa.
     */
    @Singular
    List<TerrainPoint> surfaceIntersections;

    @Singular
    List<String> recommendations;

    public Optional<AnalysisResult> getResult(AnalysisMethod method) {
        return Optional.ofNullable(results.get(method));
    }

    public Optional<MethodComparison> getComparison() {
        return Optional.ofNullable(comparison);
    }

    public Optional<SliceSet> getSliceSet() {
        return Optional.ofNullable(sliceSet);
    }

    /**
     * Resultado válido con menor Fs entre los métodos ejecutados.
     */
    public Optional<AnalysisResult> getGoverningResult() {
        return results.values().stream()
                .filter(AnalysisResult::isSuccess)
                .min(Comparator.comparingDouble(r -> r.getFactorOfSafety().getAsDouble()));
    }

    public boolean isSuccess() {
        return !results.isEmpty() && results.values().stream().allMatch(AnalysisResult::isSuccess);
    }
}
