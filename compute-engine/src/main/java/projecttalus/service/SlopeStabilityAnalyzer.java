package projecttalus.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projecttalus.config.AnalysisConfig;
import projecttalus.config.ConstraintConfig;
import projecttalus.config.SearchConfig;
import projecttalus.domain.analysis.AnalysisReport;
import projecttalus.domain.analysis.AnalysisRequest;
import projecttalus.domain.circle.SearchBounds;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.MethodComparison;
import projecttalus.domain.search.SearchResult;
import projecttalus.domain.slice.SliceSet;
import projecttalus.domain.terrain.SoilProfile;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.domain.terrain.WaterTable;
import projecttalus.exception.StabilityException;
import projecttalus.physics.constraint.CircleConstraintCalculator;
import projecttalus.physics.geometry.SliceDiscretizer;
import projecttalus.physics.search.CriticalCircleSearch;
import projecttalus.physics.solver.impl.BishopSolver;
import projecttalus.physics.solver.impl.FelleniusSolver;

import java.util.List;
import java.util.Objects;

/**
 * Punto de entrada del motor para consumidores externos (interfaz, CLI, persistencia).
 * <p>
 * Ningún fallo se propaga como excepción desde {@link #analyze}: cada método
 * solicitado recibe un resultado, fallido con su estado y mensaje cuando el
 * círculo no admite solución.
 */
@Slf4j
@RequiredArgsConstructor
public class SlopeStabilityAnalyzer {

    private final SliceDiscretizer discretizer;
    private final FelleniusSolver fellenius;
    private final BishopSolver bishop;

    public SlopeStabilityAnalyzer() {
        this(new SliceDiscretizer(), new FelleniusSolver(), new BishopSolver());
    }

    public AnalysisReport analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "La petición no puede ser nula.");
        List<AnalysisMethod> methods = request.getMethods();
        AnalysisConfig config = request.getAnalysisConfig();
        AnalysisReport.AnalysisReportBuilder report = AnalysisReport.builder()
                .circle(request.getCircle())
                .surfaceIntersections(request.getTerrain().intersections(request.getCircle()));

        SliceSet slices;
        try {
            slices = discretizer.discretize(request.getCircle(), request.getTerrain(), request.getSoil(),
                    request.getWaterTable().orElse(null), config);
        } catch (StabilityException e) {
            log.info("Análisis de {} sin dovelas válidas: {}", request.getCircle(), e.getMessage());
            for (AnalysisMethod method : methods) {
                report.result(method, AnalysisResult.failure(method, e));
            }
            return report.build();
        }
        report.sliceSet(slices);

        // Fellenius se calcula siempre: es la semilla de Bishop
        AnalysisResult felleniusResult = run(AnalysisMethod.FELLENIUS, () -> fellenius.solve(slices, config));
        if (methods.contains(AnalysisMethod.FELLENIUS)) {
            report.result(AnalysisMethod.FELLENIUS, felleniusResult);
        }

        if (methods.contains(AnalysisMethod.BISHOP)) {
            double seed = felleniusResult.getFactorOfSafety().orElse(0.0);
            double initialGuess = seed > 0 ? seed : config.initialFactorOfSafety();
            AnalysisResult bishopResult = run(AnalysisMethod.BISHOP, () -> bishop.solve(slices, config, initialGuess));
            report.result(AnalysisMethod.BISHOP, bishopResult);

            if (felleniusResult.isSuccess() && bishopResult.isSuccess()) {
                MethodComparison comparison = MethodComparison.of(
                        felleniusResult.getFactorOfSafety().getAsDouble(),
                        bishopResult.getFactorOfSafety().getAsDouble(),
                        config.comparisonLowerMargin(), config.comparisonUpperMargin());
                if (!comparison.withinExpectedMargin()) {
                    log.warn("Bishop difiere de Fellenius un {}% en {} (margen esperado [{}%, {}%]; dovelas en tracción {} / {})",
                            String.format("%.1f", comparison.relativeDifferencePercent()), request.getCircle(),
                            comparison.lowerMargin() * 100, comparison.upperMargin() * 100,
                            slices.tensionSliceCount(), MethodComparisonAdvisor.bishopTensionCount(bishopResult));
                }
                report.comparison(comparison);
                report.recommendations(MethodComparisonAdvisor.recommendations(felleniusResult, bishopResult, comparison, slices));
            } else if (felleniusResult.isSuccess()) {
                report.recommendations(MethodComparisonAdvisor.recommendations(felleniusResult, bishopResult, null, slices));
            }
        }

        AnalysisReport result = report.build();
        log.info("Análisis de {}: {}", request.getCircle(), summary(result));
        return result;
    }

    public SearchBounds computeBounds(TerrainProfile terrain) {
        return CircleConstraintCalculator.computeBounds(terrain, ConstraintConfig.defaults());
    }

    /**
     * Búsqueda completa: deriva los límites del terreno y ejecuta la estrategia configurada.
     */
    public SearchResult findCriticalCircle(TerrainProfile terrain, SoilProfile soil, WaterTable waterTable,
                                           ConstraintConfig constraintConfig, SearchConfig searchConfig) {
        SearchBounds bounds = CircleConstraintCalculator.computeBounds(terrain, constraintConfig);
        try (CriticalCircleSearch search = new CriticalCircleSearch(searchConfig)) {
            return search.search(terrain, soil, waterTable, bounds);
        }
    }

    private static AnalysisResult run(AnalysisMethod method, SolverCall call) {
        try {
            return call.solve();
        } catch (StabilityException e) {
            log.debug("{} rechazado: {}", method.getDisplayName(), e.getMessage());
            return AnalysisResult.failure(method, e);
        }
    }

    private static String summary(AnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        report.getResults().forEach((method, result) -> sb.append(method).append(" = ")
                .append(result.isSuccess()
                        ? String.format("%.3f", result.getFactorOfSafety().getAsDouble())
                        : result.getStatus().name())
                .append("; "));
        return sb.toString();
    }

    @FunctionalInterface
    private interface SolverCall {
        AnalysisResult solve();
    }
}
