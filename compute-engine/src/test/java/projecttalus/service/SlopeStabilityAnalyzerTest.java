package projecttalus.service;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import projecttalus.config.ConstraintConfig;
import projecttalus.config.SearchConfig;
import projecttalus.domain.analysis.AnalysisReport;
import projecttalus.domain.analysis.AnalysisRequest;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;
import projecttalus.domain.result.MethodComparison;
import projecttalus.domain.search.SearchResult;
import projecttalus.domain.search.SearchStatus;
import projecttalus.domain.terrain.TerrainPoint;
import projecttalus.exception.ConvergenceException;
import projecttalus.physics.geometry.SliceDiscretizer;
import projecttalus.physics.solver.impl.BishopSolver;
import projecttalus.physics.solver.impl.FelleniusSolver;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;
import static projecttalus.testing.SlopeScenarios.*;

@Slf4j
class SlopeStabilityAnalyzerTest {

    private final SlopeStabilityAnalyzer analyzer = new SlopeStabilityAnalyzer();

    private static AnalysisRequest.AnalysisRequestBuilder bermRequest() {
        return AnalysisRequest.builder()
                .terrain(bermTerrain())
                .soil(bermSoil())
                .circle(bermCircle());
    }

    @Nested
    @DisplayName("Análisis de un círculo")
    class Analyze {

        @Test
        @DisplayName("Talud con berma: ambos métodos, comparación fuera de margen y Fellenius gobierna")
        void bermScenario_bothMethods() {
            // ACT
            AnalysisReport report = analyzer.analyze(bermRequest().build());

            // ASSERT
            assertTrue(report.isSuccess());
            assertEquals(4.88125, report.getResult(AnalysisMethod.FELLENIUS).orElseThrow().getFactorOfSafety().getAsDouble(), 1e-3);
            assertEquals(6.78366, report.getResult(AnalysisMethod.BISHOP).orElseThrow().getFactorOfSafety().getAsDouble(), 1e-3);
            assertThat(report.getSliceSet()).hasValueSatisfying(slices -> assertThat(slices.size()).isEqualTo(10));

            MethodComparison comparison = report.getComparison().orElseThrow();
            log.info("Diferencia Bishop/Fellenius: {}%", comparison.relativeDifferencePercent());
            assertFalse(comparison.withinExpectedMargin(), "Círculo profundo y simétrico: Bishop supera el margen habitual");
            assertTrue(comparison.bishopFactorOfSafety() > comparison.felleniusFactorOfSafety());

            assertEquals(AnalysisMethod.FELLENIUS, report.getGoverningResult().orElseThrow().getMethod());
        }

        @Test
        @DisplayName("Talud con berma: cortes con el terreno y recomendación por gran diferencia")
        void bermScenario_intersectionsAndRecommendations() {
            // ACT
            AnalysisReport report = analyzer.analyze(bermRequest().build());

            // ASSERT
            List<TerrainPoint> crossings = report.getSurfaceIntersections();
            assertEquals(2, crossings.size());
            assertEquals(11.3873, crossings.get(0).x(), 1e-3);
            assertEquals(10.1780, crossings.get(0).y(), 1e-3);
            assertEquals(35.0, crossings.get(1).x(), 1e-3);
            assertEquals(2.6667, crossings.get(1).y(), 1e-3);

            // Sin tracción y ambos Fs > 1: solo se señala la diferencia (~39 %)
            assertThat(report.getRecommendations()).hasSize(1);
            assertThat(report.getRecommendations().get(0)).startsWith("Diferencia grande del 39");
        }

        @Test
        @DisplayName("Un círculo fuera del terreno no tiene cortes ni recomendaciones")
        void circleAboveTerrain_noIntersectionsNorRecommendations() {
            AnalysisReport report = analyzer.analyze(bermRequest().circle(FailureCircle.of(30, 30, 5)).build());

            assertThat(report.getSurfaceIntersections()).isEmpty();
            assertThat(report.getRecommendations()).isEmpty();
        }

        @Test
        @DisplayName("El nivel freático reduce el Fs de ambos métodos")
        void bermScenario_withWaterTable() {
            AnalysisReport report = analyzer.analyze(bermRequest().waterTable(bermWaterTable()).build());

            AnalysisResult fellenius = report.getResult(AnalysisMethod.FELLENIUS).orElseThrow();
            AnalysisResult bishop = report.getResult(AnalysisMethod.BISHOP).orElseThrow();
            assertEquals(2.99998, fellenius.getFactorOfSafety().getAsDouble(), 1e-3);
            assertEquals(4.7737, bishop.getFactorOfSafety().getAsDouble(), 1e-3);
            assertTrue(fellenius.hasWarnings(), "Las dovelas en tracción deben advertirse");
        }

        @Test
        @DisplayName("Solo se informa del método solicitado")
        void onlyRequestedMethod() {
            AnalysisReport report = analyzer.analyze(bermRequest().method(AnalysisMethod.FELLENIUS).build());

            assertThat(report.getResults()).containsOnlyKeys(AnalysisMethod.FELLENIUS);
            assertThat(report.getComparison()).isEmpty();
        }

        @Test
        @DisplayName("Momento motor negativo: ambos métodos con INVALID_SLIP_SURFACE")
        void negativeDrivingMoment() {
            AnalysisReport report = analyzer.analyze(bermRequest().circle(FailureCircle.of(5, 12, 10)).build());

            assertFalse(report.isSuccess());
            assertEquals(AnalysisStatus.INVALID_SLIP_SURFACE, report.getResult(AnalysisMethod.FELLENIUS).orElseThrow().getStatus());
            assertEquals(AnalysisStatus.INVALID_SLIP_SURFACE, report.getResult(AnalysisMethod.BISHOP).orElseThrow().getStatus());
            assertTrue(report.getGoverningResult().isEmpty());
            assertTrue(report.getComparison().isEmpty());
        }

        @Test
        @DisplayName("Círculo que no corta el terreno: GEOMETRY_ERROR sin dovelas")
        void circleAboveTerrain() {
            AnalysisReport report = analyzer.analyze(bermRequest().circle(FailureCircle.of(30, 30, 5)).build());

            assertTrue(report.getSliceSet().isEmpty());
            for (AnalysisMethod method : AnalysisMethod.values()) {
                AnalysisResult result = report.getResult(method).orElseThrow();
                assertEquals(AnalysisStatus.GEOMETRY_ERROR, result.getStatus());
                assertTrue(result.getErrorMessage().isPresent());
                assertTrue(result.getFactorOfSafety().isEmpty());
            }
        }

        @Test
        @DisplayName("Sin resistencia al corte ambos métodos fallan con su estado, sin Fs")
        void noShearResistance_bothMethodsFail() {
            AnalysisReport report = analyzer.analyze(AnalysisRequest.builder()
                    .terrain(simpleSlope())
                    .soil(cohesionlessSoil())
                    .waterTable(floodingWaterTable())
                    .circle(simpleSlopeCriticalCircle())
                    .analysisConfig(twentySlices())
                    .build());

            assertFalse(report.isSuccess());
            for (AnalysisMethod method : AnalysisMethod.values()) {
                AnalysisResult result = report.getResult(method).orElseThrow();
                assertEquals(AnalysisStatus.NO_SHEAR_RESISTANCE, result.getStatus());
                assertTrue(result.getFactorOfSafety().isEmpty());
            }
            assertTrue(report.getGoverningResult().isEmpty());
        }

        @Test
        @DisplayName("Un fallo de convergencia en Bishop no invalida el resultado de Fellenius")
        void bishopConvergenceFailure_isIsolated() {
            // ARRANGE
            BishopSolver bishop = mock(BishopSolver.class);
            when(bishop.solve(any(), any(), anyDouble())).thenThrow(new ConvergenceException(3.1, 0.02, 100));
            SlopeStabilityAnalyzer isolated = new SlopeStabilityAnalyzer(new SliceDiscretizer(), new FelleniusSolver(), bishop);

            // ACT
            AnalysisReport report = isolated.analyze(bermRequest().build());

            // ASSERT
            AnalysisResult fellenius = report.getResult(AnalysisMethod.FELLENIUS).orElseThrow();
            AnalysisResult failed = report.getResult(AnalysisMethod.BISHOP).orElseThrow();
            assertTrue(fellenius.isSuccess());
            assertEquals(AnalysisStatus.CONVERGENCE_ERROR, failed.getStatus());
            assertEquals(fellenius, report.getGoverningResult().orElseThrow());
            // Bishop se siembra con el Fs de Fellenius
            verify(bishop).solve(any(), any(), eq(fellenius.getFactorOfSafety().getAsDouble()));
            assertThat(report.getRecommendations()).containsExactly("Bishop no convergió: usar Fellenius como referencia");
        }
    }

    @Test
    @DisplayName("Búsqueda completa sobre el talud simple")
    void findCriticalCircle_simpleSlope() {
        // ARRANGE
        SearchConfig config = SearchConfig.defaults()
                .withAnalysisConfig(twentySlices())
                .withCoarseGridResolution(6)
                .withRefinePasses(1)
                .withThreadCount(2);

        // ACT
        SearchResult result = analyzer.findCriticalCircle(simpleSlope(), simpleSlopeSoil(), null,
                ConstraintConfig.defaults(), config);

        // ASSERT
        assertEquals(SearchStatus.FOUND, result.getStatus());
        SearchBounds bounds = analyzer.computeBounds(simpleSlope());
        assertEquals(bounds, result.getBounds());
        assertTrue(bounds.contains(result.getBestCircle().orElseThrow()));
        double fs = result.getBestFactorOfSafety().getAsDouble();
        assertTrue(fs > 1.5 && fs < 5.0, "Fs = " + fs);
    }
}
