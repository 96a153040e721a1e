package projecttalus.physics.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projecttalus.config.SearchConfig;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GeneticSearchTest {

    private final SearchBounds bounds = new SearchBounds(10, 30, 10, 20, 5, 20);

    @Test
    @DisplayName("El cruce produce hijos dentro de la caja de sus padres")
    void crossover_staysBetweenParents() {
        Random random = new Random(1);
        FailureCircle a = FailureCircle.of(12, 11, 6);
        FailureCircle b = FailureCircle.of(28, 19, 18);

        for (int i = 0; i < 500; i++) {
            FailureCircle child = GeneticSearch.crossover(a, b, random);
            assertTrue(child.centerX() >= 12 && child.centerX() <= 28);
            assertTrue(child.centerY() >= 11 && child.centerY() <= 19);
            assertTrue(child.radius() >= 6 && child.radius() <= 18);
        }
    }

    @Test
    @DisplayName("La mutación nunca saca al individuo de los límites")
    void mutate_isClampedToBounds() {
        Random random = new Random(2);
        // Escala exagerada para forzar salidas antes del acotado
        SearchConfig config = SearchConfig.defaults().withMutationRate(1.0).withMutationScale(2.0);
        FailureCircle edge = FailureCircle.of(10, 20, 5);

        for (int i = 0; i < 500; i++) {
            FailureCircle mutated = GeneticSearch.mutate(edge, bounds, config, random);
            assertTrue(bounds.contains(mutated), "Fuera de límites: " + mutated);
        }
    }

    @Test
    @DisplayName("Con tasa de mutación nula el individuo no cambia")
    void mutate_zeroRateIsIdentity() {
        SearchConfig config = SearchConfig.defaults().withMutationRate(0.0);
        FailureCircle circle = FailureCircle.of(15, 12, 8);

        assertEquals(circle, GeneticSearch.mutate(circle, bounds, config, new Random(3)));
    }

    @Test
    @DisplayName("Aptitud 1/Fs para válidos y cero para rechazados")
    void fitness() {
        FailureCircle circle = FailureCircle.of(15, 12, 8);
        AnalysisResult valid = AnalysisResult.builder()
                .method(AnalysisMethod.BISHOP).status(AnalysisStatus.VALID).factorOfSafety(2.0).build();
        AnalysisResult rejected = AnalysisResult.failure(AnalysisMethod.BISHOP, AnalysisStatus.CONVERGENCE_ERROR, "no converge");

        assertEquals(0.5, GeneticSearch.fitness(new CandidateEvaluation(circle, valid)), 1e-12);
        assertEquals(0.0, GeneticSearch.fitness(new CandidateEvaluation(circle, rejected)));
    }

    @Test
    @DisplayName("linspace incluye ambos extremos y colapsa rangos degenerados")
    void linspace() {
        assertArrayEquals(new double[]{0, 0.5, 1}, GridSearch.linspace(0, 1, 3), 1e-12);
        assertArrayEquals(new double[]{4}, GridSearch.linspace(4, 4, 5));
        assertEquals(125, GridSearch.gridPoints(bounds, 5).size());
    }
}
