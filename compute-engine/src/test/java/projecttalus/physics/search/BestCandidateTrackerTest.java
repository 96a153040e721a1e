package projecttalus.physics.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class BestCandidateTrackerTest {

    private static CandidateEvaluation candidate(double x, double factorOfSafety) {
        AnalysisResult result = AnalysisResult.builder()
                .method(AnalysisMethod.BISHOP)
                .status(AnalysisStatus.VALID)
                .factorOfSafety(factorOfSafety)
                .build();
        return new CandidateEvaluation(FailureCircle.of(x, 10, 5), result);
    }

    @Test
    @DisplayName("Solo los candidatos válidos con menor Fs reemplazan al mejor")
    void offer_keepsMinimum() {
        BestCandidateTracker tracker = new BestCandidateTracker();
        CandidateEvaluation rejected = new CandidateEvaluation(FailureCircle.of(0, 10, 5),
                AnalysisResult.failure(AnalysisMethod.BISHOP, AnalysisStatus.GEOMETRY_ERROR, "fuera"));

        assertThat(tracker.offer(rejected)).isFalse();
        assertThat(tracker.get()).isEmpty();
        assertThat(tracker.offer(candidate(1, 2.0))).isTrue();
        assertThat(tracker.offer(candidate(2, 2.5))).isFalse();
        assertThat(tracker.offer(candidate(3, 1.5))).isTrue();
        assertThat(tracker.get()).hasValueSatisfying(best -> assertThat(best.factorOfSafety()).isEqualTo(1.5));
    }

    @Test
    @DisplayName("A igual Fs gana el círculo de menor abscisa, sea cual sea el orden de llegada")
    void offer_tieBreakIsOrderIndependent() {
        BestCandidateTracker forward = new BestCandidateTracker();
        forward.offer(candidate(5, 1.8));
        forward.offer(candidate(3, 1.8));

        BestCandidateTracker backward = new BestCandidateTracker();
        backward.offer(candidate(3, 1.8));
        backward.offer(candidate(5, 1.8));

        assertThat(forward.get().orElseThrow().circle()).isEqualTo(backward.get().orElseThrow().circle());
        assertThat(forward.get().orElseThrow().circle().centerX()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Ofertas concurrentes desde varios hilos conservan el mínimo global")
    void offer_concurrent() throws Exception {
        BestCandidateTracker tracker = new BestCandidateTracker();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            double fs = 1.0 + ((i * 7919) % 2000) / 1000.0;
            CandidateEvaluation evaluation = candidate(i, fs);
            tasks.add(() -> tracker.offer(evaluation));
        }
        try {
            pool.invokeAll(tasks);
        } finally {
            pool.shutdown();
        }

        assertThat(tracker.get()).isPresent();
        assertThat(tracker.get().get().factorOfSafety()).isEqualTo(1.0);
        assertThat(tracker.get().get().circle().centerX()).isEqualTo(0.0);
    }
}
