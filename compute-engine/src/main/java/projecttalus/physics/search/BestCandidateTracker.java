package projecttalus.physics.search;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mejor candidato válido visto hasta el momento. Los hilos de evaluación lo
 * actualizan mediante compare-and-swap, sin bloqueos.
 */
public class BestCandidateTracker {

    private final AtomicReference<CandidateEvaluation> best = new AtomicReference<>();

    /**
     * @return {@code true} si el candidato pasa a ser el mejor.
     */
    public boolean offer(CandidateEvaluation candidate) {
        if (!candidate.isValid()) {
            return false;
        }
        while (true) {
            CandidateEvaluation current = best.get();
            if (current != null && CandidateEvaluation.BY_FACTOR_OF_SAFETY.compare(candidate, current) >= 0) {
                return false;
            }
            if (best.compareAndSet(current, candidate)) {
                return true;
            }
        }
    }

    public Optional<CandidateEvaluation> get() {
        return Optional.ofNullable(best.get());
    }
}
