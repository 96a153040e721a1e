package projecttalus.physics.search;

import lombok.extern.slf4j.Slf4j;
import projecttalus.domain.circle.FailureCircle;

import java.util.ArrayList;
import java.util.List;

/**
 * Muestreo uniforme de círculos dentro de los límites, evaluado por lotes.
 */
@Slf4j
final class RandomSearch {

    private static final int BATCH_SIZE = 100;

    private RandomSearch() {
    }

    static void run(SearchRun run) {
        int remaining = run.getConfig().getRandomSamples();
        while (remaining > 0 && !run.isCancelled()) {
            int batch = Math.min(BATCH_SIZE, remaining);
            List<FailureCircle> circles = new ArrayList<>(batch);
            for (int i = 0; i < batch; i++) {
                circles.add(run.randomCircle(run.getBounds()));
            }
            run.evaluate(circles);
            run.roundCompleted();
            remaining -= batch;
        }
        log.debug("Muestreo aleatorio: mejor Fs = {}", run.bestFactorOfSafety());
    }
}
