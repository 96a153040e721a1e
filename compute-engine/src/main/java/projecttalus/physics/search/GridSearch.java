package projecttalus.physics.search;

import lombok.extern.slf4j.Slf4j;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rejilla gruesa n³ sobre (xc, yc, r) y pasadas de refinamiento m³ centradas
 * en el mejor punto, con una ventana de ± un paso que se reduce a la mitad en
 * cada pasada.
 */
@Slf4j
final class GridSearch {

    private GridSearch() {
    }

    static void run(SearchRun run) {
        runCoarse(run);
        refine(run);
    }

    static void runCoarse(SearchRun run) {
        int n = run.getConfig().getCoarseGridResolution();
        run.evaluate(gridPoints(run.getBounds(), n));
        log.debug("Rejilla gruesa {}³: mejor Fs = {}", n, run.bestFactorOfSafety());
    }

    private static void refine(SearchRun run) {
        SearchBounds bounds = run.getBounds();
        int n = run.getConfig().getCoarseGridResolution();
        double stepX = bounds.centerXSpan() / (n - 1);
        double stepY = bounds.centerYSpan() / (n - 1);
        double stepR = bounds.radiusSpan() / (n - 1);

        for (int pass = 1; pass <= run.getConfig().getRefinePasses(); pass++) {
            if (run.isCancelled()) {
                return;
            }
            Optional<CandidateEvaluation> best = run.getTracker().get();
            if (best.isEmpty()) {
                log.debug("Sin candidato válido que refinar");
                return;
            }
            SearchBounds window = bounds.window(best.get().circle(), stepX, stepY, stepR);
            run.evaluate(gridPoints(window, run.getConfig().getRefineGridResolution()));
            run.roundCompleted();
            log.debug("Refinamiento {}: mejor Fs = {}", pass, run.bestFactorOfSafety());
            stepX /= 2;
            stepY /= 2;
            stepR /= 2;
        }
    }

    static List<FailureCircle> gridPoints(SearchBounds bounds, int resolution) {
        double[] xs = linspace(bounds.centerXMin(), bounds.centerXMax(), resolution);
        double[] ys = linspace(bounds.centerYMin(), bounds.centerYMax(), resolution);
        double[] rs = linspace(bounds.radiusMin(), bounds.radiusMax(), resolution);
        List<FailureCircle> points = new ArrayList<>(xs.length * ys.length * rs.length);
        for (double x : xs) {
            for (double y : ys) {
                for (double r : rs) {
                    points.add(new FailureCircle(x, y, r));
                }
            }
        }
        return points;
    }

    // Un rango degenerado produce un único valor
    static double[] linspace(double min, double max, int count) {
        if (max <= min) {
            return new double[]{min};
        }
        double[] values = new double[count];
        double step = (max - min) / (count - 1);
        for (int i = 0; i < count; i++) {
            values[i] = min + i * step;
        }
        values[count - 1] = max;
        return values;
    }
}
