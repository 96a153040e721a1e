package projecttalus.physics.search;

import java.util.OptionalDouble;

/**
 * Recibe el progreso de la búsqueda tras cada lote de evaluaciones.
 * Se invoca en el hilo que lanzó la búsqueda.
 */
@FunctionalInterface
public interface SearchProgressListener {

    SearchProgressListener NONE = (evaluated, best) -> {
    };

    void onBatchCompleted(int evaluatedCount, OptionalDouble bestFactorOfSafety);
}
