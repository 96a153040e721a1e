package projecttalus.physics.solver;

import projecttalus.config.AnalysisConfig;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.slice.SliceSet;

public interface StabilitySolver extends SolverComponent {

    AnalysisMethod getMethod();

    /**
     * Calcula el factor de seguridad de un conjunto de dovelas.
     *
     * @return Resultado con estado {@code VALID}.
     * @throws projecttalus.exception.StabilityException si el círculo o el método no admiten solución.
     */
    AnalysisResult solve(SliceSet slices, AnalysisConfig config);
}
