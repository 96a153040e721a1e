package projecttalus.physics.search;

import lombok.extern.slf4j.Slf4j;
import projecttalus.config.AnalysisConfig;
import projecttalus.config.SearchConfig;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;
import projecttalus.domain.slice.SliceSet;
import projecttalus.domain.terrain.SoilProfile;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.domain.terrain.WaterTable;
import projecttalus.exception.StabilityException;
import projecttalus.physics.constraint.CircleConstraintCalculator;
import projecttalus.physics.geometry.SliceDiscretizer;
import projecttalus.physics.solver.impl.BishopSolver;
import projecttalus.physics.solver.impl.FelleniusSolver;

import java.util.Objects;

/**
 * Evaluador de candidatos sobre un terreno concreto: comprobación de
 * contención, discretización y solver. Bishop se siembra con Fellenius.
 * Cualquier {@link StabilityException} se traduce a un resultado rechazado.
 */
@Slf4j
public class SlopeCandidateEvaluator implements CandidateEvaluator {

    private final TerrainProfile terrain;
    private final SoilProfile soil;
    private final WaterTable waterTable;
    private final AnalysisMethod method;
    private final AnalysisConfig analysisConfig;
    private final boolean requireTerrainContainment;

    private final SliceDiscretizer discretizer;
    private final FelleniusSolver fellenius;
    private final BishopSolver bishop;

    public SlopeCandidateEvaluator(TerrainProfile terrain, SoilProfile soil, WaterTable waterTable, SearchConfig config) {
        this(terrain, soil, waterTable, config, new SliceDiscretizer(), new FelleniusSolver(), new BishopSolver());
    }

    public SlopeCandidateEvaluator(TerrainProfile terrain, SoilProfile soil, WaterTable waterTable, SearchConfig config,
                                   SliceDiscretizer discretizer, FelleniusSolver fellenius, BishopSolver bishop) {
        this.terrain = Objects.requireNonNull(terrain, "El terreno no puede ser nulo.");
        this.soil = Objects.requireNonNull(soil, "El perfil de suelo no puede ser nulo.");
        this.waterTable = waterTable;
        this.method = config.getMethod();
        this.analysisConfig = config.getAnalysisConfig();
        this.requireTerrainContainment = config.isRequireTerrainContainment();
        this.discretizer = discretizer;
        this.fellenius = fellenius;
        this.bishop = bishop;
    }

    @Override
    public AnalysisResult evaluate(FailureCircle circle) {
        if (requireTerrainContainment && !CircleConstraintCalculator.emergesWithinTerrain(circle, terrain)) {
            return AnalysisResult.failure(method, AnalysisStatus.GEOMETRY_ERROR,
                    "El arco no emerge dentro del perfil del terreno");
        }
        try {
            SliceSet slices = discretizer.discretize(circle, terrain, soil, waterTable, analysisConfig);
            AnalysisResult felleniusResult = fellenius.solve(slices, analysisConfig);
            if (method == AnalysisMethod.FELLENIUS) {
                return felleniusResult;
            }
            double seed = felleniusResult.getFactorOfSafety().orElse(0.0);
            return bishop.solve(slices, analysisConfig, seed > 0 ? seed : analysisConfig.initialFactorOfSafety());
        } catch (StabilityException e) {
            return AnalysisResult.failure(method, e);
        }
    }
}
