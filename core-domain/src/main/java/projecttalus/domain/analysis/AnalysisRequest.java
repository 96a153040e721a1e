package projecttalus.domain.analysis;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import projecttalus.config.AnalysisConfig;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.terrain.SoilProfile;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.domain.terrain.WaterTable;

import java.util.List;
import java.util.Optional;

/**
 * Petición de análisis de un círculo concreto.
 * Sin métodos explícitos se ejecutan Fellenius y Bishop.
 */
@Value
@Builder
public class AnalysisRequest {

    @NonNull
    TerrainProfile terrain;

    @NonNull
    SoilProfile soil;

    WaterTable waterTable;

    @NonNull
    FailureCircle circle;

    @Singular
    List<AnalysisMethod> methods;

    @Builder.Default
    AnalysisConfig analysisConfig = AnalysisConfig.defaults();

    public Optional<WaterTable> getWaterTable() {
        return Optional.ofNullable(waterTable);
    }

    public List<AnalysisMethod> getMethods() {
        return methods.isEmpty() ? List.of(AnalysisMethod.FELLENIUS, AnalysisMethod.BISHOP) : methods;
    }
}
