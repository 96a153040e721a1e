package projecttalus.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import projecttalus.config.AnalysisConfig;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;
import projecttalus.domain.result.SliceDiagnostic;
import projecttalus.domain.slice.Slice;
import projecttalus.domain.slice.SliceSet;
import projecttalus.exception.InvalidSlipSurfaceException;
import projecttalus.exception.NoShearResistanceException;
import projecttalus.physics.solver.StabilitySolver;

/**
 * Método ordinario de dovelas (Fellenius).
 * <p>
 * Fs = Σ[c'·ΔL + max(0, W·cos(α) - u·ΔL)·tan(φ')] / Σ W·sin(α)
 * <p>
 * Explícito, sin iteración. La normal efectiva negativa se trunca a cero y
 * se avisa como dovela en tracción; si ninguna dovela resiste se lanza
 * {@link NoShearResistanceException}.
 */
@Slf4j
public class FelleniusSolver implements StabilitySolver {

    @Override
    public String getName() {
        return "Fellenius";
    }

    @Override
    public String getDescription() {
        return "Método ordinario de dovelas: equilibrio de momentos sin fuerzas entre dovelas.";
    }

    @Override
    public AnalysisMethod getMethod() {
        return AnalysisMethod.FELLENIUS;
    }

    @Override
    public AnalysisResult solve(SliceSet slices, AnalysisConfig config) {
        double drivingSum = slices.drivingSum();
        if (drivingSum <= 0) {
            throw new InvalidSlipSurfaceException(drivingSum);
        }

        AnalysisResult.AnalysisResultBuilder result = AnalysisResult.builder()
                .method(AnalysisMethod.FELLENIUS)
                .status(AnalysisStatus.VALID)
                .iterations(1)
                .radius(slices.circle().radius())
                .drivingSum(drivingSum);

        double resistingSum = 0.0;
        for (Slice slice : slices.slices()) {
            double normal = slice.effectiveNormal();
            double resisting = slice.cohesion() * slice.arcLength() + Math.max(0.0, normal) * slice.tanFriction();
            resistingSum += resisting;
            if (normal < 0) {
                result.warning(String.format("Dovela %d en tracción: N' = %.2f kN/m truncada a 0", slice.index(), normal));
            }
            result.sliceDiagnostic(new SliceDiagnostic(slice.index(), slice.xCenter(), slice.width(), slice.height(),
                    slice.alphaDegrees(), slice.weight(), slice.porePressure(), slice.arcLength(),
                    resisting, slice.drivingForce(), Double.NaN, normal < 0));
        }

        if (resistingSum <= 0) {
            throw new NoShearResistanceException(AnalysisMethod.FELLENIUS, resistingSum, slices.size());
        }

        double factorOfSafety = resistingSum / drivingSum;
        log.debug("Fellenius: Fs = {} (resistente = {}, actuante = {})", factorOfSafety, resistingSum, drivingSum);
        return result
                .factorOfSafety(factorOfSafety)
                .resistingSum(resistingSum)
                .historyEntry(factorOfSafety)
                .build();
    }
}
