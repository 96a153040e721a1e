package projecttalus.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import projecttalus.config.AnalysisConfig;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;
import projecttalus.domain.result.SliceDiagnostic;
import projecttalus.domain.slice.Slice;
import projecttalus.domain.slice.SliceSet;
import projecttalus.exception.ConvergenceException;
import projecttalus.exception.InvalidGeometryException;
import projecttalus.exception.InvalidSlipSurfaceException;
import projecttalus.exception.NoShearResistanceException;
import projecttalus.exception.ParameterException;
import projecttalus.physics.solver.StabilitySolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Bishop simplificado, resuelto por iteración de punto fijo.
 * <p>
 * mα = cos(α) + sin(α)·tan(φ')/Fs
 * <br>
 * Fs = Σ[(c'·Δx + max(0, W - u·Δx)·tan(φ'))/mα] / Σ W·sin(α)
 * <p>
 * Un mα ≤ 0 es una singularidad del método y se notifica como geometría
 * inválida en lugar de recortarse. Stateless y Thread-Safe.
 */
@Slf4j
public class BishopSolver implements StabilitySolver {

    /**
     * Cambios de signo consecutivos del incremento de Fs a partir de los cuales se avisa de oscilación.
     */
    private static final int OSCILLATION_THRESHOLD = 3;

    @Override
    public String getName() {
        return "Bishop";
    }

    @Override
    public String getDescription() {
        return "Bishop simplificado: equilibrio de momentos con fuerzas entre dovelas horizontales.";
    }

    @Override
    public AnalysisMethod getMethod() {
        return AnalysisMethod.BISHOP;
    }

    @Override
    public AnalysisResult solve(SliceSet slices, AnalysisConfig config) {
        return solve(slices, config, config.initialFactorOfSafety());
    }

    /**
     * Itera desde una semilla explícita (se recomienda el Fs de Fellenius).
     *
     * @throws ParameterException        si la semilla no es positiva.
     * @throws InvalidSlipSurfaceException si Σ W·sin(α) ≤ 0.
     * @throws NoShearResistanceException si ninguna dovela aporta resistencia.
     * @throws InvalidGeometryException  si algún mα ≤ 0.
     * @throws ConvergenceException      si se agota el presupuesto de iteraciones.
     */
    public AnalysisResult solve(SliceSet slices, AnalysisConfig config, double initialGuess) {
        if (!(initialGuess > 0) || Double.isInfinite(initialGuess)) {
            throw new ParameterException("initialGuess", initialGuess, "El Fs inicial de Bishop debe ser > 0");
        }
        double drivingSum = slices.drivingSum();
        if (drivingSum <= 0) {
            throw new InvalidSlipSurfaceException(drivingSum);
        }
        // Con mα > 0 el numerador solo se anula si ninguna dovela resiste
        double baseResistance = 0.0;
        for (Slice slice : slices.slices()) {
            baseResistance += slice.cohesion() * slice.width() + Math.max(0.0, effectiveWeight(slice)) * slice.tanFriction();
        }
        if (baseResistance <= 0) {
            throw new NoShearResistanceException(AnalysisMethod.BISHOP, baseResistance, slices.size());
        }

        List<Double> history = new ArrayList<>();
        double factorOfSafety = initialGuess;
        double previousDelta = 0.0;
        int signChanges = 0;
        double residual = Double.POSITIVE_INFINITY;

        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            double[] mAlpha = new double[slices.size()];
            double[] terms = new double[slices.size()];
            double numerator = 0.0;
            for (int k = 0; k < slices.size(); k++) {
                Slice slice = slices.get(k);
                mAlpha[k] = mAlpha(slice, factorOfSafety);
                if (mAlpha[k] <= 0) {
                    throw new InvalidGeometryException(slice.index(), mAlpha[k], slice.alphaDegrees(), factorOfSafety);
                }
                terms[k] = (slice.cohesion() * slice.width()
                        + Math.max(0.0, effectiveWeight(slice)) * slice.tanFriction()) / mAlpha[k];
                numerator += terms[k];
            }

            double next = numerator / drivingSum;
            double delta = next - factorOfSafety;
            residual = Math.abs(delta);
            history.add(next);
            if (delta * previousDelta < 0) {
                signChanges++;
            } else {
                signChanges = 0;
            }
            previousDelta = delta;
            log.trace("Bishop iteración {}: Fs = {} (residuo {})", iteration, next, residual);
            factorOfSafety = next;

            if (residual < config.tolerance()) {
                return buildResult(slices, config, next, iteration, residual, history,
                        numerator, drivingSum, terms, mAlpha, signChanges >= OSCILLATION_THRESHOLD);
            }
        }

        log.warn("Bishop no convergió en {} iteraciones (Fs = {}, residuo = {})",
                config.maxIterations(), factorOfSafety, residual);
        throw new ConvergenceException(factorOfSafety, residual, config.maxIterations());
    }

    private AnalysisResult buildResult(SliceSet slices, AnalysisConfig config, double factorOfSafety,
                                       int iterations, double residual, List<Double> history,
                                       double resistingSum, double drivingSum,
                                       double[] terms, double[] mAlpha, boolean oscillated) {
        AnalysisResult.AnalysisResultBuilder result = AnalysisResult.builder()
                .method(AnalysisMethod.BISHOP)
                .status(AnalysisStatus.VALID)
                .factorOfSafety(factorOfSafety)
                .iterations(iterations)
                .residual(residual)
                .factorOfSafetyHistory(history)
                .resistingSum(resistingSum)
                .drivingSum(drivingSum)
                .radius(slices.circle().radius());

        if (oscillated) {
            result.warning(String.format("Fs osciló durante la iteración antes de converger en %d iteraciones", iterations));
        }
        for (int k = 0; k < slices.size(); k++) {
            Slice slice = slices.get(k);
            boolean tension = effectiveWeight(slice) < 0;
            if (mAlpha[k] < config.lowMAlphaThreshold()) {
                result.warning(String.format("mα = %.3f en la dovela %d (α = %.1f°): próximo a la singularidad",
                        mAlpha[k], slice.index(), slice.alphaDegrees()));
            }
            if (tension) {
                result.warning(String.format("Dovela %d en tracción: W - u·Δx = %.2f kN/m truncado a 0",
                        slice.index(), effectiveWeight(slice)));
            }
            result.sliceDiagnostic(new SliceDiagnostic(slice.index(), slice.xCenter(), slice.width(), slice.height(),
                    slice.alphaDegrees(), slice.weight(), slice.porePressure(), slice.arcLength(),
                    terms[k], slice.drivingForce(), mAlpha[k], tension));
        }
        log.debug("Bishop: Fs = {} en {} iteraciones", factorOfSafety, iterations);
        return result.build();
    }

    static double mAlpha(Slice slice, double factorOfSafety) {
        return slice.cosAlpha() + slice.sinAlpha() * slice.tanFriction() / factorOfSafety;
    }

    private static double effectiveWeight(Slice slice) {
        return slice.weight() - slice.porePressure() * slice.width();
    }
}
