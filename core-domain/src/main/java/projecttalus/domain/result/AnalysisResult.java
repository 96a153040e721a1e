package projecttalus.domain.result;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import projecttalus.exception.StabilityException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Resultado de aplicar un método de equilibrio límite a un círculo.
 * <p>
 * Un resultado fallido nunca lleva un Fs: el consumidor recibe un
 * {@link OptionalDouble} vacío, el estado correspondiente y el mensaje de
 * error, de forma que un valor verosímil pero incorrecto no puede filtrarse.
 */
@Value
@Builder
public class AnalysisResult {

    AnalysisMethod method;
    AnalysisStatus status;

    /**
     * Fs, NaN si el análisis falló. Se expone como {@link OptionalDouble}.
     */
    @Builder.Default
    double factorOfSafety = Double.NaN;

    /**
     * Iteraciones consumidas (1 para Fellenius).
     */
    int iterations;

    /**
     * Último |Fs_n+1 - Fs_n| (Bishop). 0 para Fellenius.
     */
    double residual;

    @Singular("historyEntry")
    List<Double> factorOfSafetyHistory;

    @Singular
    List<SliceDiagnostic> sliceDiagnostics;

    double resistingSum;
    double drivingSum;
    double radius;

    @Singular
    List<String> warnings;

    String errorMessage;

    public static AnalysisResult failure(AnalysisMethod method, StabilityException exception) {
        Objects.requireNonNull(exception, "La excepción no puede ser nula.");
        return AnalysisResult.builder()
                .method(method)
                .status(exception.getStatus())
                .errorMessage(exception.getMessage())
                .build();
    }

    public static AnalysisResult failure(AnalysisMethod method, AnalysisStatus status, String message) {
        return AnalysisResult.builder()
                .method(method)
                .status(status)
                .errorMessage(message)
                .build();
    }

    /**
     * Válido solo con estado {@code VALID} y un Fs estrictamente positivo; NaN o Fs ≤ 0 nunca son éxito.
     */
    public boolean isSuccess() {
        return status == AnalysisStatus.VALID && factorOfSafety > 0;
    }

    public OptionalDouble getFactorOfSafety() {
        return isSuccess() ? OptionalDouble.of(factorOfSafety) : OptionalDouble.empty();
    }

    public Optional<StabilityClass> getStabilityClass() {
        return isSuccess() ? Optional.of(StabilityClass.fromFactorOfSafety(factorOfSafety)) : Optional.empty();
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * Momento resistente respecto al centro del círculo (suma resistente × r) [kN·m/m].
     */
    public double getResistingMoment() {
        return resistingSum * radius;
    }

    /**
     * Momento actuante respecto al centro del círculo (Σ W·sin(α) × r) [kN·m/m].
     */
    public double getDrivingMoment() {
        return drivingSum * radius;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
