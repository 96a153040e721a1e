package projecttalus.service;

import projecttalus.domain.result.AnalysisResult;
import projecttalus.domain.result.AnalysisStatus;
import projecttalus.domain.result.MethodComparison;
import projecttalus.domain.result.SliceDiagnostic;
import projecttalus.domain.slice.SliceSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Traduce la comparación Bishop/Fellenius de un círculo en recomendaciones
 * legibles para el informe.
 * <p>
 * Biblioteca estática, Stateless y Thread-Safe.
 */
public final class MethodComparisonAdvisor {

    static final int SLOW_CONVERGENCE_ITERATIONS = 20;
    static final double RELIABLE_SPREAD = 0.05;
    static final double MODERATE_SPREAD = 0.15;

    private MethodComparisonAdvisor() {
    }

    /**
     * @param fellenius  Resultado de Fellenius (válido).
     * @param bishop     Resultado de Bishop, válido o fallido.
     * @param comparison Comparación entre ambos, {@code null} si Bishop falló.
     * @param slices     Dovelas del análisis; sus dovelas en tracción son las que trunca Fellenius.
     * @return Recomendaciones en el orden convergencia, diferencia, tracción y estabilidad.
     */
    public static List<String> recommendations(AnalysisResult fellenius, AnalysisResult bishop,
                                               MethodComparison comparison, SliceSet slices) {
        Objects.requireNonNull(fellenius, "El resultado de Fellenius no puede ser nulo.");
        Objects.requireNonNull(bishop, "El resultado de Bishop no puede ser nulo.");
        Objects.requireNonNull(slices, "Las dovelas no pueden ser nulas.");
        List<String> advice = new ArrayList<>();

        if (bishop.getStatus() == AnalysisStatus.CONVERGENCE_ERROR) {
            advice.add("Bishop no convergió: usar Fellenius como referencia");
        } else if (bishop.isSuccess() && bishop.getIterations() > SLOW_CONVERGENCE_ITERATIONS) {
            advice.add(String.format("Bishop requirió %d iteraciones: verificar los parámetros", bishop.getIterations()));
        }
        if (comparison == null) {
            return advice;
        }

        double spread = Math.abs(comparison.relativeDifference());
        if (spread < RELIABLE_SPREAD) {
            advice.add(String.format("Diferencia del %.1f %%: ambos métodos son fiables", spread * 100));
        } else if (spread < MODERATE_SPREAD) {
            advice.add(String.format("Diferencia moderada del %.1f %%: preferir Bishop por su precisión", spread * 100));
        } else {
            advice.add(String.format("Diferencia grande del %.1f %%: revisar la geometría y los parámetros", spread * 100));
        }

        long felleniusTension = slices.tensionSliceCount();
        long bishopTension = bishopTensionCount(bishop);
        if (bishopTension > felleniusTension) {
            advice.add(String.format("Bishop detecta más dovelas en tracción (%d frente a %d): superficie de falla problemática",
                    bishopTension, felleniusTension));
        } else if (bishopTension < felleniusTension) {
            advice.add(String.format("Bishop reduce las dovelas en tracción (%d frente a %d) al considerar las fuerzas entre dovelas",
                    bishopTension, felleniusTension));
        }

        double fsFellenius = comparison.felleniusFactorOfSafety();
        double fsBishop = comparison.bishopFactorOfSafety();
        if (fsBishop < 1.0 && fsFellenius >= 1.0) {
            advice.add("Solo Bishop indica inestabilidad (Fs < 1): análisis más detallado recomendado");
        } else if (fsFellenius < 1.0 && fsBishop >= 1.0) {
            advice.add("Solo Fellenius indica inestabilidad (Fs < 1): Bishop es más optimista");
        }
        return advice;
    }

    static long bishopTensionCount(AnalysisResult bishop) {
        return bishop.getSliceDiagnostics().stream().filter(SliceDiagnostic::inTension).count();
    }
}
