package projecttalus.config;

import lombok.Builder;
import lombok.With;
import projecttalus.exception.ParameterException;

/**
 * Parámetros numéricos de un análisis de equilibrio límite sobre un círculo.
 *
 * @param sliceCount            Número de columnas N en que se divide el rango efectivo (5 a 200).
 * @param tolerance             Tolerancia de convergencia de Bishop |Fs_n+1 - Fs_n|.
 * @param maxIterations         Presupuesto de iteraciones de Bishop.
 * @param maxAlphaDegrees       |α| a partir del cual una dovela se descarta [°].
 * @param minValidSlices        Mínimo de dovelas válidas para aceptar el círculo.
 * @param initialFactorOfSafety Semilla de Bishop cuando no se dispone del resultado de Fellenius.
 * @param lowMAlphaThreshold    mα por debajo del cual se emite un aviso de cercanía a la singularidad.
 * @param comparisonLowerMargin Diferencia relativa mínima esperada (Bishop - Fellenius) / Fellenius.
 * @param comparisonUpperMargin Diferencia relativa máxima esperada.
 */
@Builder
@With
public record AnalysisConfig(
        int sliceCount,
        double tolerance,
        int maxIterations,
        double maxAlphaDegrees,
        int minValidSlices,
        double initialFactorOfSafety,
        double lowMAlphaThreshold,
        double comparisonLowerMargin,
        double comparisonUpperMargin
) {
    public static final int SLICE_COUNT = 10;
    public static final int MIN_SLICE_COUNT = 5;
    public static final int MAX_SLICE_COUNT = 200;
    public static final double TOLERANCE = 0.001;
    public static final int MAX_ITERATIONS = 100;
    public static final double MAX_ALPHA_DEGREES = 80.0;
    public static final int MIN_VALID_SLICES = 5;

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder()
                .sliceCount(SLICE_COUNT)
                .tolerance(TOLERANCE)
                .maxIterations(MAX_ITERATIONS)
                .maxAlphaDegrees(MAX_ALPHA_DEGREES)
                .minValidSlices(MIN_VALID_SLICES)
                .initialFactorOfSafety(1.0)
                .lowMAlphaThreshold(0.2)
                .comparisonLowerMargin(-0.02)
                .comparisonUpperMargin(0.20)
                .build();
    }

    /**
     * Comprueba los rangos de todos los parámetros.
     *
     * @throws ParameterException con el primer parámetro fuera de rango.
     */
    public void validate() {
        if (sliceCount < MIN_SLICE_COUNT || sliceCount > MAX_SLICE_COUNT) {
            throw new ParameterException("sliceCount", sliceCount,
                    "El número de dovelas debe estar entre " + MIN_SLICE_COUNT + " y " + MAX_SLICE_COUNT);
        }
        if (!(tolerance > 0) || Double.isInfinite(tolerance)) {
            throw new ParameterException("tolerance", tolerance, "La tolerancia debe ser > 0");
        }
        if (maxIterations < 1) {
            throw new ParameterException("maxIterations", maxIterations, "Se necesita al menos una iteración");
        }
        if (!(maxAlphaDegrees > 0 && maxAlphaDegrees < 90)) {
            throw new ParameterException("maxAlphaDegrees", maxAlphaDegrees, "El límite de α debe estar en (0°, 90°)");
        }
        if (minValidSlices < MIN_VALID_SLICES || minValidSlices > sliceCount) {
            throw new ParameterException("minValidSlices", minValidSlices,
                    "El mínimo de dovelas válidas debe estar entre " + MIN_VALID_SLICES + " y el número de dovelas");
        }
        if (!(initialFactorOfSafety > 0) || Double.isInfinite(initialFactorOfSafety)) {
            throw new ParameterException("initialFactorOfSafety", initialFactorOfSafety, "El Fs inicial debe ser > 0");
        }
        if (!(comparisonLowerMargin <= comparisonUpperMargin)) {
            throw new ParameterException(String.format("Margen de comparación inválido: [%s, %s]",
                    comparisonLowerMargin, comparisonUpperMargin));
        }
    }
}
