package projecttalus.domain.result;

/**
 * Comparación Bishop frente a Fellenius sobre el mismo conjunto de dovelas.
 * Bishop suele dar entre un 5 % y un 15 % más; una diferencia fuera del
 * margen esperado se señala, nunca invalida los resultados.
 *
 * @param felleniusFactorOfSafety Fs de Fellenius.
 * @param bishopFactorOfSafety    Fs de Bishop.
 * @param absoluteDifference      Bishop - Fellenius.
 * @param relativeDifference      (Bishop - Fellenius) / Fellenius.
 * @param lowerMargin             Límite inferior del margen esperado.
 * @param upperMargin             Límite superior del margen esperado.
 */
public record MethodComparison(
        double felleniusFactorOfSafety,
        double bishopFactorOfSafety,
        double absoluteDifference,
        double relativeDifference,
        double lowerMargin,
        double upperMargin
) {
    public static MethodComparison of(double fellenius, double bishop, double lowerMargin, double upperMargin) {
        double difference = bishop - fellenius;
        return new MethodComparison(fellenius, bishop, difference, difference / fellenius, lowerMargin, upperMargin);
    }

    public boolean withinExpectedMargin() {
        return relativeDifference >= lowerMargin && relativeDifference <= upperMargin;
    }

    public double relativeDifferencePercent() {
        return relativeDifference * 100.0;
    }
}
