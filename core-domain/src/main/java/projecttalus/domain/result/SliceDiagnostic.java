package projecttalus.domain.result;

/**
 * Datos por dovela que acompañan a un resultado, para inspección o representación externa.
 * {@code mAlpha} es NaN en Fellenius, que no lo utiliza.
 */
public record SliceDiagnostic(
        int index,
        double xCenter,
        double width,
        double height,
        double alphaDegrees,
        double weight,
        double porePressure,
        double arcLength,
        double resistingTerm,
        double drivingTerm,
        double mAlpha,
        boolean inTension
) {
}
