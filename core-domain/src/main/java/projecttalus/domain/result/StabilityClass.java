package projecttalus.domain.result;

/**
 * Clasificación cualitativa de un factor de seguridad.
 */
public enum StabilityClass {
    UNSTABLE("Inestable"),
    MARGINALLY_STABLE("Marginalmente estable"),
    STABLE("Estable"),
    VERY_STABLE("Muy estable");

    private final String description;

    StabilityClass(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static StabilityClass fromFactorOfSafety(double factorOfSafety) {
        if (Double.isNaN(factorOfSafety)) {
            throw new IllegalArgumentException("No se puede clasificar un Fs NaN.");
        }
        if (factorOfSafety < 1.0) {
            return UNSTABLE;
        }
        if (factorOfSafety < 1.2) {
            return MARGINALLY_STABLE;
        }
        if (factorOfSafety < 1.5) {
            return STABLE;
        }
        return VERY_STABLE;
    }
}
