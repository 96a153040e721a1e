package projecttalus.domain.result;

/**
 * Métodos de equilibrio límite disponibles.
 */
public enum AnalysisMethod {
    /** Método ordinario de dovelas, explícito y conservador. */
    FELLENIUS("Fellenius (ordinario)"),
    /** Bishop simplificado, iterativo. */
    BISHOP("Bishop simplificado");

    private final String displayName;

    AnalysisMethod(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
