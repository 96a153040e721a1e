package projecttalus.domain.result;

/**
 * Estado de validez de un análisis de estabilidad.
 * <p>
 * Distingue el caso "geometría válida y Fs calculado" de cada tipo concreto
 * de fallo, de modo que el llamador pueda explicar al usuario por qué no
 * existe un factor de seguridad.
 */
public enum AnalysisStatus {
    VALID,                // Geometría válida y Fs calculado
    PARAMETER_ERROR,      // Parámetros de suelo o geometría fuera de rango físico
    GEOMETRY_ERROR,       // El círculo no corta el terreno lo suficiente
    INVALID_SLIP_SURFACE, // Σ W·sin(α) ≤ 0: no es una superficie de deslizamiento
    INVALID_GEOMETRY,     // Bishop: mα ≤ 0 en alguna dovela
    CONVERGENCE_ERROR,    // Bishop agotó las iteraciones sin converger
    NO_SHEAR_RESISTANCE,  // Σ de fuerzas resistentes ≤ 0: el Fs sería nulo
    CANCELLED;            // Evaluación abortada por el anfitrión

    public boolean isValid() {
        return this == VALID;
    }
}
