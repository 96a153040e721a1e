package projecttalus.domain.search;

/**
 * Estrategias de búsqueda del círculo crítico.
 */
public enum SearchStrategy {
    /** Rejilla gruesa sobre (xc, yc, r) seguida de pasadas de refinamiento. */
    GRID,
    /** Muestreo uniforme dentro de los límites. */
    RANDOM,
    /** Algoritmo genético con elitismo. */
    GENETIC,
    /** Rejilla gruesa y genético sembrado con el mejor punto de la rejilla. */
    HYBRID
}
