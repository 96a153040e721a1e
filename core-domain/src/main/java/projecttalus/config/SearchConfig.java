package projecttalus.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.result.AnalysisMethod;
import projecttalus.domain.search.SearchStrategy;
import projecttalus.exception.ParameterException;

import java.util.List;

/**
 * Configuración de una búsqueda de círculo crítico.
 * Agrupa la estrategia y sus parámetros con la configuración del análisis
 * que se aplica a cada candidato.
 */
@Value
@Builder
@With
public class SearchConfig {

    @Builder.Default
    SearchStrategy strategy = SearchStrategy.GRID;

    /**
     * Método con el que se evalúa cada candidato. Bishop se siembra con Fellenius.
     */
    @Builder.Default
    AnalysisMethod method = AnalysisMethod.BISHOP;

    @Builder.Default
    AnalysisConfig analysisConfig = AnalysisConfig.defaults();

    /**
     * Puntos por dimensión de la rejilla gruesa (n³ candidatos).
     */
    @Builder.Default
    int coarseGridResolution = 8;

    /**
     * Puntos por dimensión de cada rejilla de refinamiento (m³ candidatos).
     */
    @Builder.Default
    int refineGridResolution = 5;

    @Builder.Default
    int refinePasses = 2;

    @Builder.Default
    int randomSamples = 500;

    @Builder.Default
    int populationSize = 40;

    @Builder.Default
    int generations = 30;

    @Builder.Default
    int tournamentSize = 3;

    @Builder.Default
    double crossoverRate = 0.8;

    @Builder.Default
    double mutationRate = 0.2;

    /**
     * Desviación típica de la mutación, como fracción del rango de cada dimensión.
     */
    @Builder.Default
    double mutationScale = 0.05;

    @Builder.Default
    int eliteCount = 2;

    /**
     * Descarta, sin analizarlos, los círculos cuyo arco no emerge dentro del perfil.
     */
    @Builder.Default
    boolean requireTerrainContainment = true;

    /**
     * Número de hilos del pool de evaluación.
     */
    @Builder.Default
    int threadCount = Runtime.getRuntime().availableProcessors();

    /**
     * Semilla de todos los sorteos; con la misma semilla la búsqueda es reproducible.
     */
    @Builder.Default
    long seed = 42L;

    /**
     * Círculos sugeridos que se evalúan antes que el resto (acotados a los límites).
     */
    @Singular
    List<FailureCircle> hints;

    public static SearchConfig defaults() {
        return SearchConfig.builder().build();
    }

    public void validate() {
        analysisConfig.validate();
        if (coarseGridResolution < 2) {
            throw new ParameterException("coarseGridResolution", coarseGridResolution, "La rejilla necesita al menos 2 puntos por eje");
        }
        if (refineGridResolution < 2) {
            throw new ParameterException("refineGridResolution", refineGridResolution, "La rejilla necesita al menos 2 puntos por eje");
        }
        if (refinePasses < 0) {
            throw new ParameterException("refinePasses", refinePasses, "Las pasadas de refinamiento no pueden ser negativas");
        }
        if (randomSamples < 1) {
            throw new ParameterException("randomSamples", randomSamples, "Se necesita al menos una muestra");
        }
        if (populationSize < 2) {
            throw new ParameterException("populationSize", populationSize, "La población debe tener al menos 2 individuos");
        }
        if (generations < 1) {
            throw new ParameterException("generations", generations, "Se necesita al menos una generación");
        }
        if (tournamentSize < 1 || tournamentSize > populationSize) {
            throw new ParameterException("tournamentSize", tournamentSize, "Tamaño de torneo fuera de rango");
        }
        if (!(crossoverRate >= 0 && crossoverRate <= 1)) {
            throw new ParameterException("crossoverRate", crossoverRate, "La tasa de cruce debe estar en [0, 1]");
        }
        if (!(mutationRate >= 0 && mutationRate <= 1)) {
            throw new ParameterException("mutationRate", mutationRate, "La tasa de mutación debe estar en [0, 1]");
        }
        if (!(mutationScale > 0)) {
            throw new ParameterException("mutationScale", mutationScale, "La escala de mutación debe ser > 0");
        }
        if (eliteCount < 0 || eliteCount >= populationSize) {
            throw new ParameterException("eliteCount", eliteCount, "La élite debe ser menor que la población");
        }
        if (threadCount < 1) {
            throw new ParameterException("threadCount", threadCount, "Se necesita al menos un hilo");
        }
    }
}
