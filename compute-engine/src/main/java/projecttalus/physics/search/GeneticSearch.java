package projecttalus.physics.search;

import lombok.extern.slf4j.Slf4j;
import projecttalus.config.SearchConfig;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Algoritmo genético sobre (xc, yc, r).
 * <p>
 * Aptitud 1/Fs para candidatos válidos y 0 para los rechazados; selección
 * por torneo, cruce por mezcla de coordenadas, mutación gaussiana acotada a
 * los límites y elitismo. El mejor candidato de toda la ejecución lo guarda
 * el {@link BestCandidateTracker}, no la población.
 */
@Slf4j
final class GeneticSearch {

    private static final double INVALID_FITNESS = 0.0;

    private GeneticSearch() {
    }

    /**
     * @param seeds Individuos iniciales (ya dentro de los límites); el resto de la población se sortea.
     */
    static void run(SearchRun run, List<FailureCircle> seeds) {
        SearchConfig config = run.getConfig();
        SearchBounds bounds = run.getBounds();

        List<FailureCircle> initial = new ArrayList<>(config.getPopulationSize());
        for (FailureCircle seed : seeds) {
            if (initial.size() < config.getPopulationSize()) {
                initial.add(bounds.clamp(seed));
            }
        }
        while (initial.size() < config.getPopulationSize()) {
            initial.add(run.randomCircle(bounds));
        }

        List<CandidateEvaluation> population = run.evaluate(initial);
        for (int generation = 1; generation <= config.getGenerations(); generation++) {
            if (run.isCancelled()) {
                return;
            }
            population.sort(Comparator.comparingDouble(GeneticSearch::fitness).reversed());

            List<CandidateEvaluation> elites = new ArrayList<>(population.subList(0, config.getEliteCount()));
            List<FailureCircle> offspring = new ArrayList<>(config.getPopulationSize() - elites.size());
            Random random = run.getRandom();
            while (elites.size() + offspring.size() < config.getPopulationSize()) {
                FailureCircle first = tournament(population, config.getTournamentSize(), random);
                FailureCircle second = tournament(population, config.getTournamentSize(), random);
                FailureCircle child = random.nextDouble() < config.getCrossoverRate()
                        ? crossover(first, second, random)
                        : first;
                offspring.add(mutate(child, bounds, config, random));
            }

            List<CandidateEvaluation> next = new ArrayList<>(elites);
            next.addAll(run.evaluate(offspring));
            population = next;
            run.roundCompleted();
            log.debug("Generación {}: mejor Fs = {}", generation, run.bestFactorOfSafety());
        }
    }

    static double fitness(CandidateEvaluation evaluation) {
        if (!evaluation.isValid()) {
            return INVALID_FITNESS;
        }
        return 1.0 / Math.max(evaluation.factorOfSafety(), 1e-9);
    }

    private static FailureCircle tournament(List<CandidateEvaluation> population, int size, Random random) {
        CandidateEvaluation winner = null;
        for (int i = 0; i < size; i++) {
            CandidateEvaluation contender = population.get(random.nextInt(population.size()));
            if (winner == null || fitness(contender) > fitness(winner)) {
                winner = contender;
            }
        }
        return winner.circle();
    }

    // Mezcla convexa independiente por coordenada
    static FailureCircle crossover(FailureCircle a, FailureCircle b, Random random) {
        double wx = random.nextDouble();
        double wy = random.nextDouble();
        double wr = random.nextDouble();
        return new FailureCircle(
                wx * a.centerX() + (1 - wx) * b.centerX(),
                wy * a.centerY() + (1 - wy) * b.centerY(),
                wr * a.radius() + (1 - wr) * b.radius());
    }

    static FailureCircle mutate(FailureCircle circle, SearchBounds bounds, SearchConfig config, Random random) {
        double x = circle.centerX();
        double y = circle.centerY();
        double r = circle.radius();
        if (random.nextDouble() < config.getMutationRate()) {
            x += random.nextGaussian() * config.getMutationScale() * bounds.centerXSpan();
        }
        if (random.nextDouble() < config.getMutationRate()) {
            y += random.nextGaussian() * config.getMutationScale() * bounds.centerYSpan();
        }
        if (random.nextDouble() < config.getMutationRate()) {
            r += random.nextGaussian() * config.getMutationScale() * bounds.radiusSpan();
        }
        // Acotar antes de construir: un radio mutado puede ser negativo
        return bounds.clamp(new FailureCircle(x, y, Math.max(r, bounds.radiusMin())));
    }
}
