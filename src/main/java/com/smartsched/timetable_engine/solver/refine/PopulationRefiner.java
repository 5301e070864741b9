package com.smartsched.timetable_engine.solver.refine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.solver.core.CancellationToken;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;
import com.smartsched.timetable_engine.solver.progress.WorkReporter;

/**
 * Generational search over complete schedules. Elites carry over unchanged, the rest of each
 * generation is bred by tournament selection, cluster-aligned crossover and a small mutation.
 * Children are scored in parallel; generations run one after another.
 */
public class PopulationRefiner {

    private static final Logger logger = LoggerFactory.getLogger(PopulationRefiner.class);

    private record Scored(Chromosome chromosome, Fitness fitness) {}

    private final SchedulingProblem problem;
    private final EngineSettings settings;
    private final FitnessEvaluator evaluator;
    private final FitnessCache cache;
    private final Random random;

    public PopulationRefiner(SchedulingProblem problem, EngineSettings settings) {
        this.problem = problem;
        this.settings = settings;
        this.evaluator = new FitnessEvaluator(problem, settings);
        this.cache = new FitnessCache(settings.getCacheMaxEntries(), settings.getCacheEvictionInterval());
        this.random = new Random(settings.getSeed());
    }

    public RefinementResult refine(Chromosome seed, ChromosomeLayout layout, CancellationToken token,
                                   WorkReporter reporter) {
        long deadline = System.nanoTime() + (long) (settings.getRefinerTimeBudgetSeconds() * 1e9);
        int populationSize = Math.max(2, settings.getPopulation());
        int elites = Math.min(Math.max(1, settings.getEliteCount()), populationSize - 1);
        int generations = settings.getGenerations();

        Scored seedScored = score(seed);
        if (seed.length() == 0) {
            reporter.report(generations, generations);
            return new RefinementResult(seed, seedScored.fitness(), seedScored.fitness(), 0, cache.peakSize());
        }
        List<Chromosome> founders = new ArrayList<>();
        for (int i = 1; i < populationSize; i++) {
            Chromosome variant = seed.copy();
            mutate(variant);
            founders.add(variant);
        }
        List<Scored> population = new ArrayList<>();
        population.add(seedScored);
        population.addAll(scoreAll(founders));
        population.sort(Comparator.comparingDouble(sc -> sc.fitness().cost()));
        Scored best = population.get(0);

        int generation = 0;
        int stale = 0;
        while (generation < generations) {
            token.throwIfCancelled();
            if (System.nanoTime() > deadline) {
                logger.warn("Refinement time budget exhausted after {} generations", generation);
                break;
            }
            if (isPerfect(best.fitness())) {
                break;
            }

            List<Scored> next = new ArrayList<>(population.subList(0, elites));
            List<Chromosome> children = new ArrayList<>(populationSize - elites);
            while (children.size() < populationSize - elites) {
                Chromosome child = crossover(tournament(population), tournament(population), layout);
                mutate(child);
                children.add(child);
            }
            next.addAll(scoreAll(children));
            next.sort(Comparator.comparingDouble(sc -> sc.fitness().cost()));
            population = next;

            if (population.get(0).fitness().cost() < best.fitness().cost()) {
                best = population.get(0);
                stale = 0;
            } else {
                stale++;
            }
            Set<Long> survivors = population.stream()
                    .map(sc -> sc.chromosome().signature())
                    .collect(Collectors.toCollection(HashSet::new));
            cache.endGeneration(survivors);
            generation++;
            reporter.report(generation, generations);
            logger.debug("Generation {}: best cost {} ({} conflicts), cache {}", generation, best.fitness().cost(),
                    best.fitness().conflicts(), cache.size());
            if (stale >= settings.getPlateauGenerations()) {
                logger.info("Refinement plateaued at generation {}", generation);
                break;
            }
        }
        reporter.report(generations, generations);
        logger.info("Refinement finished after {} generations: conflicts {} -> {}, cost {} -> {}, cache peak {}",
                generation, seedScored.fitness().conflicts(), best.fitness().conflicts(), seedScored.fitness().cost(),
                best.fitness().cost(), cache.peakSize());
        int peak = cache.peakSize();
        cache.clear();
        return new RefinementResult(best.chromosome(), best.fitness(), seedScored.fitness(), generation, peak);
    }

    private boolean isPerfect(Fitness fitness) {
        return fitness.conflicts() == 0 && fitness.capacityViolations() == 0 && fitness.preferenceMisses() == 0;
    }

    private List<Scored> scoreAll(List<Chromosome> chromosomes) {
        return chromosomes.parallelStream().map(this::score).collect(Collectors.toList());
    }

    private Scored score(Chromosome chromosome) {
        long signature = chromosome.signature();
        Fitness fitness = cache.get(signature);
        if (fitness == null) {
            fitness = evaluator.evaluate(chromosome);
            cache.put(signature, fitness);
        }
        return new Scored(chromosome, fitness);
    }

    private Chromosome tournament(List<Scored> population) {
        Scored winner = null;
        for (int i = 0; i < Math.max(1, settings.getTournamentSize()); i++) {
            Scored contender = population.get(random.nextInt(population.size()));
            if (winner == null || contender.fitness().cost() < winner.fitness().cost()) {
                winner = contender;
            }
        }
        return winner.chromosome();
    }

    // Child takes a contiguous run of cluster blocks from the second parent.
    private Chromosome crossover(Chromosome first, Chromosome second, ChromosomeLayout layout) {
        Chromosome child = first.copy();
        int blocks = layout.blockCount();
        if (blocks == 0 || first == second) {
            return child;
        }
        int from = random.nextInt(blocks);
        int to = from + 1 + random.nextInt(blocks - from);
        for (int b = from; b < to; b++) {
            for (int s : layout.block(b)) {
                child.set(s, second.slot(s), second.room(s));
            }
        }
        return child;
    }

    private void mutate(Chromosome chromosome) {
        int genes = Math.max(1, (int) Math.round(settings.getMutationRate() * chromosome.length()));
        for (int i = 0; i < genes; i++) {
            int s = random.nextInt(chromosome.length());
            int[] rooms = problem.roomsForCourse(problem.courseOfSession(s));
            chromosome.set(s, random.nextInt(problem.slotCount()), rooms[random.nextInt(rooms.length)]);
        }
    }
}
