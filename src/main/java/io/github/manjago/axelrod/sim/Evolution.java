package io.github.manjago.axelrod.sim;

import io.github.manjago.axelrod.core.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evolution loop for a population of two-state automatons.
 *
 * Each cycle:
 * 1. Every pair (slot 2i, slot 2i+1) plays a repeated match
 * 2. The population's mean payoff per round is recorded
 * 3. The first {@code speed} slots die; as many newcomers are drawn
 *    from the old population in proportion to payoff
 * 4. Survivors and newcomers are shuffled into the next population
 *
 * Because the population is shuffled every cycle, positional death is
 * uniformly random death; only rebirth depends on fitness.
 *
 * All randomness comes from the {@link GameRng} given at construction,
 * so two runs with equally seeded generators produce the same history.
 */
public class Evolution {

    private static final Logger log = LoggerFactory.getLogger(Evolution.class);

    private final GameRng rng;
    private final FitnessSelector selector;
    private final int reportInterval;

    // Event listener
    private EvolutionListener listener = EvolutionListener.NOOP;

    public Evolution(GameRng rng) {
        this(rng, Integer.MAX_VALUE);
    }

    /**
     * @param rng random source for generation, selection and shuffling
     * @param reportInterval cycles between progress reports (>= 1)
     */
    public Evolution(GameRng rng, int reportInterval) {
        if (reportInterval < 1) {
            throw new InvalidConfigurationException("Report interval must be >= 1, got " + reportInterval);
        }
        this.rng = rng;
        this.selector = new FitnessSelector(rng);
        this.reportInterval = reportInterval;
    }

    /**
     * Set event listener for evolution events.
     */
    public void setListener(EvolutionListener listener) {
        this.listener = listener != null ? listener : EvolutionListener.NOOP;
    }

    /**
     * Generate a population of independent random automatons.
     *
     * @param size population size (even, >= 2)
     * @throws InvalidConfigurationException on invalid size
     */
    public Population generatePopulation(int size) {
        Population.checkSize(size);

        List<Automaton> members = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            members.add(Automaton.random(rng));
        }
        log.debug("Generated {} random automatons", size);
        return new Population(members);
    }

    /**
     * Run the simulation.
     *
     * @param population initial population
     * @param cycles number of cycles (>= 0)
     * @param speed individuals replaced per cycle, in (0, population size)
     * @param rounds rounds per match (>= 1)
     * @return mean payoff of every cycle, in order; size == cycles
     * @throws InvalidConfigurationException on invalid parameters, before any cycle runs
     * @throws DegenerateFitnessException if a cycle's total payoff is zero; the run is aborted
     */
    public List<Double> evolve(Population population, int cycles, int speed, int rounds) {
        validate(population.size(), cycles, speed, rounds);

        log.info("Starting evolution: {} automatons, {} cycles, speed {}, {} rounds (seed: {})",
                population.size(), cycles, speed, rounds, rng.getInitialSeed());

        long startTime = System.currentTimeMillis();
        List<Double> history = new ArrayList<>(cycles);
        Population current = population;

        for (int cycle = 0; cycle < cycles; cycle++) {
            current = runCycle(current, cycle, speed, rounds, history);

            CycleReport report = new CycleReport(
                    cycle, cycles, history.get(cycle), current.cooperationRate());
            listener.onCycle(report, current);

            if ((cycle + 1) % reportInterval == 0) {
                reportProgress(report);
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Evolution finished after {} cycles ({} ms)", cycles, elapsed);
        return Collections.unmodifiableList(history);
    }

    /**
     * Run a single cycle, append its mean payoff to {@code history}
     * and return the next population.
     */
    private Population runCycle(Population population, int cycle, int speed, int rounds,
                                List<Double> history) {
        int size = population.size();
        long[] payoffs = Game.matchPopulation(population, rounds);

        long total = 0;
        for (long p : payoffs) {
            total += p;
        }
        double meanPayoff = (double) total / ((double) rounds * size);
        history.add(meanPayoff);

        double[] distribution;
        try {
            distribution = FitnessSelector.computeDistribution(payoffs);
        } catch (DegenerateFitnessException e) {
            log.error("Cycle {}: total payoff is zero, aborting run", cycle);
            throw new DegenerateFitnessException(cycle, e);
        }

        List<Automaton> members = population.members();
        List<Automaton> next = new ArrayList<>(size);
        next.addAll(members.subList(speed, size));
        next.addAll(selector.sample(distribution, members, speed));
        rng.shuffle(next);

        log.debug("Cycle {}: mean payoff {}, total {}", cycle, meanPayoff, total);
        return new Population(next);
    }

    private void reportProgress(CycleReport report) {
        log.info("Cycle {}/{}: mean payoff {}, cooperation {}%",
                report.cycle() + 1, report.totalCycles(),
                String.format("%.4f", report.meanPayoff()),
                String.format("%.1f", report.cooperationRate() * 100));

        listener.onProgress(report);
    }

    /**
     * Check run parameters.
     *
     * @throws InvalidConfigurationException on the first invalid parameter
     */
    public static void validate(int populationSize, int cycles, int speed, int rounds) {
        Population.checkSize(populationSize);
        if (cycles < 0) {
            throw new InvalidConfigurationException("Cycles must be >= 0, got " + cycles);
        }
        if (speed <= 0 || speed >= populationSize) {
            throw new InvalidConfigurationException(String.format(
                    "Speed must be in (0, %d), got %d", populationSize, speed));
        }
        if (rounds < 1) {
            throw new InvalidConfigurationException("Rounds per match must be >= 1, got " + rounds);
        }
    }

    public GameRng getRng() { return rng; }
    public int getReportInterval() { return reportInterval; }
}
