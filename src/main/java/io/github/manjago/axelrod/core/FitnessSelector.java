package io.github.manjago.axelrod.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fitness-proportional (roulette wheel) selection.
 *
 * An individual's fitness is its share of the population's total payoff.
 * The shares are laid out as a cumulative distribution over [0, 1] and
 * individuals are drawn with replacement by uniform draws against it.
 */
public class FitnessSelector {

    private static final Logger log = LoggerFactory.getLogger(FitnessSelector.class);

    /** Allowed drift of the last cumulative entry from 1.0 */
    static final double TOLERANCE = 1e-9;

    private final GameRng rng;

    /**
     * @param rng source of the uniform draws
     */
    public FitnessSelector(GameRng rng) {
        this.rng = rng;
    }

    /**
     * Build the cumulative distribution for a payoff vector.
     *
     * Result has payoffs.length + 1 entries: cum[0] = 0,
     * cum[i] = cum[i-1] + payoffs[i-1] / sum, cum[N] = 1.
     *
     * @throws DegenerateFitnessException if the payoffs sum to zero
     * @throws IllegalArgumentException if a payoff is negative
     */
    public static double[] computeDistribution(long[] payoffs) {
        long sum = 0;
        for (long p : payoffs) {
            if (p < 0) {
                throw new IllegalArgumentException("Negative payoff: " + p);
            }
            sum += p;
        }
        if (sum == 0) {
            throw new DegenerateFitnessException(
                    "Total payoff of " + payoffs.length + " individuals is zero");
        }

        double[] cumulative = new double[payoffs.length + 1];
        for (int i = 1; i <= payoffs.length; i++) {
            cumulative[i] = cumulative[i - 1] + (double) payoffs[i - 1] / sum;
        }

        int last = payoffs.length;
        if (Math.abs(cumulative[last] - 1.0) > TOLERANCE) {
            throw new IllegalStateException("Cumulative distribution ends at " + cumulative[last]);
        }
        // Pin to exactly 1 so every draw in [0,1) lands somewhere
        cumulative[last] = 1.0;
        return cumulative;
    }

    /**
     * Draw {@code count} individuals with replacement.
     *
     * Each draw takes r in [0, 1) and picks population[i-1] for the smallest i
     * with distribution[i] > r. Individuals with zero fitness are never picked.
     *
     * @param distribution cumulative distribution from {@link #computeDistribution(long[])}
     * @param population individuals the distribution was built for
     * @param count number of draws (>= 0)
     */
    public List<Automaton> sample(double[] distribution, List<Automaton> population, int count) {
        if (distribution.length != population.size() + 1) {
            throw new IllegalArgumentException(String.format(
                    "Distribution has %d entries, expected %d",
                    distribution.length, population.size() + 1));
        }
        if (count < 0) {
            throw new IllegalArgumentException("Sample count must be >= 0, got " + count);
        }

        List<Automaton> drawn = new ArrayList<>(count);
        for (int n = 0; n < count; n++) {
            double r = rng.nextDouble();
            int index = firstAbove(distribution, r);
            drawn.add(population.get(index - 1));
            log.trace("Draw r={} -> slot {}", r, index - 1);
        }
        return drawn;
    }

    /**
     * Smallest i with distribution[i] > r. Exists for any r in [0, 1)
     * because the last entry is 1.
     */
    static int firstAbove(double[] distribution, double r) {
        int low = 1;
        int high = distribution.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (distribution[mid] > r) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    @Override
    public String toString() {
        return "FitnessSelector[" + rng + "]";
    }
}
