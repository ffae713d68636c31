package io.github.manjago.axelrod.core;

/**
 * Total payoff of the population is zero, so fitness-proportional
 * selection has no distribution to draw from.
 *
 * There is no fallback: the run that hit this is aborted.
 */
public class DegenerateFitnessException extends IllegalStateException {

    private final long cycle;

    /**
     * Raised outside a run (cycle unknown).
     */
    public DegenerateFitnessException(String message) {
        super(message);
        this.cycle = -1;
    }

    /**
     * Raised by the evolution loop at the given zero-based cycle.
     */
    public DegenerateFitnessException(long cycle, DegenerateFitnessException cause) {
        super("Degenerate fitness at cycle " + cycle + ": " + cause.getMessage(), cause);
        this.cycle = cycle;
    }

    /**
     * Zero-based cycle where the population total was zero, or -1 if unknown.
     */
    public long getCycle() {
        return cycle;
    }
}
