package io.github.manjago.axelrod.sim;

/**
 * Outcome of one completed evolution cycle.
 */
public record CycleReport(
    int cycle,              // zero-based index of the completed cycle
    int totalCycles,        // cycles requested for the run
    double meanPayoff,      // mean payoff per individual per round
    double cooperationRate  // share of cooperators entering the next cycle
) {

    /**
     * Completed share of the run, 0..1.
     */
    public double progress() {
        return totalCycles > 0 ? (cycle + 1) / (double) totalCycles : 1.0;
    }
}
