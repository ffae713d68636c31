package io.github.manjago.axelrod.sim;

import java.util.List;

/**
 * Summary of a mean-payoff history.
 */
public record HistoryStats(
    int cycles,
    double first,
    double last,
    double min,
    double max,
    double mean
) {

    /**
     * Summarize a history. An empty history gives all-zero stats.
     */
    public static HistoryStats of(List<Double> history) {
        if (history.isEmpty()) {
            return new HistoryStats(0, 0, 0, 0, 0, 0);
        }
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        double sum = 0;
        for (double value : history) {
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
        }
        return new HistoryStats(
            history.size(),
            history.get(0),
            history.get(history.size() - 1),
            min,
            max,
            sum / history.size()
        );
    }

    /**
     * Change from the first to the last cycle.
     */
    public double drift() {
        return last - first;
    }

    @Override
    public String toString() {
        return String.format("""
            === History Statistics ===
            Cycles:       %,d
            Mean payoff:
              First:      %.4f
              Last:       %.4f (%+.4f)
              Min:        %.4f
              Max:        %.4f
              Average:    %.4f
            """,
            cycles,
            first,
            last, drift(),
            min,
            max,
            mean
        );
    }
}
