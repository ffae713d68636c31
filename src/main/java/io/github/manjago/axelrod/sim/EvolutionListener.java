package io.github.manjago.axelrod.sim;

import io.github.manjago.axelrod.core.Population;

/**
 * Listener for evolution events.
 *
 * Implement this interface to observe a run, for example to print
 * progress or collect population snapshots. Listeners only observe:
 * the population they get is immutable and the history is not exposed.
 */
public interface EvolutionListener {

    /**
     * Called after every completed cycle.
     *
     * @param report the cycle's outcome
     * @param next population that enters the next cycle
     */
    default void onCycle(CycleReport report, Population next) {}

    /**
     * Called every report interval.
     *
     * @param report outcome of the latest cycle
     */
    default void onProgress(CycleReport report) {}

    /**
     * No-op listener that does nothing.
     */
    EvolutionListener NOOP = new EvolutionListener() {};
}
