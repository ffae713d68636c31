package io.github.manjago.axelrod.core;

/**
 * Simulation parameters that cannot describe a valid run:
 * odd or too small population, speed outside (0, populationSize),
 * non-positive rounds or negative cycles.
 *
 * Always raised before any simulation work is done.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
