package io.github.manjago.axelrod.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.axelrod.core.InvalidConfigurationException;
import io.github.manjago.axelrod.sim.Evolution;

import java.nio.file.Path;

/**
 * Configuration for an evolution run.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record EvolutionConfig(
    // Population
    int populationSize,

    // Evolution
    int cycles,
    int speed,                // individuals replaced per cycle
    int rounds,               // rounds per match

    // Randomness
    long seed,                // 0 = derive from clock

    // Reporting
    int reportInterval        // cycles between progress reports
) {

    /**
     * Load default configuration.
     */
    public static EvolutionConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static EvolutionConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static EvolutionConfig fromConfig(Config config) {
        Config c = config.getConfig("axelrod");

        return new EvolutionConfig(
            c.getInt("population.size"),
            c.getInt("evolution.cycles"),
            c.getInt("evolution.speed"),
            c.getInt("evolution.rounds"),
            c.getLong("random.seed"),
            c.getInt("reporting.interval")
        );
    }

    /**
     * Seed to actually use: the configured one, or a clock-derived one if 0.
     */
    public long effectiveSeed() {
        return seed != 0 ? seed : System.nanoTime();
    }

    /**
     * Check the parameters describe a runnable simulation.
     *
     * @return this config
     * @throws InvalidConfigurationException on the first invalid parameter
     */
    public EvolutionConfig validate() {
        Evolution.validate(populationSize, cycles, speed, rounds);
        if (reportInterval < 1) {
            throw new InvalidConfigurationException("Report interval must be >= 1, got " + reportInterval);
        }
        return this;
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with the values of an existing config.
     */
    public static Builder builder(EvolutionConfig base) {
        return new Builder()
                .populationSize(base.populationSize())
                .cycles(base.cycles())
                .speed(base.speed())
                .rounds(base.rounds())
                .seed(base.seed())
                .reportInterval(base.reportInterval());
    }

    public static class Builder {
        private int populationSize = 100;
        private int cycles = 500;
        private int speed = 10;
        private int rounds = 10;
        private long seed = 0;
        private int reportInterval = 50;

        public Builder populationSize(int size) { this.populationSize = size; return this; }
        public Builder cycles(int cycles) { this.cycles = cycles; return this; }
        public Builder speed(int speed) { this.speed = speed; return this; }
        public Builder rounds(int rounds) { this.rounds = rounds; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder reportInterval(int interval) { this.reportInterval = interval; return this; }

        public EvolutionConfig build() {
            return new EvolutionConfig(
                populationSize, cycles, speed, rounds, seed, reportInterval
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            EvolutionConfig:
              population.size:     %,d
              evolution.cycles:    %,d
              evolution.speed:     %d per cycle
              evolution.rounds:    %d per match
              random.seed:         %s
              reporting.interval:  %,d cycles
            """,
            populationSize,
            cycles,
            speed,
            rounds,
            seed == 0 ? "random" : Long.toString(seed),
            reportInterval
        );
    }
}
