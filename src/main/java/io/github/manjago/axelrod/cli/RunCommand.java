package io.github.manjago.axelrod.cli;

import io.github.manjago.axelrod.config.EvolutionConfig;
import io.github.manjago.axelrod.core.DegenerateFitnessException;
import io.github.manjago.axelrod.core.Game;
import io.github.manjago.axelrod.core.GameRng;
import io.github.manjago.axelrod.core.InvalidConfigurationException;
import io.github.manjago.axelrod.core.Population;
import io.github.manjago.axelrod.sim.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Run evolution command.
 *
 * Examples:
 *   axelrod run                           # Run with defaults
 *   axelrod run -c 2000 -s 20             # 2000 cycles, replace 20 per cycle
 *   axelrod run --config my.conf          # Use custom config
 *   axelrod run --seed 42 -o history.csv  # Reproducible run, save history
 */
@Command(
    name = "run",
    description = "Evolve a random population",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-n", "--population"}, description = "Population size (even)")
    private Integer populationSize;

    @Option(names = {"-c", "--cycles"}, description = "Number of cycles")
    private Integer cycles;

    @Option(names = {"-s", "--speed"}, description = "Individuals replaced per cycle")
    private Integer speed;

    @Option(names = {"-r", "--rounds"}, description = "Rounds per match")
    private Integer rounds;

    @Option(names = {"--seed"}, description = "Random seed (0 = random)")
    private Long seed;

    @Option(names = {"-o", "--output"}, description = "CSV file for the mean-payoff history")
    private Path outputFile;

    @Option(names = {"--report-interval"}, description = "Progress report interval (cycles)")
    private Integer reportInterval;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;

    @Override
    public Integer call() {
        EvolutionConfig config;
        try {
            config = buildConfig().validate();
        } catch (InvalidConfigurationException e) {
            System.err.println("❌ Invalid configuration: " + e.getMessage());
            return 1;
        }

        if (!quiet) {
            printBanner();
            System.out.println(config);
        }

        long actualSeed = config.effectiveSeed();
        GameRng rng = new GameRng(actualSeed);
        Evolution evolution = new Evolution(rng, config.reportInterval());
        if (!quiet) {
            evolution.setListener(new ConsoleProgressListener());
        }

        Population population = evolution.generatePopulation(config.populationSize());
        if (!quiet) {
            System.out.printf("🌱 Generated %,d random automatons (seed: %d)%n", population.size(), actualSeed);
            System.out.println("▶️  Evolving...\n");
        }

        long startTime = System.currentTimeMillis();
        List<Double> history;
        try {
            history = evolution.evolve(population, config.cycles(), config.speed(), config.rounds());
        } catch (DegenerateFitnessException e) {
            System.err.println("\n❌ Run aborted: " + e.getMessage());
            return 1;
        }
        long elapsed = System.currentTimeMillis() - startTime;

        if (outputFile != null) {
            try {
                writeCsv(history, outputFile);
            } catch (IOException e) {
                log.error("Failed to write history to {}", outputFile, e);
                System.err.println("❌ Cannot write " + outputFile + ": " + e.getMessage());
                return 1;
            }
        }

        if (!quiet) {
            printFinalReport(HistoryStats.of(history), elapsed);
        }

        return 0;
    }

    private EvolutionConfig buildConfig() {
        EvolutionConfig.Builder builder = configFile != null
                ? EvolutionConfig.builder(EvolutionConfig.fromFile(configFile))
                : EvolutionConfig.builder(EvolutionConfig.defaults());

        // Override from CLI options
        if (populationSize != null) builder.populationSize(populationSize);
        if (cycles != null) builder.cycles(cycles);
        if (speed != null) builder.speed(speed);
        if (rounds != null) builder.rounds(rounds);
        if (seed != null) builder.seed(seed);
        if (reportInterval != null) builder.reportInterval(reportInterval);

        return builder.build();
    }

    /**
     * Write history as {@code cycle,mean_payoff} lines, cycles numbered from 1.
     */
    static void writeCsv(List<Double> history, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("cycle,mean_payoff");
            out.newLine();
            for (int i = 0; i < history.size(); i++) {
                out.write(String.format(Locale.ROOT, "%d,%.6f", i + 1, history.get(i)));
                out.newLine();
            }
        }
        log.info("History written to {} ({} cycles)", file, history.size());
    }

    private void printBanner() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║               AXELROD                 ║");
        System.out.println("║   Prisoner's Dilemma Evolution        ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
    }

    private void printFinalReport(HistoryStats stats, long elapsedMs) {
        System.out.println();
        System.out.println("═══════════════════════════════════════");
        System.out.println("          EVOLUTION COMPLETE           ");
        System.out.println("═══════════════════════════════════════");
        System.out.println();
        System.out.printf("⏱️  Time: %,d ms%n", elapsedMs);
        System.out.println();
        System.out.print(stats);
        System.out.printf("(mutual cooperation = %d, mutual defection = %d)%n", Game.REWARD, Game.PUNISHMENT);
        if (outputFile != null) {
            System.out.println("💾 History saved to " + outputFile);
        }
        System.out.println("═══════════════════════════════════════");
    }

    /**
     * Console progress listener with live updates.
     */
    private static class ConsoleProgressListener implements EvolutionListener {
        private static final String[] SPINNER = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};
        private int spinnerIdx = 0;

        @Override
        public void onProgress(CycleReport report) {
            String spinner = SPINNER[spinnerIdx++ % SPINNER.length];

            // Compact one-line progress
            System.out.printf("\r%s Cycle %,d/%,d (%3.0f%%)  |  💰 %.3f mean payoff  |  🤝 %.1f%% cooperating   ",
                    spinner,
                    report.cycle() + 1,
                    report.totalCycles(),
                    report.progress() * 100,
                    report.meanPayoff(),
                    report.cooperationRate() * 100);
            System.out.flush();
        }
    }
}
