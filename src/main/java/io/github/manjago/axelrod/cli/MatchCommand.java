package io.github.manjago.axelrod.cli;

import io.github.manjago.axelrod.core.Automaton;
import io.github.manjago.axelrod.core.Game;
import io.github.manjago.axelrod.core.InvalidConfigurationException;
import io.github.manjago.axelrod.core.Payoff;
import io.github.manjago.axelrod.core.Preset;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: match
 *
 * Plays two preset strategies against each other and prints every round.
 *
 * Usage:
 *   axelrod match tit_for_tat all_defect
 *   axelrod match grim_trigger all_cooperate -r 20
 */
@Command(
    name = "match",
    description = "Play a repeated match between two preset strategies",
    mixinStandardHelpOptions = true
)
public class MatchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "First strategy: ${COMPLETION-CANDIDATES}")
    private Preset first;

    @Parameters(index = "1", description = "Second strategy: ${COMPLETION-CANDIDATES}")
    private Preset second;

    @Option(names = {"-r", "--rounds"}, description = "Number of rounds (default: ${DEFAULT-VALUE})")
    private int rounds = 10;

    @Override
    public Integer call() {
        List<Payoff> payoffs;
        try {
            payoffs = Game.matchPair(first.automaton(), second.automaton(), rounds);
        } catch (InvalidConfigurationException e) {
            System.err.println("❌ " + e.getMessage());
            return 1;
        }

        System.out.printf("%s vs %s, %d rounds%n", first, second, rounds);
        System.out.println("─".repeat(40));
        System.out.println("Round  Actions  Payoff");

        // Replay the actions alongside the payoffs for display
        Automaton a = first.automaton();
        Automaton b = second.automaton();
        long totalFirst = 0;
        long totalSecond = 0;
        for (int i = 0; i < payoffs.size(); i++) {
            Payoff p = payoffs.get(i);
            int actionA = a.currentAction();
            int actionB = b.currentAction();
            System.out.printf("%5d  %s  %s     %s%n", i + 1, Automaton.symbol(actionA), Automaton.symbol(actionB), p);
            totalFirst += p.first();
            totalSecond += p.second();
            a = a.step(actionB);
            b = b.step(actionA);
        }

        System.out.println("─".repeat(40));
        System.out.printf("Total: %s %d, %s %d%n", first, totalFirst, second, totalSecond);
        return 0;
    }
}
