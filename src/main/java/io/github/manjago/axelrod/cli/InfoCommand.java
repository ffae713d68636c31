package io.github.manjago.axelrod.cli;

import io.github.manjago.axelrod.config.EvolutionConfig;
import io.github.manjago.axelrod.core.Game;
import io.github.manjago.axelrod.core.Preset;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about Axelrod.
 */
@Command(
    name = "info",
    description = "Show version, configuration, payoffs and preset strategies",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║               AXELROD                 ║");
        System.out.println("║   Prisoner's Dilemma Evolution        ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(EvolutionConfig.defaults());

        System.out.println("Payoff matrix (row player, column player):");
        System.out.println("           C        D");
        System.out.printf("  C      %s    %s%n", Game.payoff(0, 0), Game.payoff(0, 1));
        System.out.printf("  D      %s    %s%n", Game.payoff(1, 0), Game.payoff(1, 1));
        System.out.println();

        System.out.println("Preset strategies (action →on C/→on D):");
        for (Preset preset : Preset.values()) {
            System.out.printf("  %-14s %s%n", preset, preset.automaton().describe());
        }
        System.out.println();

        return 0;
    }
}
