package io.github.manjago.axelrod.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Axelrod CLI - evolution of Prisoner's Dilemma automatons.
 *
 * Usage:
 *   axelrod run [options]                  - Run an evolution
 *   axelrod match tit_for_tat all_defect   - Play two presets against each other
 *   axelrod info                           - Show version, config and presets
 */
@Command(
    name = "axelrod",
    description = "Evolution of two-state automatons in the repeated Prisoner's Dilemma",
    mixinStandardHelpOptions = true,
    version = "Axelrod 1.0.0",
    subcommands = {
        RunCommand.class,
        MatchCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class AxelrodCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    /**
     * Command line configured the way {@link #main(String[])} runs it.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new AxelrodCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
