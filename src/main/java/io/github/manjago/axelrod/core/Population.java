package io.github.manjago.axelrod.core;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Fixed-size, immutable sequence of automatons.
 *
 * Size is always even and at least 2: slot 2i plays slot 2i+1.
 * Order carries no meaning beyond that pairing.
 */
public record Population(@NotNull List<Automaton> members) {

    public Population {
        checkSize(members.size());
        members = List.copyOf(members);
    }

    public static Population of(Automaton... members) {
        return new Population(List.of(members));
    }

    /**
     * Population of {@code size} copies of the same automaton.
     */
    public static Population uniform(Automaton automaton, int size) {
        return new Population(Collections.nCopies(size, automaton));
    }

    public int size() {
        return members.size();
    }

    public Automaton get(int index) {
        return members.get(index);
    }

    /**
     * Share of members whose current action is cooperate.
     */
    public double cooperationRate() {
        long cooperators = members.stream()
                .filter(a -> a.currentAction() == Automaton.COOPERATE)
                .count();
        return (double) cooperators / members.size();
    }

    /**
     * @throws InvalidConfigurationException if size is odd or less than 2
     */
    public static void checkSize(int size) {
        if (size < 2 || size % 2 != 0) {
            throw new InvalidConfigurationException(
                    "Population size must be even and >= 2, got " + size);
        }
    }
}
