package io.github.manjago.axelrod.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A strategy for the repeated Prisoner's Dilemma: a deterministic automaton
 * with exactly two states.
 *
 * Automatons are values. Reacting to the opponent never changes an instance,
 * {@link #step(int)} returns a new automaton with a different current state.
 * The same instance may therefore sit in several population slots at once.
 */
public record Automaton(@NotNull State first, @NotNull State second, int current) {

    /** Action: cooperate */
    public static final int COOPERATE = 0;

    /** Action: defect */
    public static final int DEFECT = 1;

    public Automaton {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        checkBit(current, "current");
    }

    /**
     * Generate a uniformly random automaton.
     *
     * Makes 8 independent draws over {0,1}: the initial state index,
     * then action, target on cooperate and target on defect for each state.
     */
    public static Automaton random(GameRng rng) {
        int current = rng.nextBit();
        State first = State.random(rng);
        State second = State.random(rng);
        return new Automaton(first, second, current);
    }

    /**
     * State by index (0 or 1).
     */
    @Contract(pure = true)
    public @NotNull State state(int index) {
        return checkBit(index, "index") == 0 ? first : second;
    }

    /**
     * The state the automaton is currently in.
     */
    @Contract(pure = true)
    public @NotNull State currentState() {
        return current == 0 ? first : second;
    }

    /**
     * The action played in the current state.
     */
    @Contract(pure = true)
    public int currentAction() {
        return currentState().action();
    }

    /**
     * React to the opponent's last action.
     *
     * @param opponentAction 0 (cooperate) or 1 (defect)
     * @return automaton with the same states, moved to the transition target
     */
    @Contract(pure = true)
    public @NotNull Automaton step(int opponentAction) {
        int next = currentState().next(opponentAction);
        return next == current ? this : new Automaton(first, second, next);
    }

    /**
     * Compact transition table, e.g. {@code [S0: C →0/→1 | S1: D →0/→1] @0}.
     */
    public String describe() {
        return String.format("[S0: %s | S1: %s] @%d", first, second, current);
    }

    /**
     * "C" for cooperate, "D" for defect.
     */
    public static String symbol(int action) {
        return action == COOPERATE ? "C" : "D";
    }

    static int checkBit(int value, String name) {
        if (value != 0 && value != 1) {
            throw new IllegalArgumentException(name + " must be 0 or 1, got " + value);
        }
        return value;
    }
}
