package io.github.manjago.axelrod.core;

import org.jetbrains.annotations.NotNull;

/**
 * Classic strategies expressed as two-state automatons.
 * <p>
 * Table notation: (action, target on cooperate, target on defect).
 */
public enum Preset {

    /** Always defects. S0 = S1 = (D, 1, 1), starts in S1. */
    ALL_DEFECT(new State(1, 1, 1), new State(1, 1, 1), 1),

    /** Always cooperates. S0 = S1 = (C, 0, 0), starts in S0. */
    ALL_COOPERATE(new State(0, 0, 0), new State(0, 0, 0), 0),

    /** Copies the opponent's last move. S0 = (C, 0, 1), S1 = (D, 0, 1), starts in S0. */
    TIT_FOR_TAT(new State(0, 0, 1), new State(1, 0, 1), 0),

    /**
     * Cooperates until the opponent defects once, then defects forever.
     * S0 = (C, 0, 1), S1 = (D, 1, 1), starts in S0.
     */
    GRIM_TRIGGER(new State(0, 0, 1), new State(1, 1, 1), 0);

    private final Automaton automaton;

    Preset(State first, State second, int initial) {
        this.automaton = new Automaton(first, second, initial);
    }

    /**
     * The preset's automaton in its initial state.
     */
    public @NotNull Automaton automaton() {
        return automaton;
    }
}
