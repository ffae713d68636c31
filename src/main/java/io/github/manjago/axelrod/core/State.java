package io.github.manjago.axelrod.core;

import org.jetbrains.annotations.Contract;

/**
 * One state of a two-state strategy automaton.
 *
 * Encoding (all values are 0 or 1):
 * - action:      what the automaton plays while in this state (0 = cooperate, 1 = defect)
 * - onCooperate: state to move to after the opponent cooperated
 * - onDefect:    state to move to after the opponent defected
 */
public record State(int action, int onCooperate, int onDefect) {

    public State {
        Automaton.checkBit(action, "action");
        Automaton.checkBit(onCooperate, "onCooperate");
        Automaton.checkBit(onDefect, "onDefect");
    }

    /**
     * Target state for the opponent's last action.
     */
    @Contract(pure = true)
    public int next(int opponentAction) {
        return Automaton.checkBit(opponentAction, "opponentAction") == Automaton.COOPERATE
                ? onCooperate
                : onDefect;
    }

    /**
     * Random state: action, then target on cooperate, then target on defect.
     */
    public static State random(GameRng rng) {
        int action = rng.nextBit();
        int onCooperate = rng.nextBit();
        int onDefect = rng.nextBit();
        return new State(action, onCooperate, onDefect);
    }

    @Override
    public String toString() {
        return String.format("%s →%d/→%d", Automaton.symbol(action), onCooperate, onDefect);
    }
}
