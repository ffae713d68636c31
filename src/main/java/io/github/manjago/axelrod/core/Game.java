package io.github.manjago.axelrod.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * The repeated Prisoner's Dilemma.
 *
 * Payoff matrix (row = first player, column = second player):
 * <pre>
 *              C        D
 *   C        (3,3)    (0,4)
 *   D        (4,0)    (1,1)
 * </pre>
 */
public final class Game {

    /** Both cooperate */
    public static final int REWARD = 3;

    /** Defect against a cooperator */
    public static final int TEMPTATION = 4;

    /** Cooperate against a defector */
    public static final int SUCKER = 0;

    /** Both defect */
    public static final int PUNISHMENT = 1;

    // Indexed [first action][second action]
    private static final Payoff[][] MATRIX = {
        { new Payoff(REWARD, REWARD),     new Payoff(SUCKER, TEMPTATION) },
        { new Payoff(TEMPTATION, SUCKER), new Payoff(PUNISHMENT, PUNISHMENT) }
    };

    private Game() {}

    /**
     * Payoffs for one round.
     *
     * @param first action of the first player (0 or 1)
     * @param second action of the second player (0 or 1)
     */
    @Contract(pure = true)
    public static @NotNull Payoff payoff(int first, int second) {
        return MATRIX[Automaton.checkBit(first, "first")][Automaton.checkBit(second, "second")];
    }

    /**
     * Play a repeated match between two automatons.
     *
     * Each round both players act from their current state, get scored,
     * and then each one steps on the action the other just played.
     * The arguments are not changed; the match works on its own copies.
     *
     * @param first first player
     * @param second second player
     * @param rounds number of rounds (>= 1)
     * @return payoff of every round, in order
     * @throws InvalidConfigurationException if rounds < 1
     */
    public static List<Payoff> matchPair(Automaton first, Automaton second, int rounds) {
        checkRounds(rounds);

        List<Payoff> result = new ArrayList<>(rounds);
        Automaton a = first;
        Automaton b = second;
        for (int round = 0; round < rounds; round++) {
            int actionA = a.currentAction();
            int actionB = b.currentAction();
            result.add(payoff(actionA, actionB));
            a = a.step(actionB);
            b = b.step(actionA);
        }
        return result;
    }

    /**
     * Play every consecutive pair of the population (slot 2i against 2i+1)
     * and total each player's payoff over the match.
     *
     * @param members population members (even count)
     * @param rounds rounds per match (>= 1)
     * @return total payoff per slot, in the same order as {@code members}
     * @throws InvalidConfigurationException on odd size or rounds < 1,
     *         before any match is played
     */
    public static long[] matchPopulation(List<Automaton> members, int rounds) {
        if (members.size() % 2 != 0) {
            throw new InvalidConfigurationException(
                    "Cannot pair an odd number of automatons: " + members.size());
        }
        checkRounds(rounds);

        long[] totals = new long[members.size()];
        for (int i = 0; i < members.size(); i += 2) {
            for (Payoff p : matchPair(members.get(i), members.get(i + 1), rounds)) {
                totals[i] += p.first();
                totals[i + 1] += p.second();
            }
        }
        return totals;
    }

    /**
     * @see #matchPopulation(List, int)
     */
    public static long[] matchPopulation(Population population, int rounds) {
        return matchPopulation(population.members(), rounds);
    }

    static void checkRounds(int rounds) {
        if (rounds < 1) {
            throw new InvalidConfigurationException("Rounds per match must be >= 1, got " + rounds);
        }
    }
}
