package io.github.manjago.axelrod.core;

/**
 * Payoffs of one round, for the first and the second player.
 */
public record Payoff(int first, int second) {

    /**
     * Same outcome seen from the other player's side.
     */
    public Payoff swap() {
        return new Payoff(second, first);
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
