package io.github.manjago.axelrod.core;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.ListSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;

/**
 * Deterministic random number generator shared by one simulation run.
 *
 * Every random draw of the simulation goes through this class:
 * - automaton generation (uniform bits)
 * - fitness-proportional sampling (uniform doubles)
 * - population shuffling
 *
 * Two instances created with the same seed produce the same sequence,
 * so a run can be replayed from its seed alone.
 *
 * IMPORTANT: Do not change RandomSource between versions!
 * Changing algorithm would break replay determinism.
 */
public final class GameRng {

    /**
     * Fixed algorithm - DO NOT CHANGE for backwards compatibility.
     * XoRoShiRo128++ is fast, high-quality, and has small state (128 bits).
     */
    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long initialSeed;
    private final UniformRandomProvider rng;

    /**
     * Create new RNG with given seed.
     */
    public GameRng(long seed) {
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
    }

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns 0 or 1 with equal probability.
     */
    public int nextBit() {
        return rng.nextBoolean() ? 1 : 0;
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Shuffle list in place (Fisher-Yates).
     */
    public <T> void shuffle(List<T> list) {
        ListSampler.shuffle(rng, list);
    }

    /**
     * Get initial seed (for logging/debugging).
     */
    public long getInitialSeed() {
        return initialSeed;
    }

    @Override
    public String toString() {
        return "GameRng[" + ALGORITHM + ", seed=" + initialSeed + "]";
    }
}
