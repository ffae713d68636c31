package io.github.manjago.axelrod.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.manjago.axelrod.core.Preset.*;
import static org.junit.jupiter.api.Assertions.*;

class FitnessSelectorTest {

    private static final double EPS = 1e-12;

    private FitnessSelector selector;

    @BeforeEach
    void setUp() {
        selector = new FitnessSelector(new GameRng(42));
    }

    // ========== Distribution ==========

    @Nested
    @DisplayName("Distribution")
    class Distribution {

        @Test
        @DisplayName("Cumulative shares of [1,3,5,2,9]")
        void cumulativeShares() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {1, 3, 5, 2, 9});

            assertArrayEquals(new double[] {0, 0.05, 0.2, 0.45, 0.55, 1.0}, cum, EPS);
        }

        @Test
        @DisplayName("Starts at exactly 0 and ends at exactly 1")
        void exactEnds() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {1, 1, 1, 1, 1, 1, 1});

            assertEquals(8, cum.length);
            assertEquals(0.0, cum[0]);
            assertEquals(1.0, cum[7]);
        }

        @Test
        @DisplayName("Entries are non-decreasing, flat over zero payoffs")
        void nonDecreasing() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {0, 4, 0, 0, 4});

            for (int i = 1; i < cum.length; i++) {
                assertTrue(cum[i] >= cum[i - 1]);
            }
            assertEquals(0.0, cum[1]);
            assertEquals(cum[2], cum[3]);
            assertEquals(cum[3], cum[4]);
        }

        @Test
        @DisplayName("All-zero payoffs are degenerate")
        void allZeroDegenerate() {
            DegenerateFitnessException e = assertThrows(DegenerateFitnessException.class,
                    () -> FitnessSelector.computeDistribution(new long[] {0, 0, 0, 0}));

            assertEquals(-1, e.getCycle());
        }

        @Test
        @DisplayName("Negative payoff is rejected")
        void negativeRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> FitnessSelector.computeDistribution(new long[] {3, -1}));
        }
    }

    // ========== Search ==========

    @Nested
    @DisplayName("Search")
    class Search {

        private final double[] cum = {0, 0.05, 0.2, 0.45, 0.55, 1.0};

        @Test
        @DisplayName("Finds smallest index strictly above r")
        void smallestIndexAbove() {
            assertEquals(1, FitnessSelector.firstAbove(cum, 0.0));
            assertEquals(1, FitnessSelector.firstAbove(cum, 0.049));
            assertEquals(2, FitnessSelector.firstAbove(cum, 0.05));
            assertEquals(4, FitnessSelector.firstAbove(cum, 0.5));
            assertEquals(5, FitnessSelector.firstAbove(cum, 0.55));
            assertEquals(5, FitnessSelector.firstAbove(cum, 0.9999));
        }

        @Test
        @DisplayName("Skips leading zero-fitness slots")
        void skipsZeroFitness() {
            double[] withZeros = FitnessSelector.computeDistribution(new long[] {0, 0, 5});

            assertEquals(3, FitnessSelector.firstAbove(withZeros, 0.0));
        }
    }

    // ========== Sampling ==========

    @Nested
    @DisplayName("Sampling")
    class Sampling {

        private final List<Automaton> population = List.of(
                ALL_DEFECT.automaton(), ALL_COOPERATE.automaton(),
                TIT_FOR_TAT.automaton(), GRIM_TRIGGER.automaton());

        @Test
        @DisplayName("Returns exactly count individuals")
        void returnsCount() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {1, 1, 1, 1});

            assertEquals(7, selector.sample(cum, population, 7).size());
            assertTrue(selector.sample(cum, population, 0).isEmpty());
        }

        @Test
        @DisplayName("Zero-fitness individuals are never drawn")
        void zeroFitnessNeverDrawn() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {0, 2, 0, 0});

            List<Automaton> drawn = selector.sample(cum, population, 500);

            drawn.forEach(a -> assertEquals(ALL_COOPERATE.automaton(), a));
        }

        @Test
        @DisplayName("Draw frequencies follow fitness shares")
        void frequenciesFollowShares() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {1, 0, 3, 0});

            List<Automaton> drawn = selector.sample(cum, population, 20_000);

            long titForTat = drawn.stream().filter(a -> a.equals(TIT_FOR_TAT.automaton())).count();
            long allDefect = drawn.stream().filter(a -> a.equals(ALL_DEFECT.automaton())).count();
            assertEquals(20_000, titForTat + allDefect);
            assertEquals(0.75, titForTat / 20_000.0, 0.02);
        }

        @Test
        @DisplayName("Same seed draws the same individuals")
        void deterministic() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {1, 2, 3, 4});

            List<Automaton> first = new FitnessSelector(new GameRng(9)).sample(cum, population, 50);
            List<Automaton> second = new FitnessSelector(new GameRng(9)).sample(cum, population, 50);

            assertEquals(first, second);
        }

        @Test
        @DisplayName("Distribution length must match population")
        void lengthMismatch() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {1, 1});

            assertThrows(IllegalArgumentException.class, () -> selector.sample(cum, population, 1));
        }

        @Test
        @DisplayName("Negative count is rejected")
        void negativeCount() {
            double[] cum = FitnessSelector.computeDistribution(new long[] {1, 1, 1, 1});

            assertThrows(IllegalArgumentException.class, () -> selector.sample(cum, population, -1));
        }
    }
}
