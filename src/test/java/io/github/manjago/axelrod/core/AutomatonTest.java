package io.github.manjago.axelrod.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static io.github.manjago.axelrod.core.Automaton.COOPERATE;
import static io.github.manjago.axelrod.core.Automaton.DEFECT;
import static org.junit.jupiter.api.Assertions.*;

class AutomatonTest {

    // S0 cooperates and stays on C, moves to S1 on D; S1 defects and always returns to S0
    private static final Automaton SAMPLE = new Automaton(
            new State(COOPERATE, 0, 1),
            new State(DEFECT, 0, 0),
            0);

    // ========== State ==========

    @Nested
    @DisplayName("State")
    class StateTests {

        @Test
        @DisplayName("next picks target by opponent action")
        void nextPicksTarget() {
            State state = new State(DEFECT, 1, 0);

            assertEquals(1, state.next(COOPERATE));
            assertEquals(0, state.next(DEFECT));
        }

        @Test
        @DisplayName("Values outside {0,1} are rejected")
        void rejectsInvalidValues() {
            assertThrows(IllegalArgumentException.class, () -> new State(2, 0, 0));
            assertThrows(IllegalArgumentException.class, () -> new State(0, -1, 0));
            assertThrows(IllegalArgumentException.class, () -> new State(0, 0, 5));
        }

        @Test
        @DisplayName("next rejects invalid opponent action")
        void nextRejectsInvalidAction() {
            State state = new State(COOPERATE, 0, 1);
            assertThrows(IllegalArgumentException.class, () -> state.next(2));
        }
    }

    // ========== Transitions ==========

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("currentAction is the action of the current state")
        void currentActionFollowsState() {
            assertEquals(COOPERATE, SAMPLE.currentAction());
            assertEquals(DEFECT, new Automaton(SAMPLE.first(), SAMPLE.second(), 1).currentAction());
        }

        @Test
        @DisplayName("step moves to the transition target")
        void stepMovesToTarget() {
            Automaton afterDefect = SAMPLE.step(DEFECT);

            assertEquals(1, afterDefect.current());
            assertEquals(DEFECT, afterDefect.currentAction());

            Automaton back = afterDefect.step(DEFECT);
            assertEquals(0, back.current());
        }

        @Test
        @DisplayName("step keeps the states and leaves the original untouched")
        void stepIsPure() {
            Automaton next = SAMPLE.step(DEFECT);

            assertSame(SAMPLE.first(), next.first());
            assertSame(SAMPLE.second(), next.second());
            assertEquals(0, SAMPLE.current());
            assertNotEquals(SAMPLE, next);
        }

        @Test
        @DisplayName("step to the same state gives an equal automaton")
        void stepToSameState() {
            assertEquals(SAMPLE, SAMPLE.step(COOPERATE));
        }

        @Test
        @DisplayName("step rejects invalid opponent action")
        void stepRejectsInvalidAction() {
            assertThrows(IllegalArgumentException.class, () -> SAMPLE.step(-1));
        }

        @Test
        @DisplayName("Invalid current index is rejected at construction")
        void rejectsInvalidCurrent() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Automaton(SAMPLE.first(), SAMPLE.second(), 2));
        }

        @Test
        @DisplayName("state(index) gives direct access to both states")
        void stateByIndex() {
            assertSame(SAMPLE.first(), SAMPLE.state(0));
            assertSame(SAMPLE.second(), SAMPLE.state(1));
        }
    }

    // ========== Random generation ==========

    @Nested
    @DisplayName("Random generation")
    class RandomGeneration {

        @Test
        @DisplayName("Same seed gives the same automatons")
        void sameSeedSameAutomatons() {
            GameRng a = new GameRng(7);
            GameRng b = new GameRng(7);

            for (int i = 0; i < 100; i++) {
                assertEquals(Automaton.random(a), Automaton.random(b));
            }
        }

        @Test
        @DisplayName("All 256 automatons are reachable")
        void coversWholeSpace() {
            GameRng rng = new GameRng(123);
            Set<Automaton> seen = new HashSet<>();

            for (int i = 0; i < 20_000; i++) {
                seen.add(Automaton.random(rng));
            }

            // 2 initial states x (2 x 2 x 2)^2 state tables
            assertEquals(256, seen.size());
        }
    }

    @Test
    @DisplayName("describe shows both states and the current index")
    void describeShowsTable() {
        assertEquals("[S0: C →0/→1 | S1: D →0/→0] @0", SAMPLE.describe());
    }
}
