package io.github.manjago.axelrod.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.manjago.axelrod.core.Preset.*;
import static org.junit.jupiter.api.Assertions.*;

class PopulationTest {

    @Test
    @DisplayName("Odd or too small sizes are invalid")
    void invalidSizes() {
        assertThrows(InvalidConfigurationException.class, () -> Population.of());
        assertThrows(InvalidConfigurationException.class, () -> Population.of(ALL_DEFECT.automaton()));
        assertThrows(InvalidConfigurationException.class,
                () -> Population.uniform(ALL_DEFECT.automaton(), 5));
    }

    @Test
    @DisplayName("Members are an immutable copy")
    void immutableCopy() {
        List<Automaton> source = new ArrayList<>(List.of(ALL_DEFECT.automaton(), ALL_COOPERATE.automaton()));
        Population population = new Population(source);

        source.add(TIT_FOR_TAT.automaton());

        assertEquals(2, population.size());
        assertThrows(UnsupportedOperationException.class,
                () -> population.members().add(GRIM_TRIGGER.automaton()));
    }

    @Test
    @DisplayName("Cooperation rate counts current actions")
    void cooperationRate() {
        Population population = Population.of(
                ALL_DEFECT.automaton(), ALL_COOPERATE.automaton(),
                TIT_FOR_TAT.automaton(), TIT_FOR_TAT.automaton().step(Automaton.DEFECT));

        assertEquals(0.5, population.cooperationRate(), 1e-12);
        assertEquals(1.0, Population.uniform(GRIM_TRIGGER.automaton(), 4).cooperationRate(), 1e-12);
    }
}
