package work.envctl.params;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.envctl.template.ParameterConfigurationException;

class ParameterDependenciesTest {
    @Test
    void keepsDeclarationOrderWithoutReferences() {
        var order = ParameterDependencies.order(List.of("c", "a", "b"), Map.of(), Set.of("a", "b", "c"));
        assertEquals(List.of("c", "a", "b"), order);
    }

    @Test
    void placesReferencedParametersFirst() {
        var order = ParameterDependencies.order(
            List.of("location", "size", "name"),
            Map.of("location", List.of("size")),
            Set.of("location", "size", "name")
        );
        assertEquals(List.of("size", "location", "name"), order);
    }

    @Test
    void ignoresReferencesToAlreadyResolvedParameters() {
        var order = ParameterDependencies.order(
            List.of("location"),
            Map.of("location", List.of("size")),
            Set.of("location", "size")
        );
        assertEquals(List.of("location"), order);
    }

    @Test
    void rejectsTwoParameterCycle() {
        var ex = assertThrows(ParameterConfigurationException.class, () -> ParameterDependencies.order(
            List.of("a", "b"),
            Map.of("a", List.of("b"), "b", List.of("a")),
            Set.of("a", "b")
        ));
        assertEquals("Parameter dependency cycle detected: a -> b -> a", ex.getMessage());
    }

    @Test
    void rejectsThreeParameterCycle() {
        var ex = assertThrows(ParameterConfigurationException.class, () -> ParameterDependencies.order(
            List.of("a", "b", "c"),
            Map.of("a", List.of("b"), "b", List.of("c"), "c", List.of("a")),
            Set.of("a", "b", "c")
        ));
        assertTrue(ex.getMessage().contains("a -> b -> c -> a"), ex.getMessage());
    }

    @Test
    void rejectsSelfReference() {
        var ex = assertThrows(ParameterConfigurationException.class, () -> ParameterDependencies.order(
            List.of("a"),
            Map.of("a", List.of("a")),
            Set.of("a")
        ));
        assertEquals("Parameter dependency cycle detected: a -> a", ex.getMessage());
    }

    @Test
    void rejectsUnknownReference() {
        var ex = assertThrows(ParameterConfigurationException.class, () -> ParameterDependencies.order(
            List.of("a"),
            Map.of("a", List.of("missing")),
            Set.of("a")
        ));
        assertEquals("Parameter 'a' references unknown parameter 'missing'", ex.getMessage());
    }
}
