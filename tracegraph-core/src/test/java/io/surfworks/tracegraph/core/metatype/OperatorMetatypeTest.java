package io.surfworks.tracegraph.core.metatype;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.tracegraph.core.attributes.GenericLayerAttributes;
import io.surfworks.tracegraph.core.attributes.LayerAttributes;

@DisplayName("OperatorMetatype")
class OperatorMetatypeTest {

    private static final LayerAttributes MODE_A = new GenericLayerAttributes(Map.of("mode", "a"));
    private static final LayerAttributes MODE_B = new GenericLayerAttributes(Map.of("mode", "b"));

    private static SubtypeMatcher modeIs(String mode) {
        return SubtypeMatcher.custom("mode " + mode, (attrs, ctx) ->
                attrs instanceof GenericLayerAttributes g && mode.equals(g.get("mode")));
    }

    @Nested
    @DisplayName("determineSubtype")
    class DetermineSubtype {

        @Test
        @DisplayName("root without subtypes resolves to empty")
        void rootWithoutSubtypesResolvesToEmpty() {
            OperatorMetatype root = OperatorMetatype.builder("relu", "ReluOp").torch("relu").build();

            assertTrue(root.determineSubtype(MODE_A, CallContext.MODULE_CALL).isEmpty());
        }

        @Test
        @DisplayName("no matching subtype resolves to empty")
        void noMatchingSubtypeResolvesToEmpty() {
            OperatorMetatype sub = OperatorMetatype.builder("op_a", "Op").matcher(modeIs("a")).build();
            OperatorMetatype root = OperatorMetatype.builder("op", "Op").subtypes(sub).build();

            assertTrue(root.determineSubtype(MODE_B, CallContext.FREE_FUNCTION).isEmpty());
        }

        @Test
        @DisplayName("returns deepest match")
        void returnsDeepestMatch() {
            OperatorMetatype leaf = OperatorMetatype.builder("op_module_a", "Op").matcher(modeIs("a")).build();
            OperatorMetatype middle = OperatorMetatype.builder("op_module", "Op")
                    .matcher(SubtypeMatcher.MODULE_CALL).subtypes(leaf).build();
            OperatorMetatype root = OperatorMetatype.builder("op", "Op").subtypes(middle).build();

            assertEquals(leaf, root.determineSubtype(MODE_A, CallContext.MODULE_CALL).orElseThrow());
            assertEquals(middle, root.determineSubtype(MODE_B, CallContext.MODULE_CALL).orElseThrow());
            assertTrue(root.determineSubtype(MODE_A, CallContext.FREE_FUNCTION).isEmpty());
        }

        @Test
        @DisplayName("overlapping siblings are ambiguous")
        void overlappingSiblingsAreAmbiguous() {
            OperatorMetatype first = OperatorMetatype.builder("op_first", "Op")
                    .matcher(SubtypeMatcher.MODULE_CALL).build();
            OperatorMetatype second = OperatorMetatype.builder("op_second", "Op").matcher(modeIs("a")).build();
            OperatorMetatype root = OperatorMetatype.builder("op", "Op").subtypes(first, second).build();

            AmbiguousSubtypeException e = assertThrows(AmbiguousSubtypeException.class,
                    () -> root.determineSubtype(MODE_A, CallContext.MODULE_CALL));
            assertEquals(root, e.getParent());
            assertEquals(List.of(first, second), e.getMatches());

            // Only one sibling matches here
            assertEquals(second, root.determineSubtype(MODE_A, CallContext.FREE_FUNCTION).orElseThrow());
        }

        @Test
        @DisplayName("matchers tolerate missing inputs")
        void matchersTolerateMissingInputs() {
            OperatorMetatype sub = OperatorMetatype.builder("op_module", "Op")
                    .matcher(SubtypeMatcher.MODULE_CALL).build();
            OperatorMetatype depthwise = OperatorMetatype.builder("op_dw", "Op")
                    .matcher(SubtypeMatcher.DEPTHWISE_CONVOLUTION).build();
            OperatorMetatype root = OperatorMetatype.builder("op", "Op").subtypes(sub, depthwise).build();

            assertTrue(root.determineSubtype(null, null).isEmpty());
        }
    }

    @Nested
    @DisplayName("declaration")
    class Declaration {

        @Test
        @DisplayName("subtype without matcher is rejected")
        void subtypeWithoutMatcherIsRejected() {
            OperatorMetatype plain = OperatorMetatype.builder("plain", "Op").build();

            assertThrows(IllegalArgumentException.class,
                    () -> OperatorMetatype.builder("op", "Op").subtypes(plain));
        }

        @Test
        @DisplayName("blank id is rejected")
        void blankIdIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> OperatorMetatype.builder(" ", "Op"));
        }

        @Test
        @DisplayName("aliases span namespaces")
        void aliasesSpanNamespaces() {
            OperatorMetatype add = OperatorMetatype.builder("add", "AddOp")
                    .tensorMethods("add", "__add__")
                    .torch("add")
                    .build();

            assertEquals(List.of("add", "__add__"), List.copyOf(add.aliases()));
            assertEquals(List.of("add"), add.functionNames().get(NamespaceTarget.TORCH));
        }

        @Test
        @DisplayName("subtree and contains")
        void subtreeAndContains() {
            OperatorMetatype leaf = OperatorMetatype.builder("leaf", "Op").matcher(modeIs("a")).build();
            OperatorMetatype middle = OperatorMetatype.builder("middle", "Op")
                    .matcher(SubtypeMatcher.MODULE_CALL).subtypes(leaf).build();
            OperatorMetatype root = OperatorMetatype.builder("root", "Op").subtypes(middle).build();

            assertEquals(List.of(root, middle, leaf), root.subtree());
            assertTrue(root.contains(leaf));
            assertTrue(root.contains(root));
            assertFalse(leaf.contains(root));
        }

        @Test
        @DisplayName("equality is by id")
        void equalityIsById() {
            OperatorMetatype a = OperatorMetatype.builder("same", "A").build();
            OperatorMetatype b = OperatorMetatype.builder("same", "B").torch("b").build();

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertEquals("same", a.toString());
        }
    }
}
