package org.xspec.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

class SpecTreeBuilderTest {
    private static final Executable NOTHING = () -> {
    };

    @Test
    void attachesAssertionUnderWhenAndChainedAssertionAsSibling() {
        SpecNode given = SpecTreeBuilder.root("a counter", NOTHING);
        SpecNode when = SpecTreeBuilder.attach(given, "it is incremented", NOTHING, NodeKind.WHEN);
        SpecNode first = SpecTreeBuilder.attach(when, "is one", NOTHING, NodeKind.IT);
        SpecNode second = SpecTreeBuilder.attach(first, "is positive", NOTHING, NodeKind.IT);

        assertSame(given, when.parent().orElseThrow());
        assertSame(when, first.parent().orElseThrow());
        assertSame(when, second.parent().orElseThrow());
        assertEquals(List.of(first, second), when.children());
        assertTrue(first.children().isEmpty());
    }

    @Test
    void attachesWhenCalledOnAssertionBeneathNearestGiven() {
        SpecNode given = SpecTreeBuilder.root("a counter", NOTHING);
        SpecNode firstWhen = SpecTreeBuilder.attach(given, "incremented", NOTHING, NodeKind.WHEN);
        SpecNode assertion = SpecTreeBuilder.attach(firstWhen, "is one", NOTHING, NodeKind.IT);
        SpecNode secondWhen = SpecTreeBuilder.attach(assertion, "incremented again", NOTHING, NodeKind.WHEN);

        assertSame(given, secondWhen.parent().orElseThrow());
        assertEquals(List.of(firstWhen, secondWhen), given.children());
    }

    @Test
    void nestsWhenCalledOnWhenBeneathGivenAsSibling() {
        SpecNode given = SpecTreeBuilder.root("a counter", NOTHING);
        SpecNode first = SpecTreeBuilder.attach(given, "incremented", NOTHING, NodeKind.WHEN);
        SpecNode second = SpecTreeBuilder.attach(first, "decremented", NOTHING, NodeKind.WHEN);

        assertSame(given, second.parent().orElseThrow());
    }

    @Test
    void placesExceptionAssertionsAsPeersOfItNodesAndSwallowsOnParent() {
        SpecNode given = SpecTreeBuilder.root("a divisor of zero", NOTHING);
        SpecNode when = SpecTreeBuilder.attach(given, "dividing", NOTHING, NodeKind.WHEN);
        assertFalse(when.swallowsExceptions());

        SpecNode throwsCheck = SpecTreeBuilder.attachExceptionCheck(when, "should throw", NodeKind.IT, step -> NOTHING);
        SpecNode detail = SpecTreeBuilder.attachExceptionCheck(
            throwsCheck,
            "mentions zero",
            NodeKind.THE_EXCEPTION,
            step -> NOTHING
        );

        assertTrue(when.swallowsExceptions());
        assertFalse(given.swallowsExceptions());
        assertSame(when, detail.parent().orElseThrow());
        assertEquals(NodeKind.THE_EXCEPTION, detail.kind());
        assertEquals(List.of(throwsCheck, detail), when.children());
    }

    @Test
    void exceptionCheckHandsTheLocatedParentToTheActionFactory() {
        SpecNode given = SpecTreeBuilder.root("a divisor of zero", NOTHING);
        SpecNode when = SpecTreeBuilder.attach(given, "dividing", NOTHING, NodeKind.WHEN);
        SpecNode assertion = SpecTreeBuilder.attach(when, "is attempted", NOTHING, NodeKind.IT);
        SpecNode[] seen = new SpecNode[1];

        SpecTreeBuilder.attachExceptionCheck(assertion, "should throw", NodeKind.IT, step -> {
            seen[0] = step;
            return NOTHING;
        });

        assertSame(when, seen[0]);
    }

    @Test
    void rejectsEmptyDescriptionAndMissingActionWithoutTouchingTree() {
        SpecNode given = SpecTreeBuilder.root("a counter", NOTHING);

        IllegalArgumentException empty = assertThrows(
            IllegalArgumentException.class,
            () -> SpecTreeBuilder.attach(given, "", NOTHING, NodeKind.WHEN)
        );
        IllegalArgumentException missing = assertThrows(
            IllegalArgumentException.class,
            () -> SpecTreeBuilder.attach(given, "incremented", null, NodeKind.IT)
        );
        IllegalArgumentException missingDescription = assertThrows(
            IllegalArgumentException.class,
            () -> SpecTreeBuilder.attachExceptionCheck(given, null, NodeKind.IT, step -> NOTHING)
        );

        assertEquals("description must not be empty", empty.getMessage());
        assertEquals("action must not be null", missing.getMessage());
        assertTrue(missingDescription.getMessage().contains("description"));
        assertTrue(given.children().isEmpty());
        assertFalse(given.swallowsExceptions());
    }

    @Test
    void keepsDescriptionTextAsWritten() {
        SpecNode given = SpecTreeBuilder.root("  a padded counter ", NOTHING);
        SpecNode when = SpecTreeBuilder.attach(given, " ", NOTHING, NodeKind.WHEN);

        assertEquals("  a padded counter ", given.description());
        assertEquals("Given   a padded counter ", given.toString());
        assertEquals(" ", when.description());
        assertSame(given, when.parent().orElseThrow());
    }

    @Test
    void rejectsInvalidRoot() {
        assertThrows(IllegalArgumentException.class, () -> SpecTreeBuilder.root("", NOTHING));
        IllegalArgumentException missing = assertThrows(
            IllegalArgumentException.class,
            () -> SpecTreeBuilder.root("a counter", null)
        );
        assertTrue(missing.getMessage().contains("action"));
    }

    @Test
    void kindOrderDrivesNestingAndScenarioEnds() {
        assertTrue(NodeKind.WHEN.canNestUnder(NodeKind.GIVEN));
        assertTrue(NodeKind.IT.canNestUnder(NodeKind.WHEN));
        assertFalse(NodeKind.IT.canNestUnder(NodeKind.IT));
        assertFalse(NodeKind.WHEN.canNestUnder(NodeKind.WHEN));
        assertTrue(NodeKind.THE_EXCEPTION.endsScenario());
        assertFalse(NodeKind.WHEN.endsScenario());
        assertTrue(NodeKind.GIVEN.isFixtureStep());
        assertFalse(NodeKind.IT.isFixtureStep());
        assertEquals("The exception", NodeKind.THE_EXCEPTION.label());
    }
}
