package com.scenetree.hierarchy;

import com.scenetree.hierarchy.TestHierarchyFixture.Abcd;
import org.junit.jupiter.api.Test;

import static com.scenetree.hierarchy.TestHierarchyFixture.tc;
import static org.junit.jupiter.api.Assertions.*;

class NodePredicatesTest {

    @Test
    void named_isExactAndCaseSensitive() {
        var t = new Abcd();
        assertTrue(NodePredicates.named(tc, "B").test(t.B));
        assertFalse(NodePredicates.named(tc, "b").test(t.B));
        assertFalse(NodePredicates.named(tc, "B ").test(t.B));
    }

    @Test
    void tagged_delegatesToHost() {
        var t = new Abcd();
        assertTrue(NodePredicates.tagged(tc, "Circle").test(t.B));
        assertFalse(NodePredicates.tagged(tc, "Circle").test(t.C));
        assertThrows(UnknownTagException.class, () -> NodePredicates.tagged(tc, "Hexagon").test(t.C));
    }

    @Test
    void active_readsTheFlagAtTestTime() {
        var t = new Abcd();
        var active = NodePredicates.active(tc);
        assertTrue(active.test(t.C));
        t.C.setActive(false);
        assertFalse(active.test(t.C));
    }

    @Test
    void nullArguments_areRejectedUpFront() {
        assertThrows(NullPointerException.class, () -> NodePredicates.named(tc, null));
        assertThrows(NullPointerException.class, () -> NodePredicates.tagged(null, "Circle"));
        assertThrows(NullPointerException.class, () -> NodePredicates.active(null));
    }
}
