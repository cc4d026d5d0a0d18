package com.scenetree.hierarchy;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/** Behaviour every host adapter must show for the search code to be correct. */
public abstract class AbstractHierarchyTCContractTest<N> {

    protected abstract HierarchyTC<N> tc();

    protected abstract N makeNode(String name, boolean active, String... tags);

    protected abstract void attach(N parent, N child);

    /** A tag the host knows about. */
    protected abstract String registeredTag();

    /** A tag the host will refuse. */
    protected abstract String unregisteredTag();

    @Test
    public void children_areInAttachOrder_andPointBackToParent() {
        N parent = makeNode("P", true);
        N first = makeNode("first", true);
        N second = makeNode("second", true);
        attach(parent, first);
        attach(parent, second);

        assertEquals(List.of(first, second), tc().children(parent));
        assertEquals(Optional.of(parent), tc().parent(first));
        assertEquals(Optional.of(parent), tc().parent(second));
    }

    @Test
    public void root_hasNoParent_andLeaf_hasNoChildren() {
        N root = makeNode("root", true);
        assertEquals(Optional.empty(), tc().parent(root));
        assertTrue(tc().children(root).isEmpty());
    }

    @Test
    public void name_and_activeFlag_areReported() {
        assertEquals("On", tc().name(makeNode("On", true)));
        assertTrue(tc().isActive(makeNode("On", true)));
        assertFalse(tc().isActive(makeNode("Off", false)));
    }

    @Test
    public void hasTag_distinguishesTaggedFromUntagged() {
        N tagged = makeNode("T", true, registeredTag());
        N plain = makeNode("U", true);
        assertTrue(tc().hasTag(tagged, registeredTag()));
        assertFalse(tc().hasTag(plain, registeredTag()));
    }

    @Test
    public void hasTag_unregisteredTag_fails() {
        N n = makeNode("T", true, registeredTag());
        assertThrows(RuntimeException.class, () -> tc().hasTag(n, unregisteredTag()));
    }

    @Test
    public void label_isNonEmpty_andStableForSameNode() {
        N n = makeNode("LabelHere", true);
        String lbl1 = tc().label(n);
        String lbl2 = tc().label(n);
        assertNotNull(lbl1);
        assertFalse(lbl1.isBlank());
        assertEquals(lbl1, lbl2);
    }
}
