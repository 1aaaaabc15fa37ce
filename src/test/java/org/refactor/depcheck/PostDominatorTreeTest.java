package org.refactor.depcheck;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PostDominatorTreeTest {

    /**
     *        Exit
     *         |
     *       Merge
     *     /   |   \
     *    A    B   Entry
     */
    private static PostDominatorTree<String> diamondTree() {
        return PostDominatorTree.<String>builder()
                .parent("Entry", "Merge")
                .parent("A", "Merge")
                .parent("B", "Merge")
                .parent("Merge", "Exit")
                .root("Exit")
                .build();
    }

    @Test
    void properPostDominanceFollowsAncestry() {
        PostDominatorTree<String> t = diamondTree();
        assertTrue(t.properlyPostDominates("Merge", "A"));
        assertTrue(t.properlyPostDominates("Exit", "A"));
        assertFalse(t.properlyPostDominates("A", "Merge"));
        assertFalse(t.properlyPostDominates("A", "B"));
        assertFalse(t.properlyPostDominates("A", "A"));
    }

    @Test
    void leastCommonAncestor() {
        PostDominatorTree<String> t = diamondTree();
        assertEquals(Optional.of("Merge"), t.leastCommonAncestor("A", "B"));
        assertEquals(Optional.of("Merge"), t.leastCommonAncestor("Entry", "Merge"));
        assertEquals(Optional.of("A"), t.leastCommonAncestor("A", "A"));
        assertEquals(Optional.of("Exit"), t.leastCommonAncestor("Exit", "B"));
    }

    @Test
    void rootHasNoImmediateDominator() {
        PostDominatorTree<String> t = diamondTree();
        assertEquals(Optional.empty(), t.immediateDominator("Exit"));
        assertEquals(Optional.of("Exit"), t.immediateDominator("Merge"));
        assertEquals(0, t.depth("Exit"));
        assertEquals(2, t.depth("Entry"));
        assertEquals(List.of("Exit"), t.roots());
    }

    @Test
    void nodesInDifferentTreesHaveNoCommonAncestor() {
        PostDominatorTree<String> t = PostDominatorTree.<String>builder()
                .root("Exit1")
                .root("Exit2")
                .parent("A", "Exit1")
                .parent("B", "Exit2")
                .build();
        assertEquals(Optional.empty(), t.leastCommonAncestor("A", "B"));
        assertEquals(Optional.empty(), t.leastCommonAncestor("Exit1", "Exit2"));
        assertFalse(t.properlyPostDominates("Exit1", "B"));
        assertEquals(List.of("Exit1", "Exit2"), t.roots());
    }

    @Test
    void unknownNodeIsRejected() {
        PostDominatorTree<String> t = diamondTree();
        assertThrows(IllegalArgumentException.class, () -> t.immediateDominator("Nowhere"));
        assertThrows(IllegalArgumentException.class, () -> t.leastCommonAncestor("A", "Nowhere"));
        assertThrows(IllegalArgumentException.class, () -> t.properlyPostDominates("Nowhere", "A"));
    }

    @Test
    void undeclaredParentIsRejected() {
        PostDominatorTree.Builder<String> b = PostDominatorTree.<String>builder().parent("A", "B");
        assertThrows(IllegalStateException.class, b::build);
    }

    @Test
    void cycleIsRejected() {
        PostDominatorTree.Builder<String> b = PostDominatorTree.<String>builder()
                .parent("A", "B")
                .parent("B", "C")
                .parent("C", "A");
        assertThrows(IllegalStateException.class, b::build);
    }

    @Test
    void conflictingParentIsRejected() {
        PostDominatorTree.Builder<String> b = PostDominatorTree.<String>builder().parent("A", "B");
        assertThrows(IllegalStateException.class, () -> b.parent("A", "C"));
        assertThrows(IllegalArgumentException.class, () -> b.parent("D", "D"));
    }
}
