package com.tyron.padj.core.history;

import org.junit.jupiter.api.Test;

import static com.tyron.padj.testFramework.EditOps.backspace;
import static com.tyron.padj.testFramework.EditOps.deleteForward;
import static com.tyron.padj.testFramework.EditOps.insert;
import static com.tyron.padj.testFramework.EditOps.replace;
import static org.junit.jupiter.api.Assertions.*;

public class DefaultGroupingPolicyTest {

    private final GroupingPolicy policy = DefaultGroupingPolicy.INSTANCE;

    @Test
    public void contiguousTypingMerges() {
        assertTrue(policy.canMerge(insert(3, "a"), insert(4, "b")));
        assertFalse(policy.canMerge(insert(3, "a"), insert(7, "b")));
        assertFalse(policy.canMerge(insert(3, "a"), insert(3, "b")));
    }

    @Test
    public void backspaceRunMerges() {
        assertTrue(policy.canMerge(backspace(5, "x"), backspace(4, "y")));
        assertFalse(policy.canMerge(backspace(5, "x"), backspace(2, "y")));
    }

    @Test
    public void forwardDeleteRunMerges() {
        assertTrue(policy.canMerge(deleteForward(5, "x"), deleteForward(5, "y")));
        assertFalse(policy.canMerge(deleteForward(5, "x"), deleteForward(6, "y")));
    }

    @Test
    public void differentKindsDoNotMerge() {
        assertFalse(policy.canMerge(insert(4, "a"), backspace(4, "a")));
        assertFalse(policy.canMerge(backspace(4, "a"), insert(4, "b")));
        assertFalse(policy.canMerge(backspace(5, "a"), deleteForward(4, "b")));
    }

    @Test
    public void multiCharacterEditsNeverMerge() {
        assertFalse(policy.canMerge(insert(0, "a"), insert(1, "pasted")));
        assertFalse(policy.canMerge(insert(0, "pasted"), insert(6, "a")));
        assertFalse(policy.canMerge(insert(0, "a"), replace(0, "a", "b")));
        assertFalse(policy.canMerge(backspace(5, "ab"), backspace(4, "c")));
    }

    @Test
    public void classification() {
        assertEquals(DefaultGroupingPolicy.Kind.TYPING, DefaultGroupingPolicy.classify(insert(0, "\n")));
        assertEquals(DefaultGroupingPolicy.Kind.BACKSPACE, DefaultGroupingPolicy.classify(backspace(0, "a")));
        assertEquals(DefaultGroupingPolicy.Kind.FORWARD_DELETE, DefaultGroupingPolicy.classify(deleteForward(0, "a")));
        assertEquals(DefaultGroupingPolicy.Kind.OTHER, DefaultGroupingPolicy.classify(replace(0, "a", "b")));
    }
}
