package com.tyron.padj.api.history;

import java.util.List;

/**
 * One user-visible undo step: the operations recorded between two group boundaries.
 * <p>
 * {@code seq} is assigned when the group is sealed; it is unique and strictly increasing
 * per document and is the ordering key across the memory and disk tiers.
 */
public record EditGroup(long seq, List<EditOperation> operations) {

    public EditGroup {
        if (seq < 0) {
            throw new IllegalArgumentException("seq=" + seq + " must be >= 0");
        }
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("An edit group needs at least one operation");
        }
        operations = List.copyOf(operations);
    }

    public EditOperation first() {
        return operations.get(0);
    }

    public EditOperation last() {
        return operations.get(operations.size() - 1);
    }
}
