package com.tyron.padj.core.history;

import com.tyron.padj.api.history.EditOperation;

/**
 * Decides whether an edit may join the undo group that ends with {@code previous}.
 * <p>
 * Only consulted when the two edits fall within the group timeout.
 */
@FunctionalInterface
public interface GroupingPolicy {

    boolean canMerge(EditOperation previous, EditOperation next);

    /**
     * Merges every edit made within the timeout, whatever its kind.
     */
    static GroupingPolicy timeOnly() {
        return (previous, next) -> true;
    }
}
