package com.tyron.padj.core.history;

import com.tyron.padj.api.history.EditOperation;

/**
 * Groups runs of the same kind of single-character edit.
 * <p>
 * Typing merges with typing that continues where the previous insertion ended; backspace merges
 * with the backspace just before it; forward delete merges with forward delete at the same offset.
 * Anything else (paste, multi-character delete, replacement) is a step of its own.
 * <p>
 * Backspace and forward delete are told apart by the caret: backspace moves it, forward delete
 * leaves it where it was.
 */
public final class DefaultGroupingPolicy implements GroupingPolicy {

    public static final DefaultGroupingPolicy INSTANCE = new DefaultGroupingPolicy();

    enum Kind {
        TYPING,
        BACKSPACE,
        FORWARD_DELETE,
        OTHER
    }

    private DefaultGroupingPolicy() {
    }

    @Override
    public boolean canMerge(EditOperation previous, EditOperation next) {
        Kind kind = classify(next);
        if (kind == Kind.OTHER || kind != classify(previous)) {
            return false;
        }

        return switch (kind) {
            case TYPING -> next.position() == previous.position() + previous.inserted().length();
            case BACKSPACE -> next.position() == previous.position() - 1;
            case FORWARD_DELETE -> next.position() == previous.position();
            case OTHER -> false;
        };
    }

    static Kind classify(EditOperation op) {
        if (op.isInsertion() && op.inserted().length() == 1) {
            return Kind.TYPING;
        }
        if (op.isDeletion() && op.deleted().length() == 1) {
            return op.cursorBefore().equals(op.cursorAfter()) ? Kind.FORWARD_DELETE : Kind.BACKSPACE;
        }
        return Kind.OTHER;
    }
}
