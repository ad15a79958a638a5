package org.apache.nifi.controllers.vfs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pre-order walk behind {@link ListableFile#recurse}. Children are listed only when the walk reaches them.
 */
class RecursiveWalk implements Iterator<ListableFile> {

    private final TraversalFilter filter;
    private final boolean recurseSkipped;

    // Pending files, next to visit on top; each is paired with whether it may be yielded
    private final Deque<ListableFile> pending = new ArrayDeque<>();
    private final Deque<Boolean> pendingYieldable = new ArrayDeque<>();

    private ListableFile next;

    RecursiveWalk(ListableFile root, TraversalFilter filter, boolean includeSelf, boolean recurseSkipped) {
        this.filter = filter;
        this.recurseSkipped = recurseSkipped;
        pending.push(root);
        pendingYieldable.push(includeSelf);
    }

    @Override
    public boolean hasNext() {
        try {
            while (next == null && !pending.isEmpty()) {
                ListableFile file = pending.pop();
                boolean yieldable = pendingYieldable.pop();

                TraversalOutcome outcome = filter.evaluate(file);
                if (outcome.recurses() || (outcome == TraversalOutcome.SKIP && recurseSkipped)) {
                    pushChildren(file);
                }
                if (outcome.yields() && yieldable) {
                    next = file;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return next != null;
    }

    @Override
    public ListableFile next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ListableFile result = next;
        next = null;
        return result;
    }

    private void pushChildren(ListableFile folder) throws IOException {
        List<? extends ListableFile> children = folder.getChildren();
        if (children == null) {
            return;
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
            pendingYieldable.push(Boolean.TRUE);
        }
    }
}
