package org.apache.nifi.controllers.vfs;

/**
 * Decision a {@link TraversalFilter} makes for one file during {@link ListableFile#recurse}.
 */
public enum TraversalOutcome {
    /**
     * Neither yield the file nor descend into it, unless skipped folders are descended into.
     */
    SKIP(false, false),
    YIELD(true, false),
    RECURSE(false, true),
    BOTH(true, true);

    private final boolean yields;
    private final boolean recurses;

    TraversalOutcome(boolean yields, boolean recurses) {
        this.yields = yields;
        this.recurses = recurses;
    }

    /**
     * Maps a boolean filter result: true yields and recurses, false skips.
     *
     * @param include the filter result
     * @return {@link #BOTH} or {@link #SKIP}
     */
    public static TraversalOutcome of(boolean include) {
        return include ? BOTH : SKIP;
    }

    public boolean yields() {
        return yields;
    }

    public boolean recurses() {
        return recurses;
    }
}
