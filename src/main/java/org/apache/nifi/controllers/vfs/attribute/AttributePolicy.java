package org.apache.nifi.controllers.vfs.attribute;

import java.io.IOException;
import java.util.Objects;

/**
 * What a copy does with one attribute kind: copy it with the kind's own algorithm, skip it, or run a
 * caller supplied transfer.
 */
public final class AttributePolicy {

    public static final AttributePolicy ALWAYS = new AttributePolicy("ALWAYS", AttributeSet::copyTo);

    public static final AttributePolicy NEVER = new AttributePolicy("NEVER", null);

    private final String name;
    private final AttributeTransfer transfer;

    private AttributePolicy(String name, AttributeTransfer transfer) {
        this.name = name;
        this.transfer = transfer;
    }

    /**
     * Maps a boolean flag onto {@link #ALWAYS} or {@link #NEVER}.
     *
     * @param copy whether to copy
     * @return the policy
     */
    public static AttributePolicy of(boolean copy) {
        return copy ? ALWAYS : NEVER;
    }

    /**
     * Creates a policy that runs the given transfer instead of the kind's own algorithm.
     *
     * @param transfer the transfer, invoked with the source and target sets
     * @return the policy
     */
    public static AttributePolicy custom(AttributeTransfer transfer) {
        return new AttributePolicy("CUSTOM", Objects.requireNonNull(transfer, "transfer"));
    }

    public boolean isSkipped() {
        return transfer == null;
    }

    /**
     * Applies this policy to one pair of attribute sets.
     *
     * @param source the set of the file being copied
     * @param target the set of the copy
     * @throws IOException if the transfer fails
     */
    public void apply(AttributeSet source, AttributeSet target) throws IOException {
        if (transfer != null) {
            transfer.transfer(source, target);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
