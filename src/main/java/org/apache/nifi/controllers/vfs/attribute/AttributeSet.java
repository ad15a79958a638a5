package org.apache.nifi.controllers.vfs.attribute;

import java.io.IOException;

/**
 * One category of metadata attached to a file, together with the way it is transferred to another file.
 */
public interface AttributeSet {

    /**
     * Gets the kind this set belongs to.
     *
     * @return the kind
     */
    AttributeKind<?> getKind();

    /**
     * Transfers this set onto the set of the same kind belonging to another file.
     *
     * @param target the target set, always of the same kind as this one
     * @throws IOException if the backend fails to read or write the metadata
     */
    void copyTo(AttributeSet target) throws IOException;

    /**
     * Whether this kind is copied when a copy names neither the kind nor a fallback.
     *
     * @return true to copy by default
     */
    boolean isCopiedByDefault();
}
