package org.apache.nifi.controllers.vfs.attribute;

import java.io.IOException;

/**
 * Caller supplied transfer used in place of a kind's own {@link AttributeSet#copyTo(AttributeSet)}.
 */
@FunctionalInterface
public interface AttributeTransfer {

    void transfer(AttributeSet source, AttributeSet target) throws IOException;
}
