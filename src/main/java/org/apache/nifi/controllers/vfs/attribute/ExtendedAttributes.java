package org.apache.nifi.controllers.vfs.attribute;

import org.apache.nifi.controllers.vfs.exception.AttributeNameRestrictedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Named binary values attached to a file (user extended attributes).
 */
public abstract class ExtendedAttributes implements AttributeSet {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtendedAttributes.class);

    public abstract List<String> list() throws IOException;

    public abstract byte[] get(String name) throws IOException;

    /**
     * Creates or replaces an attribute.
     *
     * @param name the attribute name
     * @param value the attribute value
     * @throws AttributeNameRestrictedException if the backend does not accept the name
     * @throws IOException if the attribute cannot be written
     */
    public abstract void set(String name, byte[] value) throws IOException;

    public abstract void delete(String name) throws IOException;

    @Override
    public AttributeKind<ExtendedAttributes> getKind() {
        return AttributeKind.EXTENDED_ATTRIBUTES;
    }

    /**
     * Makes the target carry exactly this file's attributes. Existing target attributes are deleted first;
     * an attribute whose name the target refuses is skipped.
     */
    @Override
    public void copyTo(AttributeSet target) throws IOException {
        ExtendedAttributes other = AttributeKind.EXTENDED_ATTRIBUTES.cast(target);

        for (String name : other.list()) {
            other.delete(name);
        }

        for (String name : list()) {
            try {
                other.set(name, get(name));
            } catch (AttributeNameRestrictedException e) {
                LOGGER.debug("Skipping extended attribute {}: {}", name, e.getMessage());
            }
        }
    }

    @Override
    public boolean isCopiedByDefault() {
        return true;
    }
}
