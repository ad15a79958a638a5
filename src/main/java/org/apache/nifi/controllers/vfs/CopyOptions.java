package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.attribute.CopyAttributesSpec;

/**
 * Options for {@link ReadableFile#copyTo(WritableFile, CopyOptions)}.
 * This class is immutable, and instances are created using the Builder pattern.
 */
public final class CopyOptions {

    /**
     * Refuses to overwrite, follows links, copies attributes by their kinds' defaults.
     */
    public static final CopyOptions DEFAULT = builder().build();

    private final boolean overwrite;
    private final boolean dereferenceLinks;
    private final CopyAttributesSpec attributes;

    private CopyOptions(Builder builder) {
        this.overwrite = builder.overwrite;
        this.dereferenceLinks = builder.dereferenceLinks;
        this.attributes = builder.attributes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether an existing target is deleted before copying instead of failing the copy.
     */
    public boolean isOverwrite() {
        return overwrite;
    }

    /**
     * Whether links are copied as what they point to. When false, links are recreated as links with the
     * same target text.
     */
    public boolean isDereferenceLinks() {
        return dereferenceLinks;
    }

    public CopyAttributesSpec getAttributes() {
        return attributes;
    }

    public Builder toBuilder() {
        return new Builder()
                .overwrite(overwrite)
                .dereferenceLinks(dereferenceLinks)
                .attributes(attributes);
    }

    /**
     * Builder class for CopyOptions.
     */
    public static class Builder {
        private boolean overwrite = false;
        private boolean dereferenceLinks = true;
        private CopyAttributesSpec attributes = CopyAttributesSpec.DEFAULT;

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder dereferenceLinks(boolean dereferenceLinks) {
            this.dereferenceLinks = dereferenceLinks;
            return this;
        }

        public Builder attributes(CopyAttributesSpec attributes) {
            this.attributes = attributes == null ? CopyAttributesSpec.DEFAULT : attributes;
            return this;
        }

        public CopyOptions build() {
            return new CopyOptions(this);
        }
    }
}
