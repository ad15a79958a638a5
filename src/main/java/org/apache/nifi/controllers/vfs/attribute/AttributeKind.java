package org.apache.nifi.controllers.vfs.attribute;

import java.util.Objects;

/**
 * Key identifying one category of file metadata. Kinds compare by their identifier, so a kind
 * created by a backend matches the well-known constants below.
 *
 * @param <A> the attribute set type the kind maps to
 */
public final class AttributeKind<A extends AttributeSet> {

    public static final AttributeKind<PosixPermissions> POSIX_PERMISSIONS =
            new AttributeKind<>("posix-permissions", PosixPermissions.class);

    public static final AttributeKind<ExtendedAttributes> EXTENDED_ATTRIBUTES =
            new AttributeKind<>("extended-attributes", ExtendedAttributes.class);

    private final String id;
    private final Class<A> type;

    private AttributeKind(String id, Class<A> type) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Creates a kind for metadata outside the well-known categories.
     *
     * @param id the stable identifier of the kind
     * @param type the attribute set type
     * @param <A> the attribute set type
     * @return the kind
     */
    public static <A extends AttributeSet> AttributeKind<A> of(String id, Class<A> type) {
        return new AttributeKind<>(id, type);
    }

    public String getId() {
        return id;
    }

    public Class<A> getType() {
        return type;
    }

    /**
     * Narrows an attribute set of this kind to its concrete type.
     *
     * @param set the set
     * @return the same set, typed
     */
    public A cast(AttributeSet set) {
        return type.cast(set);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeKind)) {
            return false;
        }
        return id.equals(((AttributeKind<?>) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
