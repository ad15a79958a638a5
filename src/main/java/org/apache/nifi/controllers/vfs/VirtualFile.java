package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.attribute.AttributeCopier;
import org.apache.nifi.controllers.vfs.attribute.AttributeKind;
import org.apache.nifi.controllers.vfs.attribute.AttributeSet;
import org.apache.nifi.controllers.vfs.attribute.CopyAttributesSpec;
import org.apache.nifi.controllers.vfs.exception.PathEscapeException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A path on some backend. This is the navigation part of every file; reading, listing and writing are
 * added by {@link ReadableFile}, {@link ListableFile} and {@link WritableFile}.
 * <p>
 * Handles are immutable values. Navigation never touches the backend, so a handle may name a path
 * that does not exist.
 */
public interface VirtualFile {

    /**
     * Returns the file reached by joining the given names onto this file's path.
     * Each name may itself contain separators. An absolute name discards everything before it,
     * "." components are dropped and ".." components step up one level. With no names, a handle
     * equal to this one is returned.
     *
     * @param names the names to join
     * @return the resulting file
     */
    VirtualFile child(String... names);

    /**
     * Gets the folder containing this file.
     *
     * @return the parent, or null if this file is a root
     */
    VirtualFile getParent();

    /**
     * Gets the components of this file's absolute path. An empty first component marks an absolute
     * path on backends with a single root.
     *
     * @return the path components
     */
    List<String> getPathComponents();

    /**
     * Whether this handle and the other one name the same path on the same backend.
     *
     * @param other the other handle
     * @return true if both handles name the same path
     */
    boolean sameAs(VirtualFile other);

    /**
     * Gets the separator the backend uses between path components.
     *
     * @return the separator
     */
    String getSeparator();

    /**
     * Gets the components of the path leading from another file to this one, using ".." to step out of
     * the other file's folders.
     *
     * @param relativeTo the file the result is relative to
     * @return the relative path components; {@code ["."]} when both files are the same
     */
    default List<String> getPathComponents(VirtualFile relativeTo) {
        List<String> mine = getPathComponents();
        List<String> theirs = relativeTo.getPathComponents();

        int common = 0;
        while (common < mine.size() && common < theirs.size() && mine.get(common).equals(theirs.get(common))) {
            common++;
        }

        List<String> result = new ArrayList<>();
        for (int i = common; i < theirs.size(); i++) {
            result.add("..");
        }
        result.addAll(mine.subList(common, mine.size()));

        if (result.isEmpty()) {
            result.add(".");
        }
        return result;
    }

    /**
     * Same as {@link #child(String...)}, but fails unless the result is a strict descendant of this file.
     * The names may contain ".." as long as the result stays inside this file.
     *
     * @param names the names to join
     * @return the resulting file
     * @throws PathEscapeException if the names lead outside of this file
     */
    default VirtualFile safeChild(String... names) {
        VirtualFile result = child(names);
        if (!result.descendantOf(this, false)) {
            throw new PathEscapeException(getPath(), result.getPath());
        }
        return result;
    }

    /**
     * Same as {@code getParent().child(names)}.
     */
    default VirtualFile sibling(String... names) {
        return getParent().child(names);
    }

    /**
     * Gets the chain of folders containing this file, nearest first.
     *
     * @param includeSelf whether this file starts the list
     * @return the ancestors, ending with the root
     */
    default List<VirtualFile> getAncestors(boolean includeSelf) {
        List<VirtualFile> result = new ArrayList<>();
        VirtualFile current = includeSelf ? this : getParent();
        while (current != null) {
            result.add(current);
            current = current.getParent();
        }
        return result;
    }

    default boolean descendantOf(VirtualFile other, boolean includeSelf) {
        for (VirtualFile ancestor : getAncestors(includeSelf)) {
            if (other.sameAs(ancestor)) {
                return true;
            }
        }
        return false;
    }

    default boolean ancestorOf(VirtualFile other, boolean includeSelf) {
        return other.descendantOf(this, includeSelf);
    }

    /**
     * Gets the absolute, backend native path of this file.
     *
     * @return the path
     */
    default String getPath() {
        return getPath(null, getSeparator());
    }

    /**
     * Joins this file's path components with the given separator.
     *
     * @param relativeTo when not null, the path is made relative to this file
     * @param separator the separator to join with
     * @return the path
     */
    default String getPath(VirtualFile relativeTo, String separator) {
        List<String> components = relativeTo == null ? getPathComponents() : getPathComponents(relativeTo);
        if (components.size() == 1 && components.get(0).isEmpty()) {
            return separator;
        }
        return String.join(separator, components);
    }

    /**
     * Gets the last component of this file's path; empty for a root.
     */
    default String getName() {
        List<String> components = getPathComponents();
        return components.isEmpty() ? "" : components.get(components.size() - 1);
    }

    /**
     * Gets the metadata sets this file supports, keyed by kind. Files without metadata support return
     * an empty map.
     *
     * @return the attribute sets
     * @throws IOException if the backend fails while determining which sets apply
     */
    default Map<AttributeKind<?>, AttributeSet> getAttributes() throws IOException {
        return Collections.emptyMap();
    }

    /**
     * Copies this file's metadata onto another file, kind by kind, following the given copy instructions.
     *
     * @param other the target file
     * @param spec the per-kind instructions
     * @throws IOException if a transfer fails
     */
    default void copyAttributesTo(VirtualFile other, CopyAttributesSpec spec) throws IOException {
        AttributeCopier.copy(this, other, spec);
    }
}
