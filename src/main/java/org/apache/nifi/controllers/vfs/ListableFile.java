package org.apache.nifi.controllers.vfs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A readable file whose children, when it is a folder, can be enumerated.
 */
public interface ListableFile extends ReadableFile {

    @Override
    ListableFile child(String... names);

    @Override
    ListableFile getParent();

    @Override
    default ListableFile safeChild(String... names) {
        return (ListableFile) ReadableFile.super.safeChild(names);
    }

    @Override
    default ListableFile sibling(String... names) {
        return getParent().child(names);
    }

    /**
     * Gets the names of this folder's children in sorted order. A link to a folder lists the target's
     * children.
     *
     * @return the names, or null if this file is not a folder
     * @throws IOException if the backend fails
     */
    List<String> getChildNames() throws IOException;

    /**
     * Gets handles for this folder's children, located under this file's own path.
     *
     * @return the children, or null if this file is not a folder
     * @throws IOException if the backend fails
     */
    default List<? extends ListableFile> getChildren() throws IOException {
        List<String> names = getChildNames();
        if (names == null) {
            return null;
        }
        List<ListableFile> children = new ArrayList<>(names.size());
        for (String name : names) {
            children.add(child(name));
        }
        return children;
    }

    /**
     * A folder's size is the sum of its children's sizes, recursively.
     */
    @Override
    default long size() throws IOException {
        if (!isFolder()) {
            return ReadableFile.super.size();
        }
        long total = 0;
        for (ListableFile child : getChildren()) {
            total += child.size();
        }
        return total;
    }

    default Stream<ListableFile> recurse() {
        return recurse(TraversalFilter.ALL);
    }

    default Stream<ListableFile> recurse(TraversalFilter filter) {
        return recurse(filter, true, true);
    }

    /**
     * Walks this file and its descendants in pre-order, lazily.
     * <p>
     * The filter decides per file whether it is yielded and whether the walk descends into it. A skipped
     * file is still descended into when {@code recurseSkipped} is set. Descendants are always eligible to
     * be yielded; {@code includeSelf} only concerns this file. Listing failures surface as
     * {@link UncheckedIOException} from the stream.
     *
     * @param filter the per-file decision, or null to yield and descend into everything
     * @param includeSelf whether this file itself may be yielded
     * @param recurseSkipped whether to descend into files the filter skipped
     * @return the walk; it cannot be restarted, call this method again instead
     */
    default Stream<ListableFile> recurse(TraversalFilter filter, boolean includeSelf, boolean recurseSkipped) {
        RecursiveWalk walk = new RecursiveWalk(this, filter == null ? TraversalFilter.ALL : filter,
                includeSelf, recurseSkipped);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(walk,
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }
}
