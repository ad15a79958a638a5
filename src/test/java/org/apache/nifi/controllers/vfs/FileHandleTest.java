package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.exception.PathEscapeException;
import org.apache.nifi.controllers.vfs.local.LocalFileBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Navigation only; none of these touch the disk.
 */
@DisplayName("File Handle Navigation Tests")
public class FileHandleTest {

    private final FileBackend backend = LocalFileBackend.getInstance();
    private final ReadWriteFile root = backend.root();
    private final ReadWriteFile h = backend.file("/srv/data");

    @Test
    @DisplayName("Should return an equal handle for no names and the parent for one name")
    void testChildAndParent() {
        assertTrue(h.child().sameAs(h));
        assertEquals(h, h.child());
        assertTrue(h.child("a").getParent().sameAs(h));
        assertEquals(Arrays.asList("", "srv", "data", "a", "b"), h.child("a/b").getPathComponents());
        assertEquals(Arrays.asList("", "srv", "data", "a", "b"), h.child("a", "b").getPathComponents());
    }

    @Test
    @DisplayName("Should normalize dot components and stop at the root")
    void testNormalization() {
        assertTrue(h.child(".", "a", "..").sameAs(h));
        assertTrue(h.child("../../../..").sameAs(root));
        assertTrue(h.child("a//b/").sameAs(h.child("a", "b")));
    }

    @Test
    @DisplayName("Should let an absolute name discard everything before it")
    void testAbsoluteName() {
        assertEquals("/etc/hosts", h.child("a", "/etc", "hosts").getPath());
    }

    @Test
    @DisplayName("Should describe the root")
    void testRoot() {
        assertNull(root.getParent());
        assertEquals("", root.getName());
        assertEquals("/", root.getPath());
        assertEquals(Collections.singletonList(""), root.getPathComponents());
        assertEquals("data", h.getName());
    }

    @Test
    @DisplayName("Should build relative paths with parent steps")
    void testRelativePaths() {
        ReadWriteFile other = backend.file("/srv/logs/today");
        assertEquals(Arrays.asList("..", "..", "data"), h.getPathComponents(other));
        assertEquals("../../data", h.getPath(other, "/"));
        assertEquals(Collections.singletonList("."), h.getPathComponents(h));
        assertEquals("srv\\data", h.getPath(root, "\\"));
    }

    @Test
    @DisplayName("Should relate ancestors and descendants")
    void testAncestry() {
        ReadWriteFile deep = h.child("x", "y");
        List<VirtualFile> ancestors = deep.getAncestors(false);

        assertEquals(4, ancestors.size());
        assertTrue(ancestors.get(0).sameAs(h.child("x")));
        assertTrue(ancestors.get(3).sameAs(root));
        assertTrue(deep.descendantOf(h, false));
        assertTrue(h.ancestorOf(deep, false));
        assertFalse(h.descendantOf(h, false));
        assertTrue(h.descendantOf(h, true));
        assertFalse(h.descendantOf(deep, true));
    }

    @Test
    @DisplayName("Should reject safe children that escape the parent")
    void testSafeChild() {
        assertTrue(h.safeChild("a/../b").sameAs(h.child("b")));
        assertThrows(PathEscapeException.class, () -> h.safeChild(".."));
        assertThrows(PathEscapeException.class, () -> h.safeChild("a/../.."));
        assertThrows(PathEscapeException.class, () -> h.safeChild("/etc"));
        assertThrows(PathEscapeException.class, () -> h.safeChild());
    }

    @Test
    @DisplayName("Should resolve siblings through the parent")
    void testSibling() {
        assertTrue(h.sibling("logs").sameAs(backend.file("/srv/logs")));
    }

    @Test
    @DisplayName("Should work as a set element")
    void testValueSemantics() {
        Set<ReadWriteFile> set = new HashSet<>();
        set.add(h.child("a"));
        set.add(backend.file("/srv/data/a"));
        assertEquals(1, set.size());
    }
}
