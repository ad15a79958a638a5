package org.apache.nifi.controllers.vfs.attribute;

import org.apache.nifi.controllers.vfs.exception.AttributeNameRestrictedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Extended Attributes Tests")
public class ExtendedAttributesTest {

    static class InMemoryAttributes extends ExtendedAttributes {
        final Map<String, byte[]> values = new TreeMap<>();
        final String restrictedPrefix;

        InMemoryAttributes(String restrictedPrefix) {
            this.restrictedPrefix = restrictedPrefix;
        }

        @Override
        public List<String> list() {
            return new ArrayList<>(values.keySet());
        }

        @Override
        public byte[] get(String name) {
            return values.get(name);
        }

        @Override
        public void set(String name, byte[] value) {
            if (restrictedPrefix != null && name.startsWith(restrictedPrefix)) {
                throw new AttributeNameRestrictedException("/target", name, null);
            }
            values.put(name, value);
        }

        @Override
        public void delete(String name) {
            values.remove(name);
        }
    }

    @Test
    @DisplayName("Should replace the target's attributes with the source's")
    void testCopyReplaces() throws IOException {
        InMemoryAttributes source = new InMemoryAttributes(null);
        source.values.put("user.a", new byte[] {1});
        source.values.put("user.b", new byte[] {2});
        InMemoryAttributes target = new InMemoryAttributes(null);
        target.values.put("user.stale", new byte[] {9});

        source.copyTo(target);

        assertEquals(List.of("user.a", "user.b"), target.list());
        assertArrayEquals(new byte[] {2}, target.get("user.b"));
    }

    @Test
    @DisplayName("Should skip names the target refuses")
    void testRestrictedNamesSkipped() throws IOException {
        InMemoryAttributes source = new InMemoryAttributes(null);
        source.values.put("security.label", new byte[] {1});
        source.values.put("user.kept", new byte[] {2});
        InMemoryAttributes target = new InMemoryAttributes("security.");

        source.copyTo(target);

        assertEquals(List.of("user.kept"), target.list());
    }
}
