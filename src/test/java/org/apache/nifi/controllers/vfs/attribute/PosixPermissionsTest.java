package org.apache.nifi.controllers.vfs.attribute;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("POSIX Permissions Tests")
public class PosixPermissionsTest {

    static class InMemoryPermissions extends PosixPermissions {
        int mode;

        InMemoryPermissions(int mode) {
            this.mode = mode;
        }

        @Override
        public int getMode() {
            return mode;
        }

        @Override
        public void setMode(int mode) {
            this.mode = mode;
        }
    }

    @Test
    @DisplayName("Should render modes the way ls does")
    void testToSymbolic() {
        assertEquals("rwxr-x---", PosixPermissions.toSymbolic(0750));
        assertEquals("rw-r--r--", PosixPermissions.toSymbolic(0644));
        assertEquals("---------", PosixPermissions.toSymbolic(0));
    }

    @Test
    @DisplayName("Should parse the symbolic form")
    void testFromSymbolic() {
        assertEquals(0750, PosixPermissions.fromSymbolic("rwxr-x---"));
        assertEquals(0777, PosixPermissions.fromSymbolic("rwxrwxrwx"));
        assertThrows(IllegalArgumentException.class, () -> PosixPermissions.fromSymbolic("rwx"));
        assertThrows(IllegalArgumentException.class, () -> PosixPermissions.fromSymbolic("rwxr-x--z"));
    }

    @Test
    @DisplayName("Should copy the numeric mode")
    void testCopyTo() throws IOException {
        InMemoryPermissions source = new InMemoryPermissions(0600);
        InMemoryPermissions target = new InMemoryPermissions(0777);

        source.copyTo(target);

        assertEquals(0600, target.mode);
        assertTrue(source.isCopiedByDefault());
        assertEquals(AttributeKind.POSIX_PERMISSIONS, source.getKind());
    }
}
