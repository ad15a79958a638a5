package org.apache.nifi.controllers.vfs.attribute;

import java.io.IOException;

/**
 * The numeric permission mode of a file, for example {@code 0644}.
 * Backends supply the read and write of the mode; copying assigns the source mode to the target.
 */
public abstract class PosixPermissions implements AttributeSet {

    private static final char[] SYMBOLS = {'r', 'w', 'x'};

    /**
     * Gets the permission bits of the file.
     *
     * @return the mode, permission bits only
     * @throws IOException if the mode cannot be read
     */
    public abstract int getMode() throws IOException;

    /**
     * Replaces the permission bits of the file.
     *
     * @param mode the new mode, permission bits only
     * @throws IOException if the mode cannot be written
     */
    public abstract void setMode(int mode) throws IOException;

    @Override
    public AttributeKind<PosixPermissions> getKind() {
        return AttributeKind.POSIX_PERMISSIONS;
    }

    @Override
    public void copyTo(AttributeSet target) throws IOException {
        AttributeKind.POSIX_PERMISSIONS.cast(target).setMode(getMode());
    }

    @Override
    public boolean isCopiedByDefault() {
        return true;
    }

    /**
     * Renders permission bits the way {@code ls -l} does, e.g. {@code rwxr-x---}.
     *
     * @param mode the permission bits
     * @return the nine character form
     */
    public static String toSymbolic(int mode) {
        StringBuilder sb = new StringBuilder(9);
        for (int i = 8; i >= 0; i--) {
            sb.append((mode & (1 << i)) != 0 ? SYMBOLS[(8 - i) % 3] : '-');
        }
        return sb.toString();
    }

    /**
     * Parses the nine character {@code ls -l} form back into permission bits.
     *
     * @param symbolic the symbolic form
     * @return the permission bits
     */
    public static int fromSymbolic(String symbolic) {
        if (symbolic == null || symbolic.length() != 9) {
            throw new IllegalArgumentException("Expected nine permission characters but got " + symbolic);
        }
        int mode = 0;
        for (int i = 0; i < 9; i++) {
            char c = symbolic.charAt(i);
            if (c == SYMBOLS[i % 3]) {
                mode |= 1 << (8 - i);
            } else if (c != '-') {
                throw new IllegalArgumentException("Unexpected permission character '" + c + "' in " + symbolic);
            }
        }
        return mode;
    }
}
