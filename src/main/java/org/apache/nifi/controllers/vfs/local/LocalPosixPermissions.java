package org.apache.nifi.controllers.vfs.local;

import org.apache.nifi.controllers.vfs.attribute.PosixPermissions;
import org.apache.nifi.controllers.vfs.exception.FileErrorTranslator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Permission bits of a local file, read and written through {@link PosixFilePermissions}.
 */
class LocalPosixPermissions extends PosixPermissions {

    private final Path path;

    LocalPosixPermissions(Path path) {
        this.path = path;
    }

    @Override
    public int getMode() throws IOException {
        try {
            return fromSymbolic(PosixFilePermissions.toString(Files.getPosixFilePermissions(path, LinkOption.NOFOLLOW_LINKS)));
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path.toString());
        }
    }

    @Override
    public void setMode(int mode) throws IOException {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(toSymbolic(mode)));
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path.toString());
        }
    }
}
