package org.apache.nifi.controllers.vfs.local;

import org.apache.nifi.controllers.vfs.attribute.ExtendedAttributes;
import org.apache.nifi.controllers.vfs.exception.AttributeNameRestrictedException;
import org.apache.nifi.controllers.vfs.exception.FileErrorTranslator;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * User extended attributes of a local file. java.nio exposes only the {@code user.} namespace and drops the
 * prefix from names.
 */
class LocalExtendedAttributes extends ExtendedAttributes {

    private final Path path;

    LocalExtendedAttributes(Path path) {
        this.path = path;
    }

    private UserDefinedFileAttributeView view() throws IOException {
        UserDefinedFileAttributeView view = Files.getFileAttributeView(path, UserDefinedFileAttributeView.class);
        if (view == null) {
            throw new IOException("Extended attributes are not available for " + path);
        }
        return view;
    }

    @Override
    public List<String> list() throws IOException {
        try {
            List<String> names = new ArrayList<>(view().list());
            Collections.sort(names);
            return names;
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path.toString());
        }
    }

    @Override
    public byte[] get(String name) throws IOException {
        try {
            UserDefinedFileAttributeView view = view();
            ByteBuffer buffer = ByteBuffer.allocate(view.size(name));
            view.read(name, buffer);
            buffer.flip();
            byte[] value = new byte[buffer.remaining()];
            buffer.get(value);
            return value;
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path.toString());
        }
    }

    @Override
    public void set(String name, byte[] value) throws IOException {
        try {
            view().write(name, ByteBuffer.wrap(value));
        } catch (IOException e) {
            FileOperationException translated = FileErrorTranslator.translate(e, path.toString());
            if (isNameRestriction(e, translated)) {
                throw new AttributeNameRestrictedException(path.toString(), name, e);
            }
            if (translated != null) {
                throw translated;
            }
            throw e;
        }
    }

    @Override
    public void delete(String name) throws IOException {
        try {
            view().delete(name);
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path.toString());
        }
    }

    /**
     * Whether a failed write was refused because of the attribute's name: a namespace the file system
     * does not support, or a name longer than it allows.
     */
    static boolean isNameRestriction(IOException e, FileOperationException translated) {
        if (translated != null && translated.getErrorType() == FileErrorType.UNSUPPORTED_OPERATION) {
            return true;
        }
        if (!(e instanceof FileSystemException)) {
            return false;
        }
        String reason = ((FileSystemException) e).getReason();
        return reason != null && (reason.endsWith("is too big") || reason.contains("Numerical result out of range"));
    }
}
