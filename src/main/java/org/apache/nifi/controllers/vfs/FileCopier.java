package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.exception.AlreadyExistsException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Copies files, folders and links between any two backends, then transfers their attributes.
 */
public final class FileCopier {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileCopier.class);

    private FileCopier() {
    }

    /**
     * Copies a file, folder tree or link to the target path.
     *
     * @param source the file to copy
     * @param target the path to create; must also be readable so its existence can be checked
     * @param options overwrite, link and attribute handling
     * @throws AlreadyExistsException if the target exists and overwriting is off
     * @throws NotFoundException if the source, after following links when asked to, does not exist
     * @throws UnsupportedFileOperationException if the source is a special file, or a folder that cannot be listed
     * @throws IOException if a backend fails
     */
    public static void copy(ReadableFile source, WritableFile target, CopyOptions options) throws IOException {
        ReadableFile existing = readable(target);
        if (existing.exists()) {
            if (!options.isOverwrite()) {
                throw new AlreadyExistsException(target.getPath(), "Copy target already exists: " + target.getPath());
            }
            LOGGER.debug("Deleting {} before overwriting it", target.getPath());
            target.delete();
        }

        ReadableFile resolved = options.isDereferenceLinks() ? source.dereference(true) : source;
        FileType type = resolved.getType();
        LOGGER.debug("Copying {} {} to {}", type, resolved.getPath(), target.getPath());

        switch (type) {
            case FILE:
                copyContent(resolved, target);
                break;
            case FOLDER:
                if (!(resolved instanceof ListableFile)) {
                    throw new UnsupportedFileOperationException(resolved.getPath(),
                            "Folder " + resolved.getPath() + " cannot be listed, so it cannot be copied");
                }
                target.createFolder(false, false);
                for (ListableFile child : ((ListableFile) resolved).getChildren()) {
                    child.copyInto(target, options);
                }
                break;
            case LINK:
                // Only reached when links are not followed; the text is kept even if it dangles at the target
                target.linkTo(resolved.getLinkTarget());
                break;
            case ABSENT:
                throw new NotFoundException(resolved.getPath(), "Copy source does not exist: " + resolved.getPath());
            default:
                throw new UnsupportedFileOperationException(resolved.getPath(),
                        "Cannot copy special file " + resolved.getPath());
        }

        resolved.copyAttributesTo(target, options.getAttributes());
    }

    private static void copyContent(ReadableFile source, WritableFile target) throws IOException {
        try (FileBlocks blocks = source.readBlocks();
             OutputStream out = target.openForWriting(false)) {
            while (blocks.hasNext()) {
                out.write(blocks.next());
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static ReadableFile readable(WritableFile target) {
        if (target instanceof ReadableFile) {
            return (ReadableFile) target;
        }
        throw new UnsupportedFileOperationException(target.getPath(),
                "Copy target " + target.getPath() + " cannot be inspected for an existing file");
    }
}
