package org.apache.nifi.controllers.vfs.exception;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

/**
 * Maps native failures onto the {@link FileOperationException} hierarchy.
 * <p>
 * Failures that have no counterpart in the hierarchy are left alone, so callers can rethrow the original
 * {@link IOException} unchanged.
 */
public final class FileErrorTranslator {

    public static final int EPERM = 1;
    public static final int ENOENT = 2;
    public static final int EACCES = 13;
    public static final int EEXIST = 17;
    public static final int ENOTDIR = 20;
    public static final int EISDIR = 21;
    public static final int ENOTEMPTY = 39;
    public static final int ELOOP = 40;
    public static final int ENOTSUP = 95;

    private FileErrorTranslator() {
    }

    /**
     * Builds the exception matching a POSIX errno value.
     *
     * @param errno the errno value
     * @param path the path involved in the failure
     * @param message the error message
     * @param cause the original failure, may be null
     * @return the translated exception, or null when the errno has no counterpart
     */
    public static FileOperationException forErrno(int errno, String path, String message, Throwable cause) {
        switch (errno) {
            case ENOENT:
                return new NotFoundException(path, errno, message, cause);
            case EEXIST:
                return new AlreadyExistsException(path, errno, message, cause);
            case ENOTDIR:
                return new NotADirectoryException(path, errno, message, cause);
            case EISDIR:
                return new NotAFileException(path, errno, message, cause);
            case EACCES:
            case EPERM:
                return new PermissionDeniedException(path, errno, message, cause);
            case ENOTSUP:
                return new UnsupportedFileOperationException(path, errno, message, cause);
            case ENOTEMPTY:
                return new FileOperationException(FileErrorType.DIRECTORY_NOT_EMPTY, path, errno, message, cause);
            case ELOOP:
                return new FileOperationException(FileErrorType.TOO_MANY_LINKS, path, errno, message, cause);
            default:
                return null;
        }
    }

    /**
     * Translates a java.nio failure.
     *
     * @param e the failure
     * @param path the path to report when the failure carries none
     * @return the translated exception, or null when the failure has no counterpart
     */
    public static FileOperationException translate(IOException e, String path) {
        if (!(e instanceof FileSystemException)) {
            return null;
        }

        FileSystemException fse = (FileSystemException) e;
        String file = fse.getFile() != null ? fse.getFile() : path;
        String message = fse.getMessage();

        if (fse instanceof NoSuchFileException) {
            return forErrno(ENOENT, file, message, e);
        } else if (fse instanceof FileAlreadyExistsException) {
            return forErrno(EEXIST, file, message, e);
        } else if (fse instanceof NotDirectoryException) {
            return forErrno(ENOTDIR, file, message, e);
        } else if (fse instanceof AccessDeniedException) {
            return forErrno(EACCES, file, message, e);
        } else if (fse instanceof DirectoryNotEmptyException) {
            return forErrno(ENOTEMPTY, file, message, e);
        } else if (fse instanceof FileSystemLoopException) {
            return forErrno(ELOOP, file, message, e);
        }

        // The JDK reports some errno values only through the reason text
        String reason = fse.getReason();
        if (reason == null) {
            return null;
        } else if (reason.contains("Is a directory")) {
            return forErrno(EISDIR, file, message, e);
        } else if (reason.contains("Not a directory")) {
            return forErrno(ENOTDIR, file, message, e);
        } else if (reason.contains("Too many levels of symbolic links")) {
            return forErrno(ELOOP, file, message, e);
        } else if (reason.contains("Operation not supported")) {
            return forErrno(ENOTSUP, file, message, e);
        } else if (reason.contains("Operation not permitted")) {
            return forErrno(EPERM, file, message, e);
        }
        return null;
    }

    /**
     * Throws the translated form of a failure, or hands the original back to be rethrown.
     * Use as {@code throw FileErrorTranslator.propagate(e, path);}.
     *
     * @param e the failure
     * @param path the path to report when the failure carries none
     * @return the original failure when it has no counterpart
     * @throws FileOperationException the translated failure
     */
    public static IOException propagate(IOException e, String path) {
        FileOperationException translated = translate(e, path);
        if (translated != null) {
            throw translated;
        }
        return e;
    }
}
