package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when a name passed to a safe child lookup resolves outside of the folder it was
 * looked up in, for example through ".." components or an absolute name.
 */
public class PathEscapeException extends FileOperationException {

    private final String parentPath;

    /**
     * Creates a new PathEscapeException.
     *
     * @param parentPath The folder the lookup was confined to
     * @param attemptedPath The path the names resolved to
     */
    public PathEscapeException(String parentPath, String attemptedPath) {
        super(FileErrorType.PATH_ESCAPE, attemptedPath,
                "Path " + attemptedPath + " is not a descendant of " + parentPath);
        this.parentPath = parentPath;
    }

    /**
     * Gets the folder the lookup was confined to.
     *
     * @return The parent path
     */
    public String getParentPath() {
        return parentPath;
    }
}
