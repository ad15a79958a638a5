package org.apache.nifi.controllers.vfs.sftp;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.SftpException;
import org.apache.nifi.controllers.vfs.FileType;
import org.apache.nifi.controllers.vfs.exception.AlreadyExistsException;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;
import org.apache.nifi.controllers.vfs.exception.PermissionDeniedException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;

/**
 * Maps SFTP status codes onto the {@link FileOperationException} hierarchy.
 * <p>
 * SFTP version 3 servers answer a bare FAILURE for several distinct errors, such as creating a folder that
 * exists. The caller looks the path up after the failure and passes what it found.
 */
public final class SftpErrorTranslator {

    private static final int SSH_FX_NO_CONNECTION = 6;
    private static final int SSH_FX_CONNECTION_LOST = 7;

    private SftpErrorTranslator() {
    }

    /**
     * Translates a failed SFTP request.
     *
     * @param e the failure
     * @param path the path the request was about
     * @param existing what the path held after the failure, or null if it was not looked up
     * @return the exception to throw
     */
    public static FileOperationException translate(SftpException e, String path, FileType existing) {
        String message = "SFTP request on " + path + " failed: " + e.getMessage();

        switch (e.id) {
            case ChannelSftp.SSH_FX_NO_SUCH_FILE:
                return new NotFoundException(path, e.id, message, e);
            case ChannelSftp.SSH_FX_PERMISSION_DENIED:
                return new PermissionDeniedException(path, e.id, message, e);
            case ChannelSftp.SSH_FX_OP_UNSUPPORTED:
                return new UnsupportedFileOperationException(path, e.id, message, e);
            case ChannelSftp.SSH_FX_FAILURE:
                if (existing != null && existing != FileType.ABSENT) {
                    return new AlreadyExistsException(path, e.id, message, e);
                }
                return new FileOperationException(FileErrorType.UNEXPECTED_ERROR, path, e.id, message, e);
            case SSH_FX_NO_CONNECTION:
            case SSH_FX_CONNECTION_LOST:
                return new FileOperationException(FileErrorType.CONNECTION_ERROR, path, e.id, message, e);
            default:
                return new FileOperationException(FileErrorType.UNEXPECTED_ERROR, path, e.id, message, e);
        }
    }
}
