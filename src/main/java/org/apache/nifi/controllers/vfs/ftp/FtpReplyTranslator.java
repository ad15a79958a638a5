package org.apache.nifi.controllers.vfs.ftp;

import org.apache.commons.net.ftp.FTPReply;
import org.apache.nifi.controllers.vfs.FileType;
import org.apache.nifi.controllers.vfs.exception.AlreadyExistsException;
import org.apache.nifi.controllers.vfs.exception.AuthenticationException;
import org.apache.nifi.controllers.vfs.exception.BackendConnectionException;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;
import org.apache.nifi.controllers.vfs.exception.PermissionDeniedException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;

/**
 * Maps negative FTP replies onto the {@link FileOperationException} hierarchy.
 * <p>
 * Servers answer 550 both for missing files and for refused access, so the caller looks the path up
 * after the failure and passes what it found.
 */
public final class FtpReplyTranslator {

    private FtpReplyTranslator() {
    }

    /**
     * Translates a negative reply.
     *
     * @param replyCode the reply code
     * @param replyString the full reply text
     * @param path the path the command was about
     * @param existing what the path held after the failure, or null if it was not looked up
     * @param config the server the reply came from
     * @return the exception to throw
     */
    public static FileOperationException translate(int replyCode, String replyString, String path,
            FileType existing, FtpConnectionConfig config) {
        String message = "FTP command on " + path + " failed: " + (replyString == null ? replyCode : replyString.trim());

        switch (replyCode) {
            case FTPReply.NOT_LOGGED_IN:
                return new AuthenticationException(config.getHostname(), config.getPort(), config.getUsername(),
                        replyCode, message, null);
            case FTPReply.FILE_UNAVAILABLE:
                if (existing == null || existing == FileType.ABSENT) {
                    return new NotFoundException(path, replyCode, message, null);
                }
                return new PermissionDeniedException(path, replyCode, message, null);
            case FTPReply.FILE_NAME_NOT_ALLOWED:
            case FTPReply.NEED_ACCOUNT_FOR_STORING_FILES:
                return new PermissionDeniedException(path, replyCode, message, null);
            case 521:
                // Non-standard "already exists" reply to MKD
                return new AlreadyExistsException(path, replyCode, message, null);
            case FTPReply.UNRECOGNIZED_COMMAND:
            case FTPReply.COMMAND_NOT_IMPLEMENTED:
            case FTPReply.COMMAND_NOT_IMPLEMENTED_FOR_PARAMETER:
            case FTPReply.COMMAND_IS_SUPERFLUOUS:
                return new UnsupportedFileOperationException(path, replyCode, message, null);
            case FTPReply.SERVICE_NOT_AVAILABLE:
            case FTPReply.CANNOT_OPEN_DATA_CONNECTION:
                return new BackendConnectionException(FileErrorType.CONNECTION_ERROR,
                        config.getHostname(), config.getPort(), replyCode, message, null);
            case FTPReply.TRANSFER_ABORTED:
            case FTPReply.ACTION_ABORTED:
                return new BackendConnectionException(FileErrorType.TRANSFER_ERROR,
                        config.getHostname(), config.getPort(), replyCode, message, null);
            default:
                return new FileOperationException(FileErrorType.UNEXPECTED_ERROR, path, replyCode, message, null);
        }
    }
}
