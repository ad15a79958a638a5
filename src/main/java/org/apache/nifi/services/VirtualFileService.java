package org.apache.nifi.services;

import org.apache.nifi.controller.ControllerService;
import org.apache.nifi.controllers.vfs.ReadWriteFile;
import org.apache.nifi.controllers.vfs.ReadableFile;

/**
 * Controller service handing out files on one configured backend: the local disk, an FTP or FTPS server,
 * an SFTP server or a web server.
 */
public interface VirtualFileService extends ControllerService {

    /**
     * Gets the configured root folder, or the base URL for web servers.
     *
     * @return the root
     */
    ReadableFile getRoot();

    /**
     * Resolves a path against the configured root. Absolute paths are taken as they are.
     *
     * @param path the path
     * @return the file
     */
    ReadableFile getFile(String path);

    /**
     * Same as {@link #getFile(String)} for backends that can be written to.
     *
     * @param path the path
     * @return the file
     * @throws org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException if the backend is read-only
     */
    ReadWriteFile getWritableFile(String path);

    /**
     * Tests if the root can be reached.
     *
     * @return true if the backend answered, false otherwise
     */
    boolean testConnection();
}
