package org.apache.nifi.controllers.vfs;

/**
 * What a path currently holds, as seen without following a final symbolic link.
 */
public enum FileType {
    FILE,
    FOLDER,
    LINK,
    /**
     * Anything else the backend reports, such as devices, sockets or pipes.
     */
    OTHER,
    /**
     * Nothing exists at the path.
     */
    ABSENT
}
