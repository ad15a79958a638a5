package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when a backend refuses an extended attribute because of its name, for example a
 * namespace the target file system does not allow user processes to write.
 * Extended attribute copies skip such attributes instead of failing.
 */
public class AttributeNameRestrictedException extends FileOperationException {

    private final String attributeName;

    public AttributeNameRestrictedException(String path, String attributeName, Throwable cause) {
        super(FileErrorType.ATTRIBUTE_NAME_RESTRICTED, path, -1,
                "Attribute " + attributeName + " cannot be set on " + path, cause);
        this.attributeName = attributeName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
