package org.apache.nifi.controllers.vfs.url;

import org.apache.nifi.controllers.vfs.FileType;
import org.apache.nifi.controllers.vfs.ReadableFile;
import org.apache.nifi.controllers.vfs.VirtualFile;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A readable file at an HTTP or HTTPS URL.
 * <p>
 * Paths ignore empty segments, so {@code http://host/a} and {@code http://host/a/} name the same file.
 * Children are resolved the way a browser resolves links against a folder URL: relative names are
 * joined onto the path, absolute paths replace it and full URLs replace everything. The query of
 * this file is not carried over to its children or its parent.
 */
public final class UrlFile implements ReadableFile {

    private final UrlFileBackend backend;
    private final URI uri;
    private final List<String> components;

    UrlFile(UrlFileBackend backend, URI uri) {
        this.backend = backend;
        this.uri = uri;

        List<String> parsed = new ArrayList<>();
        parsed.add("");
        String rawPath = uri.getRawPath();
        if (rawPath != null) {
            for (String segment : rawPath.split("/")) {
                if (!segment.isEmpty()) {
                    parsed.add(segment);
                }
            }
        }
        this.components = Collections.unmodifiableList(parsed);
    }

    public URI getUri() {
        return uri;
    }

    @Override
    public UrlFile child(String... names) {
        UrlFile result = this;
        for (String name : names) {
            result = result.resolve(name);
        }
        return result;
    }

    private UrlFile resolve(String name) {
        URI reference = parseReference(name);
        if (reference.getScheme() != null || reference.getRawAuthority() != null) {
            return new UrlFile(backend, uri.resolve(reference));
        }

        String rawPath = reference.getRawPath() == null ? "" : reference.getRawPath();
        List<String> joined = new ArrayList<>(rawPath.startsWith("/") ? Collections.singletonList("") : components);
        for (String segment : rawPath.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (joined.size() > 1) {
                    joined.remove(joined.size() - 1);
                }
            } else {
                joined.add(segment);
            }
        }

        boolean folder = rawPath.endsWith("/") && joined.size() > 1;
        return withPath(joined, folder, reference.getRawQuery());
    }

    /**
     * Parses a child name as a URI reference. Names holding characters a URI cannot, such as spaces, are
     * taken literally and percent-encoded.
     *
     * @throws IllegalArgumentException if the name cannot be encoded either
     */
    static URI parseReference(String name) {
        try {
            return URI.create(name);
        } catch (IllegalArgumentException e) {
            try {
                return new URI(null, name, null);
            } catch (URISyntaxException encodingFailure) {
                encodingFailure.addSuppressed(e);
                throw new IllegalArgumentException("Invalid URL reference: " + name, encodingFailure);
            }
        }
    }

    @Override
    public UrlFile getParent() {
        if (components.size() <= 1) {
            return null;
        }
        return withPath(components.subList(0, components.size() - 1), false, null);
    }

    private UrlFile withPath(List<String> pathComponents, boolean trailingSlash, String rawQuery) {
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority());
        sb.append(String.join("/", pathComponents));
        if (pathComponents.size() == 1 || trailingSlash) {
            sb.append('/');
        }
        if (rawQuery != null) {
            sb.append('?').append(rawQuery);
        }
        return new UrlFile(backend, URI.create(sb.toString()));
    }

    @Override
    public List<String> getPathComponents() {
        return components;
    }

    /**
     * Same scheme, host and query, and the same path once empty segments are ignored.
     */
    @Override
    public boolean sameAs(VirtualFile other) {
        if (!(other instanceof UrlFile)) {
            return false;
        }
        UrlFile that = (UrlFile) other;
        return components.equals(that.components)
                && uri.getScheme().equalsIgnoreCase(that.uri.getScheme())
                && Objects.equals(uri.getRawAuthority(), that.uri.getRawAuthority())
                && Objects.equals(uri.getRawQuery(), that.uri.getRawQuery());
    }

    @Override
    public String getSeparator() {
        return "/";
    }

    @Override
    public FileType getType() throws IOException {
        return backend.typeOf(uri);
    }

    @Override
    public String getLinkTarget() throws IOException {
        return backend.redirectTarget(uri);
    }

    @Override
    public InputStream openForReading() throws IOException {
        return backend.open(uri);
    }

    /**
     * Uses the Content-Length of the final target when the server sends one, and reads the content
     * otherwise.
     */
    @Override
    public long size() throws IOException {
        ReadableFile target = dereference(true);
        long length = backend.contentLength(((UrlFile) target).uri);
        if (length > 0) {
            return length;
        }
        return ReadableFile.super.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof UrlFile && uri.equals(((UrlFile) o).uri);
    }

    @Override
    public int hashCode() {
        return uri.hashCode();
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
