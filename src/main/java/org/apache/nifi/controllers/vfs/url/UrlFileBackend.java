package org.apache.nifi.controllers.vfs.url;

import org.apache.nifi.controllers.vfs.FileType;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;
import org.apache.nifi.controllers.vfs.exception.PermissionDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only access to HTTP and HTTPS resources through the JDK HTTP client.
 * <p>
 * A URL answering 200 is a file and a URL answering with a redirect is a link whose target is the
 * {@code Location} header. Anything else is reported as absent. Reads follow redirects.
 */
public class UrlFileBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(UrlFileBackend.class);

    static final Set<Integer> REDIRECT_CODES = Set.of(
            HttpURLConnection.HTTP_MOVED_PERM,
            HttpURLConnection.HTTP_MOVED_TEMP,
            HttpURLConnection.HTTP_SEE_OTHER,
            307,
            308);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final HttpClient redirectingClient;

    public UrlFileBackend() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public UrlFileBackend(Duration connectTimeout) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        this.redirectingClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Gets a handle for an absolute http or https URL.
     *
     * @param url the URL
     * @return the handle
     * @throws IllegalArgumentException if the URL is malformed, relative or of another scheme
     */
    public UrlFile file(String url) {
        URI uri = URI.create(url);
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("Expected an http or https URL but got " + url);
        }
        if (uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
        return new UrlFile(this, uri);
    }

    FileType typeOf(URI uri) throws IOException {
        int status = head(uri, false).statusCode();
        if (status == HttpURLConnection.HTTP_OK) {
            return FileType.FILE;
        } else if (REDIRECT_CODES.contains(status)) {
            return FileType.LINK;
        }
        return FileType.ABSENT;
    }

    String redirectTarget(URI uri) throws IOException {
        HttpResponse<Void> response = head(uri, false);
        if (!REDIRECT_CODES.contains(response.statusCode())) {
            return null;
        }
        return response.headers().firstValue("Location").orElse(null);
    }

    /**
     * Gets the Content-Length a URL reports after following redirects.
     *
     * @return the length, or -1 if the URL does not answer 200 or sends no usable length
     */
    long contentLength(URI uri) throws IOException {
        HttpResponse<Void> response = head(uri, true);
        if (response.statusCode() != HttpURLConnection.HTTP_OK) {
            return -1;
        }
        return response.headers().firstValueAsLong("Content-Length").orElse(-1);
    }

    InputStream open(URI uri) throws IOException {
        LOGGER.debug("Opening {} for reading", uri);
        HttpRequest request = HttpRequest.newBuilder(uri).GET().build();
        HttpResponse<InputStream> response = send(redirectingClient, request, HttpResponse.BodyHandlers.ofInputStream());

        int status = response.statusCode();
        if (status == HttpURLConnection.HTTP_OK) {
            return response.body();
        }

        response.body().close();
        String path = uri.toString();
        String message = "URL " + path + " returned HTTP status code " + status;
        switch (status) {
            case HttpURLConnection.HTTP_NOT_FOUND:
            case HttpURLConnection.HTTP_GONE:
                throw new NotFoundException(path, status, message, null);
            case HttpURLConnection.HTTP_UNAUTHORIZED:
            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new PermissionDeniedException(path, status, message, null);
            default:
                throw new FileOperationException(FileErrorType.UNEXPECTED_ERROR, path, status, message, null);
        }
    }

    private HttpResponse<Void> head(URI uri, boolean followRedirects) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Void> response = send(followRedirects ? redirectingClient : client, request,
                HttpResponse.BodyHandlers.discarding());
        LOGGER.debug("HEAD {} answered {}", uri, response.statusCode());
        return response;
    }

    private static <T> HttpResponse<T> send(HttpClient httpClient, HttpRequest request,
            HttpResponse.BodyHandler<T> handler) throws IOException {
        try {
            return httpClient.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while requesting " + request.uri());
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    @Override
    public String toString() {
        return "url";
    }
}
