package com.openforge.scanmate.fetch;

import com.openforge.scanmate.task.ErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * {@link PageFetcher} on the JDK HttpClient.
 *
 * The client must be built with {@code Redirect.NORMAL}; the redirect chain is
 * rebuilt from {@link HttpResponse#previousResponse()}.
 */
@Slf4j
public class HttpPageFetcher implements PageFetcher {

    static final String USER_AGENT = "Mozilla/5.0 (compatible; ScanMate/1.0; +threat-scan)";

    private final HttpClient httpClient;

    public HttpPageFetcher(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RedirectProbe probeRedirects(URI url, Duration requestTimeout) {
        HttpRequest request = baseRequest(url, requestTimeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());

        List<URI> chain = chainOf(response);
        log.debug("[Fetch] HEAD {} → {} ({} hop(s))", url, response.uri(), chain.size() - 1);
        return new RedirectProbe(chain, response.uri(), response.statusCode());
    }

    @Override
    public FetchedPage fetch(URI url, Duration requestTimeout) {
        HttpRequest request = baseRequest(url, requestTimeout).GET().build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString());

        String body = response.body() == null ? "" : response.body();
        log.debug("[Fetch] GET {} → HTTP {} body-length={}", url, response.statusCode(), body.length());
        return new FetchedPage(response.statusCode(), response.uri(), body);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest.Builder baseRequest(URI url, Duration requestTimeout) {
        return HttpRequest.newBuilder()
                .uri(url)
                .timeout(requestTimeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8");
    }

    private <B> HttpResponse<B> send(HttpRequest request, HttpResponse.BodyHandler<B> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (HttpTimeoutException e) {
            throw new PageFetchException(ErrorKind.TIMEOUT,
                    "Timed out fetching %s".formatted(request.uri()), e);
        } catch (IOException e) {
            throw new PageFetchException(ErrorKind.UPSTREAM_UNAVAILABLE,
                    "Could not fetch %s: %s".formatted(request.uri(), describe(e)), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(ErrorKind.CANCELLED,
                    "Fetch of %s interrupted".formatted(request.uri()), e);
        } catch (IllegalArgumentException e) {
            throw new PageFetchException(ErrorKind.VALIDATION,
                    "Unsupported URL %s".formatted(request.uri()), e);
        }
    }

    static List<URI> chainOf(HttpResponse<?> last) {
        Deque<URI> chain = new ArrayDeque<>();
        chain.addFirst(last.uri());
        Optional<? extends HttpResponse<?>> previous = last.previousResponse();
        while (previous.isPresent()) {
            HttpResponse<?> hop = previous.get();
            chain.addFirst(hop.uri());
            previous = hop.previousResponse();
        }
        return List.copyOf(chain);
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
