package com.openforge.scanmate.fetch;

import java.net.URI;
import java.time.Duration;

/**
 * Narrow adapter over the external page-fetch service.
 * Both calls block, honour thread interruption, and fail with {@link PageFetchException}.
 */
public interface PageFetcher {

    /** Lightweight request that follows redirects and reports the chain. */
    RedirectProbe probeRedirects(URI url, Duration requestTimeout);

    /** Full GET of the page body; non-2xx statuses are returned, not thrown. */
    FetchedPage fetch(URI url, Duration requestTimeout);
}
