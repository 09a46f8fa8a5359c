package com.openforge.scanmate.fetch;

import java.net.URI;
import java.util.List;

/**
 * Result of a redirect-tracking probe.
 *
 * @param chain    every URL visited, starting with the requested one and ending
 *                 with {@code finalUrl}; a single element means no redirect
 * @param finalUrl where the redirect chain ended
 * @param status   HTTP status of the last response
 */
public record RedirectProbe(List<URI> chain, URI finalUrl, int status) {

    public RedirectProbe {
        chain = List.copyOf(chain);
    }

    public boolean redirected() {
        return chain.size() > 1;
    }
}
