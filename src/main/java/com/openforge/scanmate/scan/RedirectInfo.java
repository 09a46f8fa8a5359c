package com.openforge.scanmate.scan;

import com.openforge.scanmate.fetch.RedirectProbe;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * What the redirect check learned about a URL.
 *
 * @param description text sent to the model and stored with the scan record
 * @param finalUrl    URL the content fetch should target
 * @param known       true when the probe answered (a chain or a definite "no")
 */
public record RedirectInfo(String description, URI finalUrl, boolean known) {

    public static RedirectInfo fromProbe(RedirectProbe probe) {
        if (!probe.redirected()) {
            return new RedirectInfo("No", probe.finalUrl(), true);
        }
        String chain = probe.chain().stream()
                .map(URI::toString)
                .collect(Collectors.joining(" -> "));
        return new RedirectInfo("Yes - " + chain, probe.finalUrl(), true);
    }

    public static RedirectInfo timedOut(URI original) {
        return new RedirectInfo("Unknown - check timed out", original, false);
    }

    public static RedirectInfo failed(URI original) {
        return new RedirectInfo("Error checking redirects", original, false);
    }
}
