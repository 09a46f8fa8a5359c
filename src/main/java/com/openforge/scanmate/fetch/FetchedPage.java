package com.openforge.scanmate.fetch;

import java.net.URI;

/** Full content fetch of one URL. */
public record FetchedPage(int status, URI finalUrl, String body) {

    public boolean successful() {
        return status < 400;
    }
}
