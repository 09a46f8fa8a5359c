package com.openforge.scanmate.scan;

import com.openforge.scanmate.task.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * Turns user input into a scan target.  HTTP callers must send a complete
 * URL; socket callers may omit the scheme.
 */
public final class ScanTargets {

    private static final Pattern WEB_SCHEME = Pattern.compile("(?i)https?://");

    private ScanTargets() {
    }

    /** Strict parse: scheme http/https and a host are required. */
    public static URI strict(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Missing 'url'");
        }
        return parse(url.strip());
    }

    /** Lenient parse: a missing scheme is replaced with {@code http://}. */
    public static URI lenient(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Missing URL to scan");
        }
        String candidate = url.strip();
        if (!WEB_SCHEME.matcher(candidate).lookingAt()) {
            candidate = "http://" + candidate;
        }
        return parse(candidate);
    }

    /** Whether a free-text socket message should be treated as a URL. */
    public static boolean looksLikeUrl(String message) {
        if (message == null) {
            return false;
        }
        String candidate = message.strip();
        return candidate.startsWith("http") || candidate.contains(".");
    }

    private static URI parse(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            boolean web = "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
            if (!web || uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ValidationException("Invalid URL format");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL format");
        }
    }
}
