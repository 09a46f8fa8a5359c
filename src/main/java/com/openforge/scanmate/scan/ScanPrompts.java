package com.openforge.scanmate.scan;

import com.openforge.scanmate.support.ModelReplies;
import com.openforge.scanmate.support.TextLimits;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed instruction, payload layout and report post-processing of the
 * analyze stage.
 */
final class ScanPrompts {

    static final String INSTRUCTION =
            "You are Mr. White, a cybersecurity specialist analyzing webpages for threats. "
            + "Reply with ONLY this format:\n\n"
            + "Status: <one-line threat assessment>\n"
            + "Threat Level: <Safe|Low|Medium|High|Critical>\n"
            + "Link: <URL>\n"
            + "Redirects: <Yes/No> <describe redirect chain if present>\n\n"
            + "1. Main purpose: <brief description of site purpose and function>\n"
            + "2. Content summary: <describe key content, topics, products or services on the page>\n"
            + "3. Security concerns: <list any suspicious elements, forms, scripts, or content>\n"
            + "4. Recommendation: <clear advice on whether to proceed or take caution>\n\n"
            + "Be extremely concise but thorough in describing the actual website content. "
            + "Focus on detecting phishing, malware, suspicious forms, unusual scripts, or misleading information. "
            + "Mention specific content elements like login forms, payment options, product offerings, "
            + "or specific topics discussed. "
            + "If the URL was shortened or redirected, analyze whether the redirect is suspicious or potentially misleading.";

    static final String THREAT_LEVEL_MARKER = "Threat Level:";
    static final String TRUNCATION_MARKER   = "... [content truncated for analysis]";

    private ScanPrompts() {
    }

    static String payload(String url, String redirectDescription, int statusCode, String content) {
        return "[SCAN_PAGE] URL: %s\n\nRedirect info: %s\n\nStatus Code: %d\n\n%s"
                .formatted(url, redirectDescription, statusCode, content);
    }

    /** Page body as the model sees it: capped, with a warning for error statuses. */
    static String analysableContent(String body, int statusCode, int contentLimit) {
        String content = TextLimits.truncate(body == null ? "" : body, contentLimit, TRUNCATION_MARKER);
        if (statusCode >= 400) {
            content = "Warning: URL returned status code %d\n\n%s".formatted(statusCode, content);
        }
        return content;
    }

    static String normaliseReport(String raw, int reportLimit) {
        List<String> lines = new ArrayList<>(ModelReplies.cleanLines(raw));
        boolean hasThreatLevel = lines.stream().anyMatch(line -> line.startsWith(THREAT_LEVEL_MARKER));
        if (!hasThreatLevel) {
            lines.add(0, THREAT_LEVEL_MARKER + " Unknown");
        }
        return TextLimits.capAtSentence(String.join("\n", lines), reportLimit);
    }

    static String degradedReport(String url, String redirectDescription) {
        return "Status: Analysis interrupted but redirect information was captured\n"
                + "Threat Level: Unknown\n"
                + "Link: " + url + "\n"
                + "Redirects: " + redirectDescription + "\n\n"
                + "1. Main purpose: Analysis was interrupted, but redirect information was captured\n"
                + "2. Content summary: Unable to complete full analysis\n"
                + "3. Security concerns: Unknown - scan was interrupted\n"
                + "4. Recommendation: Exercise caution when clicking links";
    }
}
