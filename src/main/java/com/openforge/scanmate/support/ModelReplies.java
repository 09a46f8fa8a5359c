package com.openforge.scanmate.support;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Clean-up of raw model output before it is shown or stored.
 */
public final class ModelReplies {

    private static final Pattern END_MARKERS = Pattern.compile("(</s>)+");

    private ModelReplies() {
    }

    /** Strips end-of-sequence markers, trims every line and drops blank ones. */
    public static List<String> cleanLines(String raw) {
        if (raw == null) {
            return List.of();
        }
        String stripped = END_MARKERS.matcher(raw).replaceAll("").strip();
        return Arrays.stream(stripped.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
