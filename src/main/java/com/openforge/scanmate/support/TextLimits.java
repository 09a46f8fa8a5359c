package com.openforge.scanmate.support;

/**
 * Length caps applied to model output and fetched content.
 */
public final class TextLimits {

    private TextLimits() {
    }

    /**
     * Caps {@code text} at {@code max} characters, cutting back to the last
     * full stop inside the limit and terminating with one.  Text that fits is
     * returned unchanged.
     */
    public static String capAtSentence(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        String head = text.substring(0, max);
        int lastStop = head.lastIndexOf('.');
        String sentence = lastStop >= 0 ? head.substring(0, lastStop) : head;
        // The trailing stop may push the result one past max when no stop was found
        if (sentence.length() + 1 > max) {
            sentence = sentence.substring(0, max - 1);
        }
        return sentence + ".";
    }

    /** Hard cut at {@code max} characters followed by {@code marker}. */
    public static String truncate(String text, int max, String marker) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + marker;
    }

    /** First {@code max} characters followed by "..." when longer. */
    public static String preview(String text, int max) {
        return truncate(text, max, "...");
    }
}
