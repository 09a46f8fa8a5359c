package com.openforge.scanmate.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextLimitsTest {

    @Test
    @DisplayName("Text within the limit is returned unchanged")
    void capAtSentence_keepsShortText() {
        assertEquals("Short. Text", TextLimits.capAtSentence("Short. Text", 50));
        assertNull(TextLimits.capAtSentence(null, 10));
    }

    @Test
    @DisplayName("Long text is cut back to the last full stop inside the limit")
    void capAtSentence_cutsAtLastStop() {
        String text = "First sentence. Second sentence. Third sentence runs long";

        String capped = TextLimits.capAtSentence(text, 40);

        assertEquals("First sentence. Second sentence.", capped);
    }

    @Test
    @DisplayName("Without any full stop the result still respects the limit")
    void capAtSentence_withoutStopNeverExceedsLimit() {
        String capped = TextLimits.capAtSentence("a".repeat(100), 20);

        assertEquals(20, capped.length());
        assertTrue(capped.endsWith("."));
    }

    @Test
    void truncate_appendsMarkerOnlyWhenCut() {
        assertEquals("abc", TextLimits.truncate("abc", 5, "..."));
        assertEquals("abcde[cut]", TextLimits.truncate("abcdefgh", 5, "[cut]"));
        assertEquals("ab...", TextLimits.preview("abcdef", 2));
    }
}
