package com.openforge.scanmate.support;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelRepliesTest {

    @Test
    void cleanLines_stripsEndMarkersAndBlankLines() {
        String raw = "  Status: fine  \n\n\n   Threat Level: Low</s></s>\r\n\t\n";

        assertEquals(List.of("Status: fine", "Threat Level: Low"), ModelReplies.cleanLines(raw));
    }

    @Test
    void cleanLines_handlesEmptyInput() {
        assertTrue(ModelReplies.cleanLines(null).isEmpty());
        assertTrue(ModelReplies.cleanLines("</s>").isEmpty());
    }
}
