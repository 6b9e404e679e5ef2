package com.forgemind.core.evolution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextDiffTest {

    @Test
    @DisplayName("marks changed lines and keeps common ones")
    void changedLine() {
        String diff = TextDiff.lines("Summarize {{query}}.\nBe brief.", "Summarize {{query}}.\nUse bullet points.\nBe brief.");

        assertEquals("  Summarize {{query}}.\n+ Use bullet points.\n  Be brief.", diff);
    }

    @Test
    @DisplayName("removed lines are prefixed with a minus")
    void removedLine() {
        assertEquals("- Intro\n  Body", TextDiff.lines("Intro\nBody", "Body"));
    }

    @Test
    @DisplayName("an empty side diffs as all additions")
    void emptyBefore() {
        assertEquals("+ a\n+ b", TextDiff.lines("", "a\nb"));
    }

    @Test
    @DisplayName("identical compares exact text including null")
    void identical() {
        assertTrue(TextDiff.identical("x", "x"));
        assertFalse(TextDiff.identical("x", "x "));
        assertTrue(TextDiff.identical(null, null));
    }
}
