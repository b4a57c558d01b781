package me.golemcore.quill.domain.service;

import me.golemcore.quill.domain.model.ParsedResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();

    @Test
    void shouldTreatWholeResponseAsNarrativeWithoutTags() {
        ParsedResponse parsed = parser.parse("  The trees stood silent.  ");

        assertEquals("The trees stood silent.", parsed.narrative());
        assertEquals("", parsed.thinking());
        assertFalse(parsed.hasThinking());
    }

    @Test
    void shouldExtractThinkingBlocks() {
        String raw = "<think>Plan the scene.</think>\nThe door creaked.\n<THINK>\nKeep it tense.\n</THINK>It opened.";

        ParsedResponse parsed = parser.parse(raw);

        assertEquals("The door creaked.\nIt opened.", parsed.narrative());
        assertEquals("Plan the scene.\nKeep it tense.", parsed.thinking());
        assertTrue(parsed.hasThinking());
    }

    @Test
    void shouldReturnEmptyNarrativeWhenOnlyThinking() {
        ParsedResponse parsed = parser.parse("<think>nothing to say</think>");

        assertEquals("", parsed.narrative());
        assertEquals("nothing to say", parsed.thinking());
    }

    @Test
    void shouldHandleNullResponse() {
        ParsedResponse parsed = parser.parse(null);

        assertEquals("", parsed.narrative());
        assertEquals("", parsed.thinking());
    }
}
