package me.golemcore.quill.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CanonSegmenterTest {

    private final CanonSegmenter segmenter = new CanonSegmenter();

    @Test
    void shouldSplitOnBlankLines() {
        String text = "First paragraph.\nStill first.\n\nSecond paragraph.\n\n\n\nThird.";

        List<String> chunks = segmenter.segment(text);

        assertEquals(List.of("First paragraph.\nStill first.", "Second paragraph.", "Third."), chunks);
    }

    @Test
    void shouldHandleWindowsLineEndingsAndWhitespaceOnlyLines() {
        String text = "  One.\r\n\r\nTwo.\n   \nThree.  ";

        assertEquals(List.of("One.", "Two.", "Three."), segmenter.segment(text));
    }

    @Test
    void shouldReturnEmptyForBlankText() {
        assertTrue(segmenter.segment("   \n\n  ").isEmpty());
        assertTrue(segmenter.segment(null).isEmpty());
    }

    @Test
    void shouldJoinChunksWithBlankLines() {
        assertEquals("a\n\nb", segmenter.join(List.of("a", "b")));
        assertEquals("", segmenter.join(List.of()));
    }
}
