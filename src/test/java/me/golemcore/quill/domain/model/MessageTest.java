package me.golemcore.quill.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageTest {

    @Test
    void shouldCreateMessagesForEachRole() {
        Message user = Message.user("hi");
        Message assistant = Message.assistant("hello");

        assertTrue(user.isUserMessage());
        assertFalse(user.isAssistantMessage());
        assertTrue(assistant.isAssistantMessage());
        assertEquals("assistant", assistant.getRole().wireName());
    }

    @Test
    void shouldTreatNullContentAsEmpty() {
        assertEquals("", Message.user(null).getContent());
        assertEquals("", Message.builder().role(MessageRole.ASSISTANT).build().getContent());
    }

    @Test
    void shouldRequireRole() {
        assertThrows(NullPointerException.class, () -> Message.builder().content("x").build());
    }

    @Test
    void shouldCompareByValue() {
        assertEquals(Message.user("same"), Message.user("same"));
    }

    @Test
    void shouldCopyIntoUnmodifiableListWithoutNulls() {
        List<Message> source = new ArrayList<>(Arrays.asList(Message.user("a"), null, Message.assistant("b")));

        List<Message> copy = Message.copyOf(source);
        source.clear();

        assertEquals(List.of(Message.user("a"), Message.assistant("b")), copy);
        assertThrows(UnsupportedOperationException.class, () -> copy.add(Message.user("c")));
        assertTrue(Message.copyOf(null).isEmpty());
    }
}
