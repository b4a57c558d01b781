package me.golemcore.quill.domain.service;

import me.golemcore.quill.domain.model.Message;
import me.golemcore.quill.domain.model.MessageRole;
import me.golemcore.quill.infrastructure.config.QuillProperties;
import me.golemcore.quill.port.outbound.TokenCounterPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistorySimulatorTest {

    private static final String PROMPT = "Continue the story.";

    private HistorySimulator simulator;

    @BeforeEach
    void setUp() {
        TokenCounterPort counter = text -> text == null ? 0 : text.length();
        QuillProperties properties = new QuillProperties();
        HistoryStoreFactory factory = new HistoryStoreFactory(new TruncationPolicy(counter), properties);
        simulator = new HistorySimulator(factory, properties);
    }

    @Test
    void shouldSimulatePairsFromLastChunksInOriginalOrder() {
        List<String> chunks = List.of("c1", "c2", "c3", "c4", "c5", "c6", "c7");
        List<String> canon = new ArrayList<>(chunks);

        HistoryStore store = simulator.build(canon, 5, 100_000);

        List<Message> committed = store.committedSequence();
        assertEquals(10, committed.size());
        for (int pair = 0; pair < 5; pair++) {
            Message user = committed.get(pair * 2);
            Message assistant = committed.get(pair * 2 + 1);
            assertEquals(MessageRole.USER, user.getRole());
            assertEquals(PROMPT, user.getContent());
            assertEquals(MessageRole.ASSISTANT, assistant.getRole());
            assertEquals("c" + (pair + 3), assistant.getContent());
        }
        assertFalse(store.hasPendingProposal());
        assertEquals(chunks, canon);
    }

    @Test
    void shouldUseAllChunksWhenFewerThanLimit() {
        List<Message> messages = simulator.simulate(List.of("only one", "two"), 5);

        assertEquals(4, messages.size());
        assertEquals("only one", messages.get(1).getContent());
        assertEquals("two", messages.get(3).getContent());
    }

    @Test
    void shouldTruncateSimulatedHistoryToBudget() {
        List<String> chunks = List.of("aaaaaaaaaa", "bbbbbbbbbb", "cccccccccc");

        // each pair costs 19 (prompt) + 10 (chunk) tokens
        HistoryStore store = simulator.build(chunks, 3, 50);

        List<Message> committed = store.committedSequence();
        assertTrue(store.getTokenUsage().usedTokens() <= 50);
        assertEquals("cccccccccc", committed.get(committed.size() - 1).getContent());
        assertEquals(3, committed.size());
    }

    @Test
    void shouldReturnEmptyHistoryForNoChunksOrNonPositiveLimit() {
        assertTrue(simulator.simulate(List.of(), 5).isEmpty());
        assertTrue(simulator.simulate(null, 5).isEmpty());
        assertTrue(simulator.simulate(List.of("text"), 0).isEmpty());
        assertTrue(simulator.simulate(List.of("text"), -1).isEmpty());
    }

    @Test
    void shouldSkipBlankChunks() {
        List<Message> messages = simulator.simulate(List.of("first", "  ", "second"), 5);

        assertEquals(4, messages.size());
        assertEquals("second", messages.get(3).getContent());
    }

    @Test
    void shouldUseConfiguredPrompt() {
        TokenCounterPort counter = text -> 1;
        QuillProperties properties = new QuillProperties();
        properties.getMemory().setSimulatedPrompt("(go on)");
        HistorySimulator custom = new HistorySimulator(
                new HistoryStoreFactory(new TruncationPolicy(counter), properties), properties);

        List<Message> messages = custom.simulate(List.of("chunk"), 1);

        assertEquals("(go on)", messages.get(0).getContent());
    }
}
