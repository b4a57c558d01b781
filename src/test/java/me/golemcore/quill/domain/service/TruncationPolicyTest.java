package me.golemcore.quill.domain.service;

import me.golemcore.quill.domain.model.Message;
import me.golemcore.quill.domain.model.TruncationResult;
import me.golemcore.quill.port.outbound.TokenCounterPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TruncationPolicyTest {

    private TruncationPolicy policy;

    @BeforeEach
    void setUp() {
        // one token per character keeps budgets easy to reason about
        TokenCounterPort counter = text -> text == null ? 0 : text.length();
        policy = new TruncationPolicy(counter);
    }

    @Test
    void shouldDropOldestMessageWhenBudgetIsExceeded() {
        Message hello = Message.user("hello");
        Message hi = Message.assistant("hi");

        TruncationResult result = policy.truncate(List.of(hello, hi), 3);

        assertEquals(List.of(hi), result.messages());
        assertEquals(2, result.tokenCount());
        assertEquals(1, result.droppedCount());
        assertFalse(result.overBudget());
    }

    @Test
    void shouldKeepEverythingWhenWithinBudget() {
        List<Message> messages = List.of(Message.user("abc"), Message.assistant("defg"));

        TruncationResult result = policy.truncate(messages, 7);

        assertEquals(messages, result.messages());
        assertEquals(7, result.tokenCount());
        assertEquals(0, result.droppedCount());
    }

    @Test
    void shouldReturnLongestContiguousSuffix() {
        List<Message> messages = List.of(
                Message.user("aaaa"),
                Message.assistant("b"),
                Message.user("cccccc"),
                Message.assistant("dd"),
                Message.user("e"));

        TruncationResult result = policy.truncate(messages, 8);

        // "b" would still fit by itself, but the scan stops at "cccccc"
        assertEquals(messages.subList(3, 5), result.messages());
        assertEquals(3, result.tokenCount());
        assertEquals(3, result.droppedCount());
    }

    @Test
    void shouldKeepOversizedNewestMessageAloneAndFlagIt() {
        Message small = Message.user("ok");
        Message huge = Message.assistant("this message is far too long");

        TruncationResult result = policy.truncate(List.of(small, huge), 5);

        assertEquals(List.of(huge), result.messages());
        assertTrue(result.overBudget());
        assertEquals(huge.getContent().length(), result.tokenCount());
    }

    @Test
    void shouldReturnEmptyResultForEmptyInput() {
        TruncationResult result = policy.truncate(List.of(), 10);

        assertTrue(result.messages().isEmpty());
        assertFalse(result.overBudget());
    }

    @Test
    void shouldRejectBudgetBelowOne() {
        TruncationPolicy.InvalidBudgetException exception = assertThrows(
                TruncationPolicy.InvalidBudgetException.class,
                () -> policy.truncate(List.of(Message.user("x")), 0));

        assertEquals(0, exception.requestedMaxTokens());
    }

    @Test
    void shouldChargeWorstCaseWhenCounterFails() {
        TokenCounterPort failing = text -> {
            if (text.contains("boom")) {
                throw new IllegalStateException("unsupported characters");
            }
            return text.length();
        };
        TruncationPolicy fragile = new TruncationPolicy(failing);
        Message broken = Message.user("boom");

        assertEquals(4, fragile.countTokens(broken));

        TruncationResult result = fragile.truncate(List.of(broken, Message.assistant("fine")), 6);
        assertEquals(1, result.messages().size());
        assertEquals("fine", result.messages().get(0).getContent());
    }

    @Test
    void shouldChargeUtf8BytesAsWorstCase() {
        assertEquals(4, TruncationPolicy.worstCaseTokens("éé"));
        assertEquals(1, TruncationPolicy.worstCaseTokens(""));
        assertEquals(1, TruncationPolicy.worstCaseTokens(null));
    }

    @Test
    void shouldNeverReorderMessages() {
        List<Message> messages = List.of(
                Message.user("1"), Message.assistant("2"), Message.user("3"), Message.assistant("4"));

        TruncationResult result = policy.truncate(messages, 3);

        assertEquals(List.of("2", "3", "4"),
                result.messages().stream().map(Message::getContent).toList());
    }

    @Test
    void shouldNotOverflowWhenCountsAreHuge() {
        TokenCounterPort huge = text -> "big".equals(text) ? Integer.MAX_VALUE : 10;
        TruncationPolicy hugePolicy = new TruncationPolicy(huge);
        Message big = Message.user("big");
        Message small = Message.assistant("small");

        TruncationResult result = hugePolicy.truncate(List.of(big, small), 100);

        assertEquals(List.of(small), result.messages());
        assertEquals(10, result.tokenCount());
        assertEquals(1, result.droppedCount());

        TruncationResult oversized = hugePolicy.truncate(List.of(small, big), 100);
        assertEquals(List.of(big), oversized.messages());
        assertEquals(Integer.MAX_VALUE, oversized.tokenCount());
        assertTrue(oversized.overBudget());

        assertEquals(Integer.MAX_VALUE, hugePolicy.countTokens(List.of(big, big, small)));
    }
}
