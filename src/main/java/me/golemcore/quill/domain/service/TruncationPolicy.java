package me.golemcore.quill.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.quill.domain.model.Message;
import me.golemcore.quill.domain.model.TruncationResult;
import me.golemcore.quill.port.outbound.TokenCounterPort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Bounds a message sequence to a token budget by dropping the oldest messages.
 *
 * <p>
 * The result is always the longest contiguous suffix of the input that fits
 * the budget. Scanning runs from the newest message backwards and stops at the
 * first message that would overflow it. If the newest message alone is larger
 * than the budget it is kept on its own and the result is marked
 * {@link TruncationResult#overBudget()}; the sequence is never emptied.
 *
 * <p>
 * Token counting failures are not propagated: the message is charged its
 * UTF-8 byte length, which no byte-level BPE encoding can exceed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TruncationPolicy {

    private final TokenCounterPort tokenCounter;

    public TruncationResult truncate(List<Message> messages, int maxTokens) {
        requireValidBudget(maxTokens);
        if (messages == null || messages.isEmpty()) {
            return TruncationResult.empty();
        }

        int total = messages.size();
        int keepFrom = total;
        long kept = 0;
        for (int index = total - 1; index >= 0; index--) {
            long messageTokens = countTokens(messages.get(index));
            if (kept + messageTokens > maxTokens) {
                break;
            }
            kept += messageTokens;
            keepFrom = index;
        }

        boolean overBudget = false;
        if (keepFrom == total) {
            // newest message alone is over budget, keep it anyway
            keepFrom = total - 1;
            kept = countTokens(messages.get(keepFrom));
            overBudget = true;
            log.warn("[Truncation] Newest message needs {} tokens, budget is {}; keeping it alone",
                    kept, maxTokens);
        }

        if (keepFrom > 0) {
            log.debug("[Truncation] Dropped {} of {} messages to fit {} tokens", keepFrom, total, maxTokens);
        }

        return TruncationResult.builder()
                .messages(List.copyOf(messages.subList(keepFrom, total)))
                .tokenCount(saturate(kept))
                .droppedCount(keepFrom)
                .overBudget(overBudget)
                .build();
    }

    /**
     * Sums the token cost of all messages, saturating at
     * {@link Integer#MAX_VALUE}.
     */
    public int countTokens(List<Message> messages) {
        if (messages == null) {
            return 0;
        }
        long total = 0;
        for (Message message : messages) {
            total += countTokens(message);
        }
        return saturate(total);
    }

    /**
     * Token cost of one message's content.
     */
    public int countTokens(Message message) {
        if (message == null) {
            return 0;
        }
        String content = message.getContent();
        try {
            return Math.max(0, tokenCounter.count(content));
        } catch (RuntimeException e) {
            int worstCase = worstCaseTokens(content);
            log.warn("[Truncation] Token counting failed ({}), charging worst case of {} tokens",
                    e.getMessage(), worstCase);
            return worstCase;
        }
    }

    /**
     * Rejects budgets below one token.
     *
     * @throws InvalidBudgetException
     *             if {@code maxTokens < 1}
     */
    public static void requireValidBudget(int maxTokens) {
        if (maxTokens < 1) {
            throw new InvalidBudgetException(maxTokens);
        }
    }

    private static int saturate(long tokens) {
        return (int) Math.min(Integer.MAX_VALUE, tokens);
    }

    static int worstCaseTokens(String content) {
        if (content == null) {
            return 1;
        }
        return Math.max(1, content.getBytes(StandardCharsets.UTF_8).length);
    }

    /**
     * Raised when a history budget below one token is configured.
     */
    public static final class InvalidBudgetException extends IllegalArgumentException {

        private final int requestedMaxTokens;

        public InvalidBudgetException(int requestedMaxTokens) {
            super("maxTokens must be at least 1, got " + requestedMaxTokens);
            this.requestedMaxTokens = requestedMaxTokens;
        }

        public int requestedMaxTokens() {
            return requestedMaxTokens;
        }
    }
}
