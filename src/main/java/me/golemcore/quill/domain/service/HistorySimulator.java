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
import me.golemcore.quill.infrastructure.config.QuillProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeds conversation memory from previously written story text.
 *
 * <p>
 * Loaded prose has no real dialogue turns, so the last {@code n} chunks are
 * replayed as if the model had written them: each becomes an assistant turn
 * preceded by a fixed "continue" user prompt. Only the conversation memory is
 * built from this tail; the caller keeps every chunk as canon.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistorySimulator {

    private final HistoryStoreFactory historyStoreFactory;
    private final QuillProperties properties;

    /**
     * Returns a clean store whose committed history is the simulated tail of
     * {@code chunks}, bounded to {@code maxTokens}.
     */
    public HistoryStore build(List<String> chunks, int chunkLimit, int maxTokens) {
        HistoryStore store = historyStoreFactory.create(maxTokens);
        store.reset(simulate(chunks, chunkLimit));
        return store;
    }

    /**
     * Synthesizes user/assistant pairs for the last {@code chunkLimit} non-blank
     * chunks, in their original order.
     */
    public List<Message> simulate(List<String> chunks, int chunkLimit) {
        if (chunks == null || chunks.isEmpty() || chunkLimit <= 0) {
            return List.of();
        }
        List<String> usable = chunks.stream()
                .filter(chunk -> chunk != null && !chunk.isBlank())
                .toList();
        int from = Math.max(0, usable.size() - chunkLimit);
        List<String> tail = usable.subList(from, usable.size());

        String prompt = properties.getMemory().getSimulatedPrompt();
        List<Message> messages = new ArrayList<>(tail.size() * 2);
        for (String chunk : tail) {
            messages.add(Message.user(prompt));
            messages.add(Message.assistant(chunk));
        }
        log.info("[History] Simulated {} turns from the last {} of {} chunks",
                messages.size(), tail.size(), usable.size());
        return messages;
    }
}
