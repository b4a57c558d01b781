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
import me.golemcore.quill.domain.model.HistorySnapshot;
import me.golemcore.quill.infrastructure.config.QuillProperties;
import org.springframework.stereotype.Service;

/**
 * Creates independent {@link HistoryStore} instances sharing the application's
 * truncation policy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryStoreFactory {

    private final TruncationPolicy truncationPolicy;
    private final QuillProperties properties;

    /**
     * Creates an empty store with the configured {@code quill.memory.max-tokens}
     * budget.
     */
    public HistoryStore create() {
        return create(properties.getMemory().getMaxTokens());
    }

    public HistoryStore create(int maxTokens) {
        return new HistoryStore(truncationPolicy, maxTokens);
    }

    /**
     * Rebuilds a store from a persisted snapshot. A snapshot carrying an
     * invalid budget falls back to the configured one.
     */
    public HistoryStore restore(HistorySnapshot snapshot) {
        int maxTokens = snapshot.maxTokens();
        if (maxTokens < 1) {
            log.warn("[History] Snapshot budget {} is invalid, using configured {}",
                    maxTokens, properties.getMemory().getMaxTokens());
            maxTokens = properties.getMemory().getMaxTokens();
        }
        HistoryStore store = create(maxTokens);
        store.restore(snapshot);
        return store;
    }
}
