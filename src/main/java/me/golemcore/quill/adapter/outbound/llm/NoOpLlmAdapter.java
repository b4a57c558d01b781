package me.golemcore.quill.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.quill.domain.model.LlmRequest;
import me.golemcore.quill.domain.model.LlmResponse;
import me.golemcore.quill.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no provider is wired into the application.
 *
 * <p>
 * This adapter always returns a placeholder response without calling any
 * external API, so the story workflow can be exercised end to end.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .model("none")
                .finishReason("stop")
                .build());
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
