package me.golemcore.quill.adapter.outbound.tokenizer;

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

import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.quill.infrastructure.config.QuillProperties;
import me.golemcore.quill.port.outbound.TokenCounterPort;
import org.springframework.stereotype.Component;

/**
 * Token counter backed by the langchain4j OpenAI token count estimator.
 *
 * <p>
 * The encoding is resolved from {@code quill.tokenizer.model} on first use.
 * When the model is unknown to the estimator, counting falls back to a
 * character-based estimate of roughly four characters per token.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jTokenCounterAdapter implements TokenCounterPort {

    private static final int CHARS_PER_TOKEN = 4;

    private final QuillProperties properties;

    private OpenAiTokenCountEstimator estimator;
    private volatile boolean initialized = false;

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        OpenAiTokenCountEstimator current = resolveEstimator();
        if (current == null) {
            return estimateByCharacters(text);
        }
        return current.estimateTokenCountInText(text);
    }

    private OpenAiTokenCountEstimator resolveEstimator() {
        if (!initialized) {
            initialize();
        }
        return estimator;
    }

    private synchronized void initialize() {
        if (initialized) {
            return;
        }
        String model = properties.getTokenizer().getModel();
        try {
            this.estimator = new OpenAiTokenCountEstimator(model);
            log.info("[Tokenizer] Using OpenAI encoding for model: {}", model);
        } catch (RuntimeException e) {
            log.warn("[Tokenizer] No encoding for model '{}', falling back to character estimate: {}",
                    model, e.getMessage());
            this.estimator = null;
        }
        initialized = true;
    }

    static int estimateByCharacters(String text) {
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
