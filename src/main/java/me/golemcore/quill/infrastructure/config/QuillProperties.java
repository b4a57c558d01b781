package me.golemcore.quill.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the writing assistant, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code quill.*} prefix:
 * <ul>
 * <li>{@link MemoryProperties} - conversation history budget and load
 * simulation</li>
 * <li>{@link TokenizerProperties} - token counting encoding</li>
 * <li>{@link GenerationProperties} - parameters sent with each model call</li>
 * <li>{@link PromptsProperties} - system prompt defaults</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "quill")
@Data
public class QuillProperties {

    private MemoryProperties memory = new MemoryProperties();
    private TokenizerProperties tokenizer = new TokenizerProperties();
    private GenerationProperties generation = new GenerationProperties();
    private PromptsProperties prompts = new PromptsProperties();

    @Data
    public static class MemoryProperties {
        private int maxTokens = 12000;
        private int simulationChunks = 5;
        private String simulatedPrompt = "Continue the story.";
    }

    @Data
    public static class TokenizerProperties {
        private String model = "gpt-3.5-turbo";
    }

    @Data
    public static class GenerationProperties {
        private String model = "llama-3.3-70b-versatile";
        private double temperature = 0.7;
        private int maxResponseTokens = 1024;
        private long timeoutMs = 120_000;
        private String defaultGuidance = "Continue the story.";
        private String xmlTag = "";
    }

    @Data
    public static class PromptsProperties {
        private String defaultName = "Narrative Writer";
    }
}
