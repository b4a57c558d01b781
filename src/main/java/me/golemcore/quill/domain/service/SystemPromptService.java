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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.quill.infrastructure.config.QuillProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of named system prompts with one active prompt.
 *
 * <p>
 * The built-in writer prompt is registered under
 * {@code quill.prompts.default-name} and cannot be deleted, so there is always
 * a prompt to fall back to.
 */
@Service
@Slf4j
public class SystemPromptService {

    static final String DEFAULT_PROMPT_CONTENT = """
            You are a creative writing assistant collaborating with the user on a story.
            Generate only the requested narrative content, continuing from the preceding story text and the user's guidance.
            Do NOT include meta-commentary, apologies, questions, or explanations about your process unless asked.
            Write publication-ready prose in the established style and tone.
            If you need to think or plan, put it inside <think>...</think> tags; they are hidden from the user.""";

    private final String defaultName;
    private final Map<String, String> prompts = new TreeMap<>();
    private String activeName;

    public SystemPromptService(QuillProperties properties) {
        this.defaultName = properties.getPrompts().getDefaultName();
        prompts.put(defaultName, DEFAULT_PROMPT_CONTENT);
        this.activeName = defaultName;
    }

    public synchronized List<String> getPromptNames() {
        return new ArrayList<>(prompts.keySet());
    }

    public synchronized String getActivePromptName() {
        if (!prompts.containsKey(activeName)) {
            log.warn("[Prompts] Active prompt '{}' not found, falling back to '{}'", activeName, defaultName);
            activeName = defaultName;
        }
        return activeName;
    }

    public synchronized String getActivePromptContent() {
        return prompts.get(getActivePromptName());
    }

    public synchronized String getPromptContent(String name) {
        return prompts.get(name);
    }

    /**
     * @return {@code false} if no prompt with that name exists
     */
    public synchronized boolean setActivePrompt(String name) {
        if (name == null || !prompts.containsKey(name)) {
            log.warn("[Prompts] Cannot activate unknown prompt '{}'", name);
            return false;
        }
        activeName = name;
        return true;
    }

    /**
     * Creates or overwrites a prompt.
     */
    public synchronized void savePrompt(String name, String content) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Prompt name is required");
        }
        prompts.put(name.strip(), content != null ? content : "");
        log.info("[Prompts] Saved prompt '{}'", name.strip());
    }

    /**
     * @return {@code false} for the default prompt or an unknown name
     */
    public synchronized boolean deletePrompt(String name) {
        if (defaultName.equals(name)) {
            log.warn("[Prompts] The default prompt '{}' cannot be deleted", name);
            return false;
        }
        boolean removed = prompts.remove(name) != null;
        if (removed && name.equals(activeName)) {
            activeName = defaultName;
        }
        return removed;
    }
}
