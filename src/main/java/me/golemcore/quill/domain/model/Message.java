package me.golemcore.quill.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Single conversation turn stored in the history. Immutable: sequences are
 * copied when they move between committed and proposal state, the messages
 * inside them never change.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    @NonNull
    MessageRole role;

    @NonNull
    @Builder.Default
    String content = "";

    public static Message user(String content) {
        return Message.builder().role(MessageRole.USER).content(content != null ? content : "").build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(MessageRole.ASSISTANT).content(content != null ? content : "").build();
    }

    /**
     * Checks if this message is from the user.
     */
    @JsonIgnore
    public boolean isUserMessage() {
        return role == MessageRole.USER;
    }

    /**
     * Checks if this message is from the assistant.
     */
    @JsonIgnore
    public boolean isAssistantMessage() {
        return role == MessageRole.ASSISTANT;
    }

    /**
     * Copies a message list into an unmodifiable list, dropping null entries.
     */
    public static List<Message> copyOf(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        return messages.stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
