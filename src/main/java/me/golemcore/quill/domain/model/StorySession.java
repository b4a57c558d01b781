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

import lombok.Getter;
import lombok.Setter;
import me.golemcore.quill.domain.service.HistoryStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of the story being written: the validated canon, the pending
 * proposal text ("blue text") with its reasoning, and the conversation memory
 * backing model calls. The history store instance lives as long as the
 * session; new and loaded stories reset it in place.
 */
@Getter
public class StorySession {

    private final HistoryStore history;
    private final List<String> canon = new ArrayList<>();

    @Setter
    private String proposalNarrative = "";

    @Setter
    private String thinking = "";

    @Setter
    private String fileName;

    public StorySession(HistoryStore history) {
        this.history = history;
    }

    public boolean hasProposal() {
        return proposalNarrative != null && !proposalNarrative.isEmpty();
    }

    public void clearProposal() {
        proposalNarrative = "";
        thinking = "";
    }
}
