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

import lombok.Builder;

import java.util.List;

/**
 * Outcome of bounding a message sequence to a token budget.
 *
 * <p>
 * {@code overBudget} is set when the newest message alone exceeds the budget
 * and was kept anyway; callers may surface it as a notice.
 */
@Builder
public record TruncationResult(List<Message> messages, int tokenCount, int droppedCount, boolean overBudget) {

    public static TruncationResult empty() {
        return new TruncationResult(List.of(), 0, 0, false);
    }
}
