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
 * Serializable copy of a history store's state. The persistence layer may
 * write it as JSON and hand it back to
 * {@link me.golemcore.quill.domain.service.HistoryStoreFactory#restore}.
 */
@Builder
public record HistorySnapshot(int maxTokens, List<Message> committed, List<Message> proposal,
        boolean hasPendingProposal) {
}
