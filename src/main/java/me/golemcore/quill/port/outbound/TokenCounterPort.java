package me.golemcore.quill.port.outbound;

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

/**
 * Port for counting tokens of a text the way the target model tokenizes it.
 * Implementations are expected to be deterministic and side-effect free; they
 * may throw on input they cannot encode.
 */
public interface TokenCounterPort {

    /**
     * Returns the number of tokens in {@code text}; {@code 0} for null or empty
     * text.
     */
    int count(String text);
}
